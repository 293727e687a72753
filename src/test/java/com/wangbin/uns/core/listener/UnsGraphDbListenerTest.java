package com.wangbin.uns.core.listener;

import com.wangbin.uns.common.exception.GraphStoreException;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.graph.GraphDbHandler;
import com.wangbin.uns.core.graph.GraphNode;
import com.wangbin.uns.core.graph.InMemoryGraphStore;
import com.wangbin.uns.core.mqtt.MqttMessageEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UnsGraphDbListenerTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final AtomicInteger shutdowns = new AtomicInteger();
    private UnsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new UnsProperties();
        properties.getGraphdb().setRetryInterval(0);
        properties.getGraphdb().setMaxRetry(1);
    }

    private UnsGraphDbListener listener(GraphDbHandler handler) {
        UnsGraphDbListener listener = new UnsGraphDbListener(properties, handler, null);
        listener.setShutdownAction(shutdowns::incrementAndGet);
        return listener;
    }

    private static MqttMessageEnvelope envelope(byte[] payload) {
        return new MqttMessageEnvelope(payload, 1, false, null);
    }

    private static MqttMessageEnvelope json(String text) {
        return envelope(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void undecodableMessagesAreDroppedAndLaterMessagesPersisted() {
        UnsGraphDbListener listener = listener(new GraphDbHandler(store, properties.getGraphdb()));

        listener.onMessage("a/b", json("not json"));
        listener.onMessage("spBv1.0/G/NDATA/E", envelope(new byte[]{(byte) 0xFF, 0x01, 0x02}));
        assertEquals(0, store.nodeCount());

        listener.onMessage("a/b", json("{\"x\":1}"));

        assertEquals(2, store.nodeCount());
        GraphNode leaf = store.findNode(store.findNode(null, "a", "ENTERPRISE").orElseThrow().getId(),
                "b", "FACILITY").orElseThrow();
        assertEquals(1, leaf.getAttribute("x"));
        assertEquals(0, shutdowns.get());
    }

    @Test
    void timestampAttributeIsUsedForNodeTimestamps() {
        UnsGraphDbListener listener = listener(new GraphDbHandler(store, properties.getGraphdb()));

        listener.onMessage("a", json("{\"x\":1,\"timestamp\":500}"));

        assertEquals(500L, store.findNode(null, "a", "ENTERPRISE").orElseThrow().getCreatedTimestamp());
    }

    @Test
    void ignoredAttributesAreNotPersisted() {
        properties.getMqtt().getIgnoredAttributes().put("a/#", List.of("secret"));
        UnsGraphDbListener listener = listener(new GraphDbHandler(store, properties.getGraphdb()));

        listener.onMessage("a", json("{\"x\":1,\"secret\":\"s\"}"));

        assertEquals(Map.of("x", 1), store.findNode(null, "a", "ENTERPRISE").orElseThrow().getAttributes());
    }

    @Test
    void exhaustedRetriesStopTheApplication() {
        GraphDbHandler handler = new GraphDbHandler(work -> {
            throw GraphStoreException.transientError("service unavailable", null);
        }, properties.getGraphdb());
        UnsGraphDbListener listener = listener(handler);

        listener.onMessage("a/b", json("{\"x\":1}"));

        assertEquals(1, shutdowns.get());
    }

    @Test
    void nonTransientStoreErrorDropsMessageOnly() {
        GraphDbHandler handler = new GraphDbHandler(work -> {
            throw GraphStoreException.fatal("syntax error", null);
        }, properties.getGraphdb());
        UnsGraphDbListener listener = listener(handler);

        listener.onMessage("a/b", json("{\"x\":1}"));

        assertEquals(0, shutdowns.get());
    }
}
