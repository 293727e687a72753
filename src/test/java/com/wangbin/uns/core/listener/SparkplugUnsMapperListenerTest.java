package com.wangbin.uns.core.listener;

import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.mapper.SparkplugUnsPublisher;
import com.wangbin.uns.core.mqtt.MqttClientAdapter;
import com.wangbin.uns.core.mqtt.MqttMessageEnvelope;
import com.wangbin.uns.core.sparkplug.codec.SparkplugPayloadCodec;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.session.SparkplugPayloadBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SparkplugUnsMapperListenerTest {

    private final List<String> publishedTopics = new ArrayList<>();

    private SparkplugUnsMapperListener listener() {
        UnsProperties properties = new UnsProperties();
        SparkplugUnsPublisher publisher = new SparkplugUnsPublisher(new TopicRecorder(),
                properties.getSparkplug(), "timestamp");
        return new SparkplugUnsMapperListener(properties, publisher);
    }

    private static MqttMessageEnvelope envelope(byte[] payload) {
        return new MqttMessageEnvelope(payload, 1, false, null);
    }

    @Test
    void badMessagesAreDroppedAndLaterMessagesRepublished() {
        SparkplugUnsMapperListener listener = listener();
        byte[] valid = SparkplugPayloadCodec.encode(new SparkplugPayloadBuilder(1000L)
                .addMetric("temperature", SparkplugDataType.Double, 21.5)
                .build());

        listener.onMessage("spBv1.0/G/NDATA/E", envelope(new byte[]{(byte) 0xFF, 0x01, 0x02}));
        listener.onMessage("spBv1.0/G/NDATA", envelope(valid));
        assertTrue(publishedTopics.isEmpty());

        listener.onMessage("spBv1.0/G/NDATA/E", envelope(valid));

        assertEquals(List.of("G/E"), publishedTopics);
    }

    private class TopicRecorder implements MqttClientAdapter {
        @Override
        public void connect() {
        }

        @Override
        public void disconnect() {
        }

        @Override
        public void publish(String topic, byte[] payload, int qos, boolean retained) {
            publishedTopics.add(topic);
        }

        @Override
        public void subscribe(String topic, int qos) {
        }

        @Override
        public void unsubscribe(String topic) {
        }

        @Override
        public boolean isConnected() {
            return true;
        }
    }
}
