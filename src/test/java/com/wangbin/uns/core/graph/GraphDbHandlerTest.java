package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.exception.GraphPersistenceException;
import com.wangbin.uns.common.exception.GraphStoreException;
import com.wangbin.uns.core.config.UnsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class GraphDbHandlerTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private UnsProperties.GraphDbConfig config;

    @BeforeEach
    void setUp() {
        config = new UnsProperties.GraphDbConfig();
        config.setMaxRetry(2);
        config.setRetryInterval(0);
    }

    @Test
    void transientFailuresAreRetried() {
        FlakyDatabase database = new FlakyDatabase(store, 2, true);

        new GraphDbHandler(database, config).persistMessage("ent/fac", Map.of("x", 1), 10L);

        assertEquals(3, database.attempts);
        assertEquals(2, store.nodeCount());
    }

    @Test
    void retryCeilingIsFatal() {
        FlakyDatabase database = new FlakyDatabase(store, Integer.MAX_VALUE, true);
        GraphDbHandler handler = new GraphDbHandler(database, config);

        GraphPersistenceException ex = assertThrows(GraphPersistenceException.class,
                () -> handler.persistMessage("ent/fac", Map.of("x", 1), 10L));

        assertEquals(3, ex.getAttempts());
        assertEquals("ent/fac", ex.getTopic());
        assertEquals(3, database.attempts);
        assertEquals(0, store.nodeCount());
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        FlakyDatabase database = new FlakyDatabase(store, 1, false);
        GraphDbHandler handler = new GraphDbHandler(database, config);

        GraphStoreException ex = assertThrows(GraphStoreException.class,
                () -> handler.persistMessage("ent/fac", Map.of("x", 1), 10L));

        assertFalse(ex.isTransientError());
        assertEquals(1, database.attempts);
    }

    @Test
    void sparkplugTopicsUseSparkplugNodeTypes() {
        new GraphDbHandler(store, config).persistMessage("spBv1.0/G1/NDATA/E1", Map.of("seq", 1), 10L);

        assertEquals(1, store.findByLabel("spBv1_0").size());
        assertEquals(1, store.findByLabel("GROUP").size());
        assertEquals(1, store.findByLabel("MESSAGE_TYPE").size());
        assertEquals(1, store.findByLabel("EDGE_NODE").size());
    }

    @Test
    void flattenModeKeepsEverythingOnLeaf() {
        config.setNestedAttributeMode(NestedAttributeMode.FLATTEN);

        new GraphDbHandler(store, config).persistMessage("ent", Map.of("c", Map.of("k1", "v1")), 10L);

        GraphNode leaf = store.findNode(null, "ent", "ENTERPRISE").orElseThrow();
        assertEquals(Map.of("c_k1", "v1"), leaf.getAttributes());
        assertEquals(1, store.nodeCount());
    }

    /**
     * 前 failures 次写入失败，之后交给内存图
     */
    private static class FlakyDatabase implements GraphDatabase {
        private final InMemoryGraphStore delegate;
        private final int failures;
        private final boolean transientError;
        private int attempts;

        FlakyDatabase(InMemoryGraphStore delegate, int failures, boolean transientError) {
            this.delegate = delegate;
            this.failures = failures;
            this.transientError = transientError;
        }

        @Override
        public void executeWrite(Consumer<GraphStore> work) {
            attempts++;
            if (attempts <= failures) {
                throw transientError
                        ? GraphStoreException.transientError("service unavailable", null)
                        : GraphStoreException.fatal("syntax error", null);
            }
            delegate.executeWrite(work);
        }
    }
}
