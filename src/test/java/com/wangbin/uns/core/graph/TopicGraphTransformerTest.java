package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.constant.UnsConstant;
import com.wangbin.uns.common.exception.GraphTransformException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopicGraphTransformerTest {

    private static final List<String> UNS_TYPES = UnsConstant.DEFAULT_UNS_NODE_TYPES;
    private static final String NESTED = UnsConstant.DEFAULT_NESTED_ATTRIBUTE_NODE_TYPE;

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final TopicGraphTransformer transformer = new TopicGraphTransformer();

    @Test
    void nodeTypeFollowsDepth() {
        assertEquals("ENTERPRISE", TopicGraphTransformer.getTopicNodeType(0, UNS_TYPES));
        assertEquals("DEVICE", TopicGraphTransformer.getTopicNodeType(4, UNS_TYPES));
        assertEquals("DEVICE_depth_1", TopicGraphTransformer.getTopicNodeType(5, UNS_TYPES));
        assertEquals("DEVICE_depth_5", TopicGraphTransformer.getTopicNodeType(9, UNS_TYPES));
        assertEquals("NODE_depth_1", TopicGraphTransformer.getTopicNodeType(0, List.of()));
    }

    @Test
    void plainAndCompositeAttributesAreSeparated() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("a", "value1");
        message.put("b", List.of(10, 23));
        message.put("c", Map.of("k1", "v1", "k2", 100));

        AttributeSplit split = TopicGraphTransformer.separatePlainCompositeAttributes(message);

        assertEquals(Map.of("a", "value1", "b", List.of(10, 23)), split.plain());
        assertEquals(Map.of("c", Map.of("k1", "v1", "k2", 100)), split.composite());
    }

    @Test
    void listItemsWithNameAreKeyedByName() {
        Map<String, Object> message = Map.of("c", List.of(
                Map.of("name", "v1", "k2", 100),
                Map.of("name", "v2", "k2", 200)));

        AttributeSplit split = TopicGraphTransformer.separatePlainCompositeAttributes(message);

        assertTrue(split.plain().isEmpty());
        assertEquals(List.of("v1", "v2"), List.copyOf(split.composite().keySet()));
    }

    @Test
    void nullAttributesSplitIntoNothing() {
        AttributeSplit split = TopicGraphTransformer.separatePlainCompositeAttributes(null);

        assertTrue(split.plain().isEmpty());
        assertFalse(split.hasComposite());
    }

    @Test
    void everyTopicLevelBecomesANode() {
        String leafId = transformer.transform(store, "a/b/c", Map.of("x", 1), UNS_TYPES, NESTED, 100L);

        assertEquals(3, store.nodeCount());
        assertEquals(2, store.relationshipCount());
        GraphNode a = store.findNode(null, "a", "ENTERPRISE").orElseThrow();
        GraphNode b = store.findNode(a.getId(), "b", "FACILITY").orElseThrow();
        GraphNode c = store.findNode(b.getId(), "c", "AREA").orElseThrow();
        assertEquals(leafId, c.getId());
        assertEquals(Map.of("x", 1), c.getAttributes());
        assertTrue(a.getAttributes().isEmpty());
        assertTrue(b.getAttributes().isEmpty());
    }

    @Test
    void compositeAttributeBecomesChildNode() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("a", "value1");
        message.put("c", Map.of("k1", "v1", "k2", 100));

        String leafId = transformer.transform(store, "ent/fac", message, UNS_TYPES, NESTED, 100L);

        GraphNode child = store.findNode(leafId, "c", NESTED).orElseThrow();
        assertEquals(Map.of("k1", "v1", "k2", 100), child.getAttributes());
        assertEquals(Map.of("a", "value1"), store.getNode(leafId).orElseThrow().getAttributes());
    }

    @Test
    void namedListItemsBecomeNamedChildren() {
        Map<String, Object> message = Map.of("c", List.of(
                Map.of("name", "v1", "k2", 100),
                Map.of("name", "v2", "k2", 200)));

        String leafId = transformer.transform(store, "ent", message, UNS_TYPES, NESTED, 100L);

        assertEquals(100, store.findNode(leafId, "v1", NESTED).orElseThrow().getAttribute("k2"));
        assertEquals(200, store.findNode(leafId, "v2", NESTED).orElseThrow().getAttribute("k2"));
    }

    @Test
    void scalarInMixedListGetsValueAttribute() {
        Map<String, Object> message = Map.of("m", List.of(7, Map.of("k", "v")));

        String leafId = transformer.transform(store, "ent", message, UNS_TYPES, NESTED, 100L);

        assertEquals(Map.of("value", 7), store.findNode(leafId, "m_0", NESTED).orElseThrow().getAttributes());
        assertEquals(Map.of("k", "v"), store.findNode(leafId, "m_1", NESTED).orElseThrow().getAttributes());
    }

    @Test
    void nestedCompositesRecurse() {
        Map<String, Object> message = Map.of("l1", Map.of("l2", Map.of("x", 1), "y", 2));

        String leafId = transformer.transform(store, "ent", message, UNS_TYPES, NESTED, 100L);

        GraphNode l1 = store.findNode(leafId, "l1", NESTED).orElseThrow();
        assertEquals(Map.of("y", 2), l1.getAttributes());
        assertEquals(Map.of("x", 1), store.findNode(l1.getId(), "l2", NESTED).orElseThrow().getAttributes());
    }

    @Test
    void repeatedMessageMergesInsteadOfDuplicating() {
        transformer.transform(store, "a/b", Map.of("x", 1), UNS_TYPES, NESTED, 100L);
        String leafId = transformer.transform(store, "a/b", Map.of("y", 2), UNS_TYPES, NESTED, 200L);

        assertEquals(2, store.nodeCount());
        assertEquals(1, store.relationshipCount());
        GraphNode leaf = store.getNode(leafId).orElseThrow();
        assertEquals(Map.of("x", 1, "y", 2), leaf.getAttributes());
        assertEquals(100L, leaf.getCreatedTimestamp());
        assertEquals(200L, leaf.getModifiedTimestamp());
    }

    @Test
    void sameNameUnderDifferentParentsIsDifferentNode() {
        transformer.transform(store, "a/line1", Map.of(), UNS_TYPES, NESTED, 1L);
        transformer.transform(store, "b/line1", Map.of(), UNS_TYPES, NESTED, 1L);

        assertEquals(2, store.findByLabel("FACILITY").size());
    }

    @Test
    void reservedNodeNameAttributeIsRenamed() {
        String leafId = transformer.transform(store, "a", Map.of("node_name", "other"), UNS_TYPES, NESTED, 1L);

        GraphNode leaf = store.getNode(leafId).orElseThrow();
        assertEquals("a", leaf.getName());
        assertEquals("other", leaf.getAttribute(UnsConstant.NODE_NAME_ATTRIBUTE_ALIAS));
        assertNull(leaf.getAttribute(UnsConstant.NODE_NAME_KEY));
    }

    @Test
    void tooDeepNestingIsRejectedAndRolledBack() {
        TopicGraphTransformer shallow = new TopicGraphTransformer(2);
        Map<String, Object> message = Map.of("l1", Map.of("l2", Map.of("l3", Map.of("x", 1))));

        assertThrows(GraphTransformException.class, () -> store.executeWrite(
                graph -> shallow.transform(graph, "a/b", message, UNS_TYPES, NESTED, 1L)));
        assertEquals(0, store.nodeCount());
    }

    @Test
    void blankTopicIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> transformer.transform(store, " ", Map.of(), UNS_TYPES, NESTED, 1L));
        assertEquals(0, store.nodeCount());
    }
}
