package com.wangbin.uns.core.graph;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeFlattenerTest {

    @Test
    void flatMapIsUnchanged() {
        assertEquals(Map.of("a", "value1", "b", "value2"),
                AttributeFlattener.flatten(Map.of("a", "value1", "b", "value2")));
    }

    @Test
    void nodeNameIsUpperCased() {
        assertEquals(Map.of("a", "value1", "NODE_NAME", "toUpper(*)"),
                AttributeFlattener.flatten(Map.of("a", "value1", "node_name", "toUpper(*)")));
    }

    @Test
    void nestedMapsAndListsAreJoinedWithUnderscore() {
        Map<String, Object> l2 = new LinkedHashMap<>();
        l2.put("l3k1", "va1");
        l2.put("l3k2", List.of(10, 12));
        l2.put("l3k3", 3.141);
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("a", "value1");
        message.put("l1", Map.of("l2", l2, "l2kb", 100));

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("a", "value1");
        expected.put("l1_l2_l3k1", "va1");
        expected.put("l1_l2_l3k2_0", 10);
        expected.put("l1_l2_l3k2_1", 12);
        expected.put("l1_l2_l3k3", 3.141);
        expected.put("l1_l2kb", 100);
        assertEquals(expected, AttributeFlattener.flatten(message));
    }

    @Test
    void nullAndEmptyFlattenToEmpty() {
        assertTrue(AttributeFlattener.flatten(null).isEmpty());
        assertTrue(AttributeFlattener.flatten(Map.of()).isEmpty());
    }
}
