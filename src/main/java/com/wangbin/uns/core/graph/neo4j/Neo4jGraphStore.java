package com.wangbin.uns.core.graph.neo4j;

import com.wangbin.uns.common.constant.UnsConstant;
import com.wangbin.uns.core.graph.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.TransactionContext;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Cypher MERGE 的节点合并，在一个写事务内执行。
 */
@Slf4j
class Neo4jGraphStore implements GraphStore {

    private static final String MERGE_ROOT =
            "MERGE (node:%s {%s: $nodeName}) "
                    + "ON CREATE SET node.%s = $timestamp "
                    + "ON MATCH SET node.%s = $timestamp "
                    + "SET node += $attributes "
                    + "RETURN elementId(node) AS id";

    private static final String MERGE_CHILD =
            "MATCH (parent) WHERE elementId(parent) = $parentId "
                    + "MERGE (parent)-[:%s]->(node:%s {%s: $nodeName}) "
                    + "ON CREATE SET node.%s = $timestamp "
                    + "ON MATCH SET node.%s = $timestamp "
                    + "SET node += $attributes "
                    + "RETURN elementId(node) AS id";

    private final TransactionContext tx;

    Neo4jGraphStore(TransactionContext tx) {
        this.tx = tx;
    }

    @Override
    public String mergeNode(String parentId, String name, String typeLabel, Map<String, Object> attributes,
                            long timestamp) {
        String label = escapeLabel(typeLabel);
        String query = parentId == null
                ? String.format(MERGE_ROOT, label, UnsConstant.NODE_NAME_KEY,
                UnsConstant.CREATED_TIMESTAMP_KEY, UnsConstant.MODIFIED_TIMESTAMP_KEY)
                : String.format(MERGE_CHILD, UnsConstant.NODE_RELATION_NAME, label, UnsConstant.NODE_NAME_KEY,
                UnsConstant.CREATED_TIMESTAMP_KEY, UnsConstant.MODIFIED_TIMESTAMP_KEY);
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("parentId", parentId);
        parameters.put("nodeName", name);
        parameters.put("timestamp", timestamp);
        parameters.put("attributes", toProperties(attributes));
        log.debug("合并节点 {}:{} (parent={})", typeLabel, name, parentId);
        return tx.run(query, parameters).single().get("id").asString();
    }

    static String escapeLabel(String label) {
        return "`" + label.replace("`", "``") + "`";
    }

    /**
     * 属性值转换为 Neo4j 支持的类型
     */
    static Map<String, Object> toProperties(Map<String, Object> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes == null) {
            return result;
        }
        attributes.forEach((key, value) -> result.put(key, toPropertyValue(value)));
        return result;
    }

    private static Object toPropertyValue(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger integer) {
            return integer.bitLength() < 64 ? (Object) integer.longValue() : integer.toString();
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Neo4jGraphStore::toPropertyValue).toList();
        }
        return value;
    }
}
