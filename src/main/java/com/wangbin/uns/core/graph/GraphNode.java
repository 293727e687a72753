package com.wangbin.uns.core.graph;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内存图中的节点
 */
@Getter
public class GraphNode {

    private final String id;
    private final String name;
    private final String typeLabel;
    private final String parentId;
    private final long createdTimestamp;
    private Long modifiedTimestamp;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public GraphNode(String id, String name, String typeLabel, String parentId, long createdTimestamp) {
        this.id = id;
        this.name = name;
        this.typeLabel = typeLabel;
        this.parentId = parentId;
        this.createdTimestamp = createdTimestamp;
    }

    GraphNode copy() {
        GraphNode copy = new GraphNode(id, name, typeLabel, parentId, createdTimestamp);
        copy.modifiedTimestamp = modifiedTimestamp;
        copy.attributes.putAll(attributes);
        return copy;
    }

    void putAttributes(Map<String, Object> values) {
        if (values != null) {
            attributes.putAll(values);
        }
    }

    void merge(Map<String, Object> values, long timestamp) {
        this.modifiedTimestamp = timestamp;
        putAttributes(values);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    @Override
    public String toString() {
        return typeLabel + "(" + name + ")#" + id;
    }
}
