package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.exception.GraphStoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 内存图存储，用于测试和本地运行。
 * <p>
 * executeWrite 失败时恢复到事务开始前的快照。
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore, GraphDatabase {

    private record NodeKey(String parentId, String name, String typeLabel) {
    }

    private Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private Map<NodeKey, String> index = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized void executeWrite(Consumer<GraphStore> work) {
        Map<String, GraphNode> nodeSnapshot = new LinkedHashMap<>();
        nodes.forEach((id, node) -> nodeSnapshot.put(id, node.copy()));
        Map<NodeKey, String> indexSnapshot = new LinkedHashMap<>(index);
        long idSnapshot = nextId;
        try {
            work.accept(this);
        } catch (RuntimeException e) {
            nodes = nodeSnapshot;
            index = indexSnapshot;
            nextId = idSnapshot;
            log.debug("内存图事务回滚: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public synchronized String mergeNode(String parentId, String name, String typeLabel,
                                         Map<String, Object> attributes, long timestamp) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(typeLabel, "typeLabel");
        if (parentId != null && !nodes.containsKey(parentId)) {
            throw GraphStoreException.fatal("Parent node " + parentId + " does not exist", null);
        }
        NodeKey key = new NodeKey(parentId, name, typeLabel);
        String existingId = index.get(key);
        if (existingId != null) {
            nodes.get(existingId).merge(attributes, timestamp);
            return existingId;
        }
        String id = String.valueOf(nextId++);
        GraphNode node = new GraphNode(id, name, typeLabel, parentId, timestamp);
        node.putAttributes(attributes);
        nodes.put(id, node);
        index.put(key, id);
        return id;
    }

    public synchronized Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public synchronized Optional<GraphNode> findNode(String parentId, String name, String typeLabel) {
        return Optional.ofNullable(index.get(new NodeKey(parentId, name, typeLabel))).map(nodes::get);
    }

    public synchronized List<GraphNode> findByLabel(String typeLabel) {
        return nodes.values().stream().filter(node -> node.getTypeLabel().equals(typeLabel)).toList();
    }

    public synchronized List<GraphNode> children(String parentId) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (Objects.equals(parentId, node.getParentId())) {
                result.add(node);
            }
        }
        return result;
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    /**
     * 父子关系数量，每个非顶层节点对应一条
     */
    public synchronized int relationshipCount() {
        return (int) nodes.values().stream().filter(node -> node.getParentId() != null).count();
    }
}
