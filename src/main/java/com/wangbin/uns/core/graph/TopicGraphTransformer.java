package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.constant.UnsConstant;
import com.wangbin.uns.common.exception.GraphTransformException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将 topic 与消息属性转换为图节点链。
 * <p>
 * topic 每一层对应一个节点，节点类型由层级决定；只有叶子节点保存普通属性，
 * 嵌套对象和对象数组成为叶子节点下的子节点（类型为 compositeLabel），递归处理。
 */
@Slf4j
public class TopicGraphTransformer {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 32;

    private static final String SCALAR_VALUE_KEY = "value";

    private final int maxNestingDepth;

    public TopicGraphTransformer() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public TopicGraphTransformer(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * 层级名称用完后以最后一个名称加 _depth_n 命名，名称列表为空时以 NODE 为基础
     */
    public static String getTopicNodeType(int depth, List<String> levelNames) {
        if (depth < levelNames.size()) {
            return levelNames.get(depth);
        }
        String base = levelNames.isEmpty()
                ? UnsConstant.FALLBACK_NODE_TYPE
                : levelNames.get(levelNames.size() - 1);
        return base + UnsConstant.DEPTH_SUFFIX + (depth - levelNames.size() + 1);
    }

    /**
     * 拆分普通属性与复合属性，不递归。
     * <ul>
     *     <li>Map 为复合属性</li>
     *     <li>只含标量的 List 为普通属性</li>
     *     <li>含有 Map / List 元素的 List 逐项展开为复合属性，键为 属性名_下标，
     *     元素为带 name 字段的 Map 时以 name 的值为键</li>
     * </ul>
     */
    public static AttributeSplit separatePlainCompositeAttributes(Map<String, ?> attributes) {
        Map<String, Object> plain = new LinkedHashMap<>();
        Map<String, Object> composite = new LinkedHashMap<>();
        if (attributes == null) {
            return new AttributeSplit(plain, composite);
        }
        attributes.forEach((key, value) -> {
            if (value instanceof Map) {
                composite.put(key, value);
            } else if (value instanceof List<?> list) {
                Map<String, Object> items = new LinkedHashMap<>();
                boolean onlyScalars = true;
                for (int i = 0; i < list.size(); i++) {
                    Object item = list.get(i);
                    String itemKey = key + "_" + i;
                    if (item instanceof Map || item instanceof List) {
                        if (item instanceof Map<?, ?> map && map.containsKey(UnsConstant.LIST_ITEM_NAME_KEY)) {
                            itemKey = String.valueOf(map.get(UnsConstant.LIST_ITEM_NAME_KEY));
                        }
                        onlyScalars = false;
                    }
                    items.put(itemKey, item);
                }
                if (onlyScalars) {
                    plain.put(key, value);
                } else {
                    composite.putAll(items);
                }
            } else {
                plain.put(key, value);
            }
        });
        return new AttributeSplit(plain, composite);
    }

    /**
     * 转换并写入一条消息
     *
     * @return 叶子节点 id
     */
    public String transform(GraphStore store, String topic, Map<String, ?> attributes, List<String> levelNames,
                            String compositeLabel, long timestamp) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
        String[] segments = topic.split("/", -1);
        AttributeSplit split = separatePlainCompositeAttributes(attributes);
        String nodeId = null;
        for (int depth = 0; depth < segments.length; depth++) {
            boolean leaf = depth == segments.length - 1;
            String nodeType = getTopicNodeType(depth, levelNames);
            log.debug("处理 topic {} 的第 {} 层: {} ({})", topic, depth, segments[depth], nodeType);
            nodeId = store.mergeNode(nodeId, segments[depth], nodeType,
                    leaf ? renameReserved(split.plain()) : null, timestamp);
        }
        saveCompositeAttributes(store, topic, nodeId, split.composite(), compositeLabel, timestamp, 1);
        return nodeId;
    }

    private void saveCompositeAttributes(GraphStore store, String topic, String parentId,
                                         Map<String, Object> composite, String compositeLabel,
                                         long timestamp, int depth) {
        if (composite.isEmpty()) {
            return;
        }
        if (depth > maxNestingDepth) {
            throw GraphTransformException.nestingTooDeep(topic, maxNestingDepth);
        }
        for (Map.Entry<String, Object> entry : composite.entrySet()) {
            AttributeSplit child = splitValue(entry.getKey(), entry.getValue());
            String childId = store.mergeNode(parentId, entry.getKey(), compositeLabel,
                    renameReserved(child.plain()), timestamp);
            saveCompositeAttributes(store, topic, childId, child.composite(), compositeLabel, timestamp, depth + 1);
        }
    }

    @SuppressWarnings("unchecked")
    private static AttributeSplit splitValue(String key, Object value) {
        if (value instanceof Map<?, ?> map) {
            return separatePlainCompositeAttributes((Map<String, ?>) map);
        }
        if (value instanceof List) {
            // 嵌套数组以自身的键继续展开
            return separatePlainCompositeAttributes(Collections.singletonMap(key, value));
        }
        // 混合数组中的标量元素
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put(SCALAR_VALUE_KEY, value);
        return new AttributeSplit(plain, new LinkedHashMap<>());
    }

    /**
     * node_name 是节点标识属性，消息中的同名属性改名为 NODE_NAME
     */
    static Map<String, Object> renameReserved(Map<String, Object> attributes) {
        if (!attributes.containsKey(UnsConstant.NODE_NAME_KEY)) {
            return attributes;
        }
        Map<String, Object> renamed = new LinkedHashMap<>();
        attributes.forEach((key, value) -> renamed.put(
                UnsConstant.NODE_NAME_KEY.equals(key) ? UnsConstant.NODE_NAME_ATTRIBUTE_ALIAS : key, value));
        return renamed;
    }
}
