package com.wangbin.uns.core.graph;

import java.util.Map;

/**
 * 图存储写入协议，一次调用对应一次节点合并。
 */
public interface GraphStore {

    /**
     * 按 (parentId, name, typeLabel) 创建或合并节点。
     * <p>
     * 节点不存在时创建节点并记录创建时间，存在时更新修改时间并合并属性；
     * parentId 不为空时保证与父节点之间存在且只存在一条 PARENT_OF 关系。
     *
     * @param parentId   父节点 id，为 null 时表示顶层节点
     * @param name       节点名称
     * @param typeLabel  节点类型标签
     * @param attributes 需要合并的属性，可以为空
     * @param timestamp  消息时间戳（毫秒）
     * @return 节点 id
     */
    String mergeNode(String parentId, String name, String typeLabel, Map<String, Object> attributes, long timestamp);
}
