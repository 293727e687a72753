package com.wangbin.uns.core.graph;

/**
 * 嵌套属性的持久化方式
 */
public enum NestedAttributeMode {
    /**
     * 嵌套对象、对象数组保存为子节点
     */
    NODES,
    /**
     * 展平为叶子节点上以 "_" 连接键名的属性
     */
    FLATTEN
}
