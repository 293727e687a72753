package com.wangbin.uns.core.graph;

import java.util.Map;

/**
 * 属性拆分结果：plain 直接作为节点属性，composite 中每一项成为一个子节点
 */
public record AttributeSplit(Map<String, Object> plain, Map<String, Object> composite) {

    public boolean hasComposite() {
        return !composite.isEmpty();
    }
}
