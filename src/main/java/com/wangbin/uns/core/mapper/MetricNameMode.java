package com.wangbin.uns.core.mapper;

/**
 * 指标名称映射到 UNS 的方式
 */
public enum MetricNameMode {
    /**
     * 指标名按 "/" 拆分，前面的部分作为子 topic，最后一段作为属性名
     */
    SUB_TOPIC,
    /**
     * 完整指标名作为属性名
     */
    FLAT
}
