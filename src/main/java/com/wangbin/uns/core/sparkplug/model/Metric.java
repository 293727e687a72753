package com.wangbin.uns.core.sparkplug.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Sparkplug 指标。值与数据类型组成一个带标签的联合体，is_null 时值为显式空。
 */
@Value
@Builder(toBuilder = true)
public class Metric {
    String name;
    Long alias;
    Long timestamp;
    TypedValue value;
    boolean historical;
    boolean transientValue;
    MetaData metadata;
    PropertySet properties;

    public SparkplugDataType getDataType() {
        return value.dataType();
    }

    public boolean isNull() {
        return value.isNull();
    }

    public Optional<Object> getLogicalValue() {
        return value.asOptional();
    }

    public static Metric of(String name, SparkplugDataType dataType, Object value, long timestamp) {
        return Metric.builder()
                .name(name)
                .timestamp(timestamp)
                .value(value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value))
                .build();
    }
}
