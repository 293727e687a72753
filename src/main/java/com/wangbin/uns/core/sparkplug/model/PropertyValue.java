package com.wangbin.uns.core.sparkplug.model;

/**
 * 属性值，可以嵌套 PropertySet 或 PropertySetList。
 */
public record PropertyValue(TypedValue value) {

    public PropertyValue {
        value.dataType().requireAllowedIn(SparkplugDataType.Context.PROPERTY_VALUE);
    }

    public static PropertyValue of(SparkplugDataType dataType, Object value) {
        return new PropertyValue(value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value));
    }

    public SparkplugDataType dataType() {
        return value.dataType();
    }

    public boolean isNull() {
        return value.isNull();
    }
}
