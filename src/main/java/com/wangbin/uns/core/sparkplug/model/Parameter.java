package com.wangbin.uns.core.sparkplug.model;

/**
 * 模板参数
 */
public record Parameter(String name, TypedValue value) {

    public Parameter {
        value.dataType().requireAllowedIn(SparkplugDataType.Context.TEMPLATE_PARAMETER);
    }

    public static Parameter of(String name, SparkplugDataType dataType, Object value) {
        return new Parameter(name, value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value));
    }
}
