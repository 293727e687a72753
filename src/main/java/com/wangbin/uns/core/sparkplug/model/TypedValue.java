package com.wangbin.uns.core.sparkplug.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 带数据类型标签的逻辑值。value 为 null 即显式的“无值”标记，不会被当作 0 或空串。
 */
public record TypedValue(SparkplugDataType dataType, Object value) {

    public TypedValue {
        Objects.requireNonNull(dataType, "dataType");
        if (value != null && !dataType.getLogicalType().isInstance(value)) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getSimpleName()
                    + " does not match datatype " + dataType + " (expects "
                    + dataType.getLogicalType().getSimpleName() + ")");
        }
    }

    public static TypedValue of(SparkplugDataType dataType, Object value) {
        return new TypedValue(dataType, Objects.requireNonNull(value, "value"));
    }

    public static TypedValue ofNull(SparkplugDataType dataType) {
        return new TypedValue(dataType, null);
    }

    public boolean isNull() {
        return value == null;
    }

    public Optional<Object> asOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TypedValue other
                && dataType == other.dataType
                && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        int valueHash = value instanceof byte[] bytes ? Arrays.hashCode(bytes) : Objects.hashCode(value);
        return 31 * dataType.hashCode() + valueHash;
    }

    @Override
    public String toString() {
        String text = value instanceof byte[] bytes ? "bytes[" + bytes.length + "]" : String.valueOf(value);
        return dataType + ":" + text;
    }
}
