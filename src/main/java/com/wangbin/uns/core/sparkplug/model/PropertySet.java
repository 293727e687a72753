package com.wangbin.uns.core.sparkplug.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 键值属性集合，保持键的顺序。值可以继续嵌套属性集合，深度不限。
 */
public record PropertySet(Map<String, PropertyValue> properties) {

    public static final PropertySet EMPTY = new PropertySet(Map.of());

    public PropertySet {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public PropertyValue get(String key) {
        return properties.get(key);
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    /**
     * 转换为普通的嵌套 Map，PropertySet 转为 Map，PropertySetList 转为 List&lt;Map&gt;
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        properties.forEach((key, property) -> result.put(key, toPlainValue(property)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object toPlainValue(PropertyValue property) {
        Object value = property.value().value();
        if (value instanceof PropertySet nested) {
            return nested.toMap();
        }
        if (property.dataType() == SparkplugDataType.PropertySetList && value != null) {
            return ((List<PropertySet>) value).stream().map(PropertySet::toMap).toList();
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, PropertyValue> properties = new LinkedHashMap<>();

        public Builder put(String key, SparkplugDataType dataType, Object value) {
            properties.put(key, PropertyValue.of(dataType, value));
            return this;
        }

        public Builder putPropertySet(String key, PropertySet value) {
            return put(key, SparkplugDataType.PropertySet, value);
        }

        public Builder putPropertySetList(String key, List<PropertySet> value) {
            return put(key, SparkplugDataType.PropertySetList, List.copyOf(value));
        }

        public PropertySet build() {
            return new PropertySet(properties);
        }
    }
}
