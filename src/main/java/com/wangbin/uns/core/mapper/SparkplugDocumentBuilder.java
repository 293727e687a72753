package com.wangbin.uns.core.mapper;

import com.wangbin.uns.core.sparkplug.model.DataSet;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.Parameter;
import com.wangbin.uns.core.sparkplug.model.PropertySet;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.Template;
import com.wangbin.uns.core.sparkplug.model.TypedValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparkplug 逻辑值转换为可以序列化为 JSON 的普通对象。
 * <ul>
 *     <li>DataSet -&gt; 以列名为键的行列表</li>
 *     <li>Template -&gt; 成员指标名到值的 Map，参数放在 parameters 下</li>
 *     <li>PropertySet -&gt; Map，PropertySetList -&gt; List&lt;Map&gt;</li>
 *     <li>Bytes / File -&gt; Base64 字符串，DateTime -&gt; 毫秒时间戳</li>
 * </ul>
 */
public final class SparkplugDocumentBuilder {

    public static final String TEMPLATE_PARAMETERS_KEY = "parameters";

    private SparkplugDocumentBuilder() {
    }

    public static Object render(TypedValue value) {
        return value == null ? null : renderPlain(value.value());
    }

    public static Object renderPlain(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof DataSet dataSet) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Map<String, Object> row : dataSet.toRowMaps()) {
                rows.add(renderMap(row));
            }
            return rows;
        }
        if (value instanceof Template template) {
            return renderTemplate(template);
        }
        if (value instanceof PropertySet propertySet) {
            return renderMap(propertySet.toMap());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, item) -> result.put(String.valueOf(key), renderPlain(item)));
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(renderPlain(item));
            }
            return result;
        }
        return value;
    }

    private static Map<String, Object> renderMap(Map<String, Object> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, item) -> result.put(key, renderPlain(item)));
        return result;
    }

    private static Map<String, Object> renderTemplate(Template template) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Metric metric : template.metrics()) {
            if (metric.getName() != null) {
                result.put(metric.getName(), render(metric.getValue()));
            }
        }
        if (!template.parameters().isEmpty()) {
            Map<String, Object> parameters = new LinkedHashMap<>();
            for (Parameter parameter : template.parameters()) {
                parameters.put(parameter.name(), render(parameter.value()));
            }
            result.put(TEMPLATE_PARAMETERS_KEY, parameters);
        }
        return result;
    }

    /**
     * 整个载荷转换为嵌套 Map，metrics 为指标列表，每个指标以 name 命名
     */
    public static Map<String, Object> toMessageMap(SparkplugPayload payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        if (payload.getTimestamp() != null) {
            message.put("timestamp", payload.getTimestamp());
        }
        if (payload.getSeq() != null) {
            message.put("seq", payload.getSeq());
        }
        if (payload.getUuid() != null) {
            message.put("uuid", payload.getUuid());
        }
        List<Map<String, Object>> metrics = new ArrayList<>();
        for (Metric metric : payload.getMetrics()) {
            metrics.add(toMetricMap(metric));
        }
        if (!metrics.isEmpty()) {
            message.put("metrics", metrics);
        }
        return message;
    }

    private static Map<String, Object> toMetricMap(Metric metric) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (metric.getName() != null) {
            result.put("name", metric.getName());
        }
        if (metric.getAlias() != null) {
            result.put("alias", metric.getAlias());
        }
        if (metric.getTimestamp() != null) {
            result.put("timestamp", metric.getTimestamp());
        }
        result.put("datatype", metric.getDataType().name());
        if (metric.isHistorical()) {
            result.put("is_historical", true);
        }
        if (metric.isTransientValue()) {
            result.put("is_transient", true);
        }
        if (metric.isNull()) {
            result.put("is_null", true);
        }
        result.put("value", render(metric.getValue()));
        if (metric.getProperties() != null && !metric.getProperties().isEmpty()) {
            result.put("properties", renderPlain(metric.getProperties()));
        }
        return result;
    }
}
