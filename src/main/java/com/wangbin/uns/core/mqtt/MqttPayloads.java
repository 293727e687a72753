package com.wangbin.uns.core.mqtt;

import com.wangbin.uns.common.exception.PayloadFormatException;
import com.wangbin.uns.common.utils.JsonUtil;
import com.wangbin.uns.core.mapper.SparkplugDocumentBuilder;
import com.wangbin.uns.core.sparkplug.codec.SparkplugPayloadCodec;
import com.wangbin.uns.core.sparkplug.model.SparkplugTopic;
import org.eclipse.paho.client.mqttv3.MqttTopic;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 消息载荷转换为属性 Map：Sparkplug topic 按 protobuf 解码，其它 topic 按 JSON 解析。
 */
public final class MqttPayloads {

    private static final String PATH_SEPARATOR = "\\.";

    private MqttPayloads() {
    }

    /**
     * @param ignoredAttributes topic 过滤器 -&gt; 需要去掉的属性
     * @throws com.wangbin.uns.common.exception.SparkplugDecodeException Sparkplug 载荷无法解码
     * @throws PayloadFormatException                                   UNS 载荷不是 JSON 对象
     */
    public static Map<String, Object> toAttributeMap(String topic, byte[] payload,
                                                     Map<String, List<String>> ignoredAttributes) {
        Map<String, Object> attributes;
        if (SparkplugTopic.isSparkplugTopic(topic)) {
            attributes = SparkplugDocumentBuilder.toMessageMap(SparkplugPayloadCodec.decode(payload));
        } else {
            String text = new String(payload, StandardCharsets.UTF_8);
            Map<String, Object> parsed = JsonUtil.isJsonObject(text) ? JsonUtil.parseMap(text) : null;
            if (parsed == null) {
                throw PayloadFormatException.notJsonObject(topic, payload.length);
            }
            attributes = new LinkedHashMap<>(parsed);
        }
        if (ignoredAttributes != null) {
            ignoredAttributes.forEach((filter, keys) -> {
                if (MqttTopic.isMatched(filter, topic)) {
                    keys.forEach(key -> removePath(attributes, key.split(PATH_SEPARATOR)));
                }
            });
        }
        return attributes;
    }

    @SuppressWarnings("unchecked")
    private static void removePath(Map<String, Object> attributes, String[] path) {
        Map<String, Object> current = attributes;
        for (int i = 0; i < path.length - 1; i++) {
            Object next = current.get(path[i]);
            if (!(next instanceof Map)) {
                return;
            }
            current = (Map<String, Object>) next;
        }
        current.remove(path[path.length - 1]);
    }

    /**
     * 从属性中读取时间戳，缺失或不是数字时使用 defaultTimestamp
     */
    public static long timestampOf(Map<String, Object> attributes, String timestampAttribute, long defaultTimestamp) {
        Object value = attributes.get(timestampAttribute);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultTimestamp;
            }
        }
        return defaultTimestamp;
    }
}
