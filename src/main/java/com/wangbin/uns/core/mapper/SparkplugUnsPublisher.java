package com.wangbin.uns.core.mapper;

import com.wangbin.uns.common.constant.SparkplugConstant;
import com.wangbin.uns.common.utils.JsonUtil;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.mqtt.MqttClientAdapter;
import com.wangbin.uns.core.sparkplug.codec.SparkplugPayloadCodec;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.SparkplugMessageType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.SparkplugTopic;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparkplug B 消息转换为 UNS JSON 并重新发布。
 * <p>
 * spBv1.0/&lt;group&gt;/&lt;msgType&gt;/&lt;edgeNode&gt;[/&lt;device&gt;] 映射到
 * [&lt;prefix&gt;/]&lt;group&gt;/&lt;edgeNode&gt;[/&lt;device&gt;]，只转发 NBIRTH、DBIRTH、NDATA、DDATA。
 */
@Slf4j
public class SparkplugUnsPublisher {

    private final MqttClientAdapter client;
    private final UnsProperties.SparkplugConfig config;
    private final String timestampAttribute;

    public SparkplugUnsPublisher(MqttClientAdapter client, UnsProperties.SparkplugConfig config,
                                 String timestampAttribute) {
        this.client = client;
        this.config = config;
        this.timestampAttribute = timestampAttribute;
    }

    /**
     * 解码并转发一条 Sparkplug 消息
     *
     * @return 发布成功的 UNS 消息数量
     * @throws com.wangbin.uns.common.exception.TopicFormatException     topic 层级或命名空间不合法
     * @throws com.wangbin.uns.common.exception.SparkplugDecodeException 载荷无法解码
     */
    public int transformAndPublish(String topic, byte[] payload) {
        SparkplugTopic sparkplugTopic = SparkplugTopic.parse(topic);
        SparkplugMessageType type = sparkplugTopic.messageType();
        if (!type.isBirth() && !type.isData()) {
            log.debug("忽略 Sparkplug 消息类型 {}: {}", sparkplugTopic.rawMessageType(), topic);
            return 0;
        }
        Map<String, Map<String, Object>> documents = transform(sparkplugTopic, SparkplugPayloadCodec.decode(payload));
        int published = 0;
        for (Map.Entry<String, Map<String, Object>> entry : documents.entrySet()) {
            try {
                client.publish(entry.getKey(), JsonUtil.toJsonBytes(entry.getValue()),
                        config.getPublishQos(), config.isRetained());
                published++;
            } catch (Exception e) {
                log.error("发布 UNS 消息失败: topic={}, source={}", entry.getKey(), topic, e);
            }
        }
        log.debug("Sparkplug 消息 {} 转发为 {} 条 UNS 消息", topic, published);
        return published;
    }

    /**
     * 按指标名称生成 UNS topic -&gt; JSON 文档。历史值和没有名称的指标不转发。
     */
    public Map<String, Map<String, Object>> transform(SparkplugTopic topic, SparkplugPayload payload) {
        String baseTopic = baseTopic(topic);
        Map<String, Map<String, Object>> documents = new LinkedHashMap<>();
        Map<String, Long> timestamps = new LinkedHashMap<>();
        for (Metric metric : payload.getMetrics()) {
            if (metric.isHistorical()) {
                log.debug("跳过历史指标 {}", metric.getName());
                continue;
            }
            if (metric.getName() == null || metric.getName().isBlank()) {
                log.debug("跳过没有名称的指标, alias={}", metric.getAlias());
                continue;
            }
            String unsTopic = baseTopic;
            String key = metric.getName();
            if (config.getMetricNameMode() == MetricNameMode.SUB_TOPIC) {
                int split = key.lastIndexOf(SparkplugConstant.TOPIC_SEPARATOR);
                if (split > 0 && split < key.length() - 1) {
                    unsTopic = baseTopic + SparkplugConstant.TOPIC_SEPARATOR + key.substring(0, split);
                    key = key.substring(split + 1);
                }
            }
            documents.computeIfAbsent(unsTopic, t -> new LinkedHashMap<>())
                    .put(key, SparkplugDocumentBuilder.render(metric.getValue()));
            Long timestamp = metric.getTimestamp() != null ? metric.getTimestamp() : payload.getTimestamp();
            if (timestamp != null) {
                timestamps.merge(unsTopic, timestamp, Math::max);
            }
        }
        timestamps.forEach((unsTopic, timestamp) -> documents.get(unsTopic).put(timestampAttribute, timestamp));
        return documents;
    }

    String baseTopic(SparkplugTopic topic) {
        StringBuilder builder = new StringBuilder();
        if (config.getUnsPrefix() != null && !config.getUnsPrefix().isBlank()) {
            builder.append(stripSeparators(config.getUnsPrefix())).append(SparkplugConstant.TOPIC_SEPARATOR);
        }
        builder.append(topic.groupId()).append(SparkplugConstant.TOPIC_SEPARATOR).append(topic.edgeNodeId());
        if (topic.hasDevice()) {
            builder.append(SparkplugConstant.TOPIC_SEPARATOR).append(topic.deviceId());
        }
        return builder.toString();
    }

    private static String stripSeparators(String prefix) {
        String result = prefix.trim();
        while (result.endsWith(SparkplugConstant.TOPIC_SEPARATOR)) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
