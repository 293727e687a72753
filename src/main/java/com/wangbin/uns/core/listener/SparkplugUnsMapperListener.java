package com.wangbin.uns.core.listener;

import com.wangbin.uns.common.exception.BusinessException;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.mapper.SparkplugUnsPublisher;
import com.wangbin.uns.core.mqtt.MqttClientAdapter;
import com.wangbin.uns.core.mqtt.MqttClientFactory;
import com.wangbin.uns.core.mqtt.MqttConnectionConfig;
import com.wangbin.uns.core.mqtt.MqttMessageEnvelope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 订阅 Sparkplug B 命名空间，转换后发布到 UNS
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "uns.sparkplug", name = "enabled", havingValue = "true")
public class SparkplugUnsMapperListener {

    private static final String CLIENT_ID_PREFIX = "uns_sparkplugb_listener";

    private final UnsProperties properties;
    private MqttClientAdapter client;
    private SparkplugUnsPublisher publisher;

    @Autowired
    public SparkplugUnsMapperListener(UnsProperties properties) {
        this.properties = properties;
    }

    SparkplugUnsMapperListener(UnsProperties properties, SparkplugUnsPublisher publisher) {
        this.properties = properties;
        this.publisher = publisher;
    }

    @PostConstruct
    public void start() throws Exception {
        UnsProperties.MqttConfig mqtt = properties.getMqtt();
        client = MqttClientFactory.create(MqttConnectionConfig.from(mqtt, CLIENT_ID_PREFIX), this::onMessage);
        publisher = new SparkplugUnsPublisher(client, properties.getSparkplug(), mqtt.getTimestampAttribute());
        client.connect();
        client.subscribe(properties.getSparkplug().getTopic(), mqtt.getQos());
        log.info("Sparkplug 转 UNS 监听器启动完成, topic={}", properties.getSparkplug().getTopic());
    }

    @PreDestroy
    public void stop() {
        if (client != null) {
            try {
                client.close();
            } catch (Exception e) {
                log.warn("关闭 MQTT 客户端失败: {}", e.getMessage());
            }
        }
        log.info("Sparkplug 转 UNS 监听器已停止");
    }

    void onMessage(String topic, MqttMessageEnvelope envelope) {
        try {
            publisher.transformAndPublish(topic, envelope.getPayload());
        } catch (BusinessException e) {
            // topic 格式错误或载荷无法解码，直接丢弃
            log.error("Sparkplug 消息处理失败, 已丢弃: topic={}, payload={} bytes, error={}",
                    topic, envelope.getPayloadLength(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sparkplug 消息处理异常, 已丢弃: topic={}, payload={} bytes",
                    topic, envelope.getPayloadLength(), e);
        }
    }
}
