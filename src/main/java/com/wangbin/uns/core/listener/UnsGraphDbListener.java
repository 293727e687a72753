package com.wangbin.uns.core.listener;

import com.wangbin.uns.common.exception.BusinessException;
import com.wangbin.uns.common.exception.GraphPersistenceException;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.graph.GraphDbHandler;
import com.wangbin.uns.core.mqtt.MqttClientAdapter;
import com.wangbin.uns.core.mqtt.MqttClientFactory;
import com.wangbin.uns.core.mqtt.MqttConnectionConfig;
import com.wangbin.uns.core.mqtt.MqttMessageEnvelope;
import com.wangbin.uns.core.mqtt.MqttPayloads;
import com.wangbin.uns.core.mqtt.MqttTopicSubscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 订阅 UNS 与 Sparkplug topic，将消息写入图数据库。
 * <p>
 * 解码失败的消息记录后丢弃；重试耗尽的持久化失败视为致命错误，停止应用。
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "uns.graphdb", name = "enabled", havingValue = "true")
public class UnsGraphDbListener {

    private static final String CLIENT_ID_PREFIX = "uns_graphdb_listener";

    private final UnsProperties properties;
    private final GraphDbHandler graphDbHandler;
    private final ConfigurableApplicationContext context;
    private MqttClientAdapter client;
    private Runnable shutdownAction = this::exitApplication;

    public UnsGraphDbListener(UnsProperties properties, GraphDbHandler graphDbHandler,
                              ConfigurableApplicationContext context) {
        this.properties = properties;
        this.graphDbHandler = graphDbHandler;
        this.context = context;
    }

    @PostConstruct
    public void start() throws Exception {
        UnsProperties.MqttConfig mqtt = properties.getMqtt();
        client = MqttClientFactory.create(MqttConnectionConfig.from(mqtt, CLIENT_ID_PREFIX), this::onMessage);
        client.connect();
        client.subscribeAll(MqttTopicSubscription.of(properties.getGraphdb().getTopics(), mqtt.getQos()));
        log.info("图数据库监听器启动完成, topics={}", properties.getGraphdb().getTopics());
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
        log.info("图数据库监听器已停止");
    }

    void onMessage(String topic, MqttMessageEnvelope envelope) {
        try {
            Map<String, Object> attributes = MqttPayloads.toAttributeMap(topic, envelope.getPayload(),
                    properties.getMqtt().getIgnoredAttributes());
            long timestamp = MqttPayloads.timestampOf(attributes, properties.getMqtt().getTimestampAttribute(),
                    envelope.getReceivedAt());
            graphDbHandler.persistMessage(topic, attributes, timestamp);
        } catch (GraphPersistenceException e) {
            log.error("图数据库持久化失败, 应用即将停止: topic={}, attempts={}", topic, e.getAttempts(), e);
            shutdownAction.run();
        } catch (BusinessException e) {
            log.error("消息处理失败, 已丢弃: topic={}, payload={} bytes, code={}, error={}",
                    topic, envelope.getPayloadLength(), e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("消息处理异常, 已丢弃: topic={}, payload={} bytes", topic, envelope.getPayloadLength(), e);
        }
    }

    void setShutdownAction(Runnable shutdownAction) {
        this.shutdownAction = shutdownAction;
    }

    private void exitApplication() {
        // 不能在 MQTT 回调线程上关闭客户端
        Thread thread = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)),
                "uns-graphdb-shutdown");
        thread.setDaemon(false);
        thread.start();
    }
}
