package com.wangbin.uns.core.mqtt;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.mqttv5.client.IMqttMessageListener;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.MqttSubscription;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
class PahoV5ClientAdapter implements MqttClientAdapter {

    private static final long OPERATION_TIMEOUT_MILLIS = 5000;

    private final MqttConnectionConfig config;
    private final IncomingMessageHandler handler;
    private final MqttAsyncClient client;
    private final MqttConnectionOptions options;
    // topic -> qos，自动重连后重新订阅
    private final Map<String, Integer> subscriptions = new ConcurrentHashMap<>();

    PahoV5ClientAdapter(MqttConnectionConfig config, IncomingMessageHandler handler) throws MqttException {
        this(config, handler, new MqttAsyncClient(config.getBrokerUrl(), config.getClientId(), new MemoryPersistence()));
    }

    PahoV5ClientAdapter(MqttConnectionConfig config, IncomingMessageHandler handler, MqttAsyncClient client) {
        this.config = config;
        this.handler = handler;
        this.options = new MqttConnectionOptions();
        options.setAutomaticReconnect(config.isAutomaticReconnect());
        options.setCleanStart(config.isCleanSession());
        options.setConnectionTimeout(config.getConnectionTimeoutSeconds());
        options.setKeepAliveInterval(config.getKeepAliveIntervalSeconds());
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            options.setUserName(config.getUsername());
        }
        if (config.getPassword() != null) {
            options.setPassword(config.getPassword().getBytes(StandardCharsets.UTF_8));
        }
        this.client = client;
        this.client.setCallback(new MqttCallback() {
            @Override
            public void connectComplete(boolean reconnect, String serverURI) {
                log.info("MQTT v5 已连接: {}, reconnect={}", serverURI, reconnect);
                if (reconnect) {
                    restoreSubscriptions();
                }
            }

            @Override
            public void disconnected(MqttDisconnectResponse response) {
                log.warn("MQTT v5 连接断开: {}", response != null ? response.getReasonString() : "unknown");
            }

            @Override
            public void mqttErrorOccurred(MqttException exception) {
                log.error("MQTT v5 错误: {}", exception.getMessage());
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                // 订阅时注册了监听器，这里不处理
            }

            @Override
            public void deliveryComplete(IMqttToken token) {
            }

            @Override
            public void authPacketArrived(int reasonCode, MqttProperties properties) {
            }
        });
    }

    @Override
    public void connect() throws Exception {
        client.connect(options).waitForCompletion(config.getConnectionTimeoutSeconds() * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v5 client failed to connect to " + config.getBrokerUrl());
        }
        log.info("MQTT v5 已连接: {}", config.getBrokerUrl());
    }

    @Override
    public void disconnect() throws Exception {
        if (client.isConnected()) {
            client.disconnect().waitForCompletion(OPERATION_TIMEOUT_MILLIS);
        }
        client.close();
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception {
        client.publish(topic, payload != null ? payload : new byte[0], qos, retained)
                .waitForCompletion(OPERATION_TIMEOUT_MILLIS);
    }

    @Override
    public void subscribe(String topic, int qos) throws Exception {
        sendSubscribe(topic, qos).waitForCompletion(OPERATION_TIMEOUT_MILLIS);
        subscriptions.put(topic, qos);
        log.info("已订阅 {} (QoS {})", topic, qos);
    }

    @Override
    public void unsubscribe(String topic) throws Exception {
        client.unsubscribe(topic).waitForCompletion(OPERATION_TIMEOUT_MILLIS);
        subscriptions.remove(topic);
    }

    /**
     * 在回调线程上执行，不等待 SUBACK
     */
    private void restoreSubscriptions() {
        subscriptions.forEach((topic, qos) -> {
            try {
                sendSubscribe(topic, qos);
                log.info("重连后重新订阅 {} (QoS {})", topic, qos);
            } catch (MqttException e) {
                log.error("重连后重新订阅失败: topic={}, error={}", topic, e.getMessage());
            }
        });
    }

    private IMqttToken sendSubscribe(String topic, int qos) throws MqttException {
        IMqttMessageListener listener = (receivedTopic, message) -> handler.handle(receivedTopic,
                new MqttMessageEnvelope(message.getPayload(), message.getQos(), message.isRetained(),
                        userProperties(message.getProperties())));
        return client.subscribe(new MqttSubscription(topic, qos), listener);
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    private static Map<String, String> userProperties(MqttProperties properties) {
        if (properties == null || properties.getUserProperties().isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        properties.getUserProperties().forEach(prop -> result.put(prop.getKey(), prop.getValue()));
        return result;
    }
}
