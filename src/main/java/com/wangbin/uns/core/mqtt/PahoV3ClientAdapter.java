package com.wangbin.uns.core.mqtt;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttMessageListener;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
class PahoV3ClientAdapter implements MqttClientAdapter {

    private static final long OPERATION_TIMEOUT_MILLIS = 5000;

    private final MqttConnectionConfig config;
    private final IncomingMessageHandler handler;
    private final IMqttAsyncClient client;
    private final MqttConnectOptions options;
    // topic -> qos，自动重连后重新订阅
    private final Map<String, Integer> subscriptions = new ConcurrentHashMap<>();

    PahoV3ClientAdapter(MqttConnectionConfig config, IncomingMessageHandler handler) throws MqttException {
        this(config, handler, new MqttAsyncClient(config.getBrokerUrl(), config.getClientId(), new MemoryPersistence()));
    }

    PahoV3ClientAdapter(MqttConnectionConfig config, IncomingMessageHandler handler, IMqttAsyncClient client) {
        this.config = config;
        this.handler = handler;
        this.options = new MqttConnectOptions();
        options.setAutomaticReconnect(config.isAutomaticReconnect());
        options.setCleanSession(config.isCleanSession());
        options.setConnectionTimeout(config.getConnectionTimeoutSeconds());
        options.setKeepAliveInterval(config.getKeepAliveIntervalSeconds());
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            options.setUserName(config.getUsername());
        }
        if (config.getPassword() != null) {
            options.setPassword(config.getPassword().toCharArray());
        }
        this.client = client;
        this.client.setCallback(new MqttCallbackExtended() {
            @Override
            public void connectComplete(boolean reconnect, String serverURI) {
                log.info("MQTT v3 已连接: {}, reconnect={}", serverURI, reconnect);
                if (reconnect) {
                    restoreSubscriptions();
                }
            }

            @Override
            public void connectionLost(Throwable cause) {
                log.warn("MQTT v3 连接断开: {}", cause != null ? cause.getMessage() : "unknown");
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                // 订阅时注册了监听器，这里不处理
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
            }
        });
    }

    @Override
    public void connect() throws Exception {
        client.connect(options).waitForCompletion(config.getConnectionTimeoutSeconds() * 1000L);
        if (!client.isConnected()) {
            throw new IllegalStateException("MQTT v3 client failed to connect to " + config.getBrokerUrl());
        }
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
        MqttMessage message = new MqttMessage(payload != null ? payload : new byte[0]);
        message.setQos(qos);
        message.setRetained(retained);
        client.publish(topic, message).waitForCompletion(OPERATION_TIMEOUT_MILLIS);
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
                        Collections.emptyMap()));
        return client.subscribe(topic, qos, listener);
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }
}
