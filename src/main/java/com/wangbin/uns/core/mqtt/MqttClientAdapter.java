package com.wangbin.uns.core.mqtt;

import java.util.List;

/**
 * MQTT 客户端抽象，屏蔽 Paho v3 / v5 的差异。收到的消息交给创建时传入的 {@link IncomingMessageHandler}。
 */
public interface MqttClientAdapter extends AutoCloseable {

    void connect() throws Exception;

    void disconnect() throws Exception;

    void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception;

    void subscribe(String topic, int qos) throws Exception;

    void unsubscribe(String topic) throws Exception;

    boolean isConnected();

    default void subscribeAll(List<MqttTopicSubscription> subscriptions) throws Exception {
        for (MqttTopicSubscription subscription : subscriptions) {
            subscribe(subscription.topic(), subscription.qos());
        }
    }

    @Override
    default void close() throws Exception {
        disconnect();
    }
}
