package com.wangbin.uns.core.mqtt;

/**
 * 入站消息回调，在传输层回调线程上逐条执行
 */
@FunctionalInterface
public interface IncomingMessageHandler {
    void handle(String topic, MqttMessageEnvelope envelope);
}
