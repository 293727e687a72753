package com.wangbin.uns.core.mqtt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 订阅的 topic 与 QoS
 */
public record MqttTopicSubscription(String topic, int qos) {

    public static List<MqttTopicSubscription> of(Collection<String> topics, int qos) {
        List<MqttTopicSubscription> result = new ArrayList<>();
        if (topics == null) {
            return result;
        }
        for (String topic : topics) {
            if (topic != null && !topic.isBlank()) {
                result.add(new MqttTopicSubscription(topic.trim(), qos));
            }
        }
        return result;
    }
}
