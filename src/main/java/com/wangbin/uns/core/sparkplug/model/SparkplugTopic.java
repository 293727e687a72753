package com.wangbin.uns.core.sparkplug.model;

import com.wangbin.uns.common.constant.SparkplugConstant;
import com.wangbin.uns.common.exception.TopicFormatException;

/**
 * 解析后的 Sparkplug topic：spBv1.0/&lt;group&gt;/&lt;msgType&gt;/&lt;edgeNode&gt;/[&lt;device&gt;]
 */
public record SparkplugTopic(String groupId, SparkplugMessageType messageType, String rawMessageType,
                             String edgeNodeId, String deviceId) {

    public static SparkplugTopic parse(String topic) {
        if (topic == null || topic.isBlank()) {
            throw TopicFormatException.invalidDepth(String.valueOf(topic), 0);
        }
        String[] path = topic.split(SparkplugConstant.TOPIC_SEPARATOR, -1);
        if (path.length != SparkplugConstant.NODE_TOPIC_DEPTH && path.length != SparkplugConstant.DEVICE_TOPIC_DEPTH) {
            throw TopicFormatException.invalidDepth(topic, path.length);
        }
        if (!SparkplugConstant.SPARKPLUG_NAMESPACE.equals(path[0])) {
            throw TopicFormatException.invalidNamespace(topic);
        }
        String deviceId = path.length == SparkplugConstant.DEVICE_TOPIC_DEPTH ? path[4] : null;
        return new SparkplugTopic(path[1], SparkplugMessageType.fromText(path[2]), path[2], path[3], deviceId);
    }

    public boolean hasDevice() {
        return deviceId != null;
    }

    public static boolean isSparkplugTopic(String topic) {
        return topic != null && (topic.equals(SparkplugConstant.SPARKPLUG_NAMESPACE)
                || topic.startsWith(SparkplugConstant.SPARKPLUG_NAMESPACE + SparkplugConstant.TOPIC_SEPARATOR));
    }
}
