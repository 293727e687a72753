package com.wangbin.uns.common.exception;

import lombok.Getter;

/**
 * Topic 格式不合法，格式错误不是瞬时问题，不重试。
 */
@Getter
public class TopicFormatException extends BusinessException {

    public static final int CODE = 4002;

    private final String topic;

    public TopicFormatException(String topic, String message) {
        super(CODE, message);
        this.topic = topic;
    }

    public static TopicFormatException invalidDepth(String topic, int depth) {
        return new TopicFormatException(topic, "Unknown SparkplugB topic received: " + topic
                + ". Depth of tree should be 4 or 5, got " + depth);
    }

    public static TopicFormatException invalidNamespace(String topic) {
        return new TopicFormatException(topic, "Topic is not in the SparkplugB namespace: " + topic);
    }
}
