package com.wangbin.uns.common.exception;

import lombok.Getter;

/**
 * 持久化失败且重试次数耗尽，调用方应将其视为致命错误。
 */
@Getter
public class GraphPersistenceException extends BusinessException {

    public static final int CODE = 5002;

    private final String topic;
    private final int attempts;

    public GraphPersistenceException(String topic, int attempts, Throwable cause) {
        super(CODE, "Failed to persist message on topic " + topic + " after " + attempts + " attempt(s)", cause);
        this.topic = topic;
        this.attempts = attempts;
    }
}
