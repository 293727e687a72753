package com.wangbin.uns.common.exception;

import lombok.Getter;

/**
 * 图数据库写入异常。transient 为 true 时表示可重试（服务不可用、会话过期等）。
 */
@Getter
public class GraphStoreException extends BusinessException {

    public static final int CODE = 5001;

    private final boolean transientError;

    public GraphStoreException(String message, boolean transientError, Throwable cause) {
        super(CODE, message, cause);
        this.transientError = transientError;
    }

    public static GraphStoreException transientError(String message, Throwable cause) {
        return new GraphStoreException(message, true, cause);
    }

    public static GraphStoreException fatal(String message, Throwable cause) {
        return new GraphStoreException(message, false, cause);
    }
}
