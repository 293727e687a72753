package com.wangbin.uns.common.exception;

/**
 * UNS 消息不是合法的 JSON 对象，或转发的文档无法序列化为 JSON
 */
public class PayloadFormatException extends BusinessException {

    public static final int CODE = 4004;

    public PayloadFormatException(String message) {
        super(CODE, message);
    }

    public PayloadFormatException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static PayloadFormatException notSerializable(Throwable cause) {
        return new PayloadFormatException("Document cannot be serialized to JSON: " + cause.getMessage(), cause);
    }

    public static PayloadFormatException notJsonObject(String topic, int length) {
        return new PayloadFormatException("Payload on topic " + topic + " (" + length
                + " bytes) is not a JSON object");
    }
}
