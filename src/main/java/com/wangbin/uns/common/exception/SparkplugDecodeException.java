package com.wangbin.uns.common.exception;

/**
 * Sparkplug B 载荷解码异常，当前消息不可恢复，记录后丢弃。
 */
public class SparkplugDecodeException extends BusinessException {

    public static final int CODE = 4001;

    public SparkplugDecodeException(String message) {
        super(CODE, message);
    }

    public SparkplugDecodeException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static SparkplugDecodeException unknownDataType(int code) {
        return new SparkplugDecodeException("Unknown Sparkplug datatype tag: " + code);
    }

    public static SparkplugDecodeException unsupportedDataType(Object dataType, String context) {
        return new SparkplugDecodeException("Datatype " + dataType + " is not supported in " + context);
    }

    public static SparkplugDecodeException slotMismatch(Object dataType, String expected, String actual) {
        return new SparkplugDecodeException("Datatype " + dataType + " expects wire slot " + expected
                + " but found " + actual);
    }

    public static SparkplugDecodeException invalidValue(Object dataType, Object value) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new SparkplugDecodeException("Value of type " + type + " cannot be encoded as " + dataType);
    }
}
