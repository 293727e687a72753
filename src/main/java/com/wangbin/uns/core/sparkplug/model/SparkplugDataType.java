package com.wangbin.uns.core.sparkplug.model;

import com.wangbin.uns.common.exception.SparkplugDecodeException;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sparkplug B 数据类型。
 * <p>
 * 每个类型对应一个线上存储槽（{@link WireSlot}）、一个逻辑值的 Java 类型，以及允许出现的位置
 * （指标、DataSet 单元格、属性值、模板参数）。
 */
@Getter
public enum SparkplugDataType {
    Unknown(0, WireSlot.NONE, Void.class),
    Int8(1, WireSlot.INT, Byte.class),
    Int16(2, WireSlot.INT, Short.class),
    Int32(3, WireSlot.INT, Integer.class),
    Int64(4, WireSlot.LONG, Long.class),
    UInt8(5, WireSlot.INT, Integer.class),
    UInt16(6, WireSlot.INT, Integer.class),
    UInt32(7, WireSlot.INT, Long.class),
    UInt64(8, WireSlot.LONG, BigInteger.class),
    Float(9, WireSlot.FLOAT, java.lang.Float.class),
    Double(10, WireSlot.DOUBLE, java.lang.Double.class),
    Boolean(11, WireSlot.BOOLEAN, java.lang.Boolean.class),
    String(12, WireSlot.STRING, java.lang.String.class),
    DateTime(13, WireSlot.LONG, Instant.class),
    Text(14, WireSlot.STRING, java.lang.String.class),
    UUID(15, WireSlot.STRING, java.lang.String.class),
    DataSet(16, WireSlot.DATASET, com.wangbin.uns.core.sparkplug.model.DataSet.class),
    Bytes(17, WireSlot.BYTES, byte[].class),
    File(18, WireSlot.BYTES, byte[].class),
    Template(19, WireSlot.TEMPLATE, com.wangbin.uns.core.sparkplug.model.Template.class),
    PropertySet(20, WireSlot.PROPERTY_SET, com.wangbin.uns.core.sparkplug.model.PropertySet.class),
    PropertySetList(21, WireSlot.PROPERTY_SET_LIST, List.class),
    Int8Array(22, WireSlot.BYTES, List.class),
    Int16Array(23, WireSlot.BYTES, List.class),
    Int32Array(24, WireSlot.BYTES, List.class),
    Int64Array(25, WireSlot.BYTES, List.class),
    UInt8Array(26, WireSlot.BYTES, List.class),
    UInt16Array(27, WireSlot.BYTES, List.class),
    UInt32Array(28, WireSlot.BYTES, List.class),
    UInt64Array(29, WireSlot.BYTES, List.class),
    FloatArray(30, WireSlot.BYTES, List.class),
    DoubleArray(31, WireSlot.BYTES, List.class),
    BooleanArray(32, WireSlot.BYTES, List.class),
    StringArray(33, WireSlot.BYTES, List.class),
    DateTimeArray(34, WireSlot.BYTES, List.class);

    /**
     * 值所在的位置，不同位置允许的数据类型不同
     */
    public enum Context {
        METRIC,
        DATASET_CELL,
        PROPERTY_VALUE,
        TEMPLATE_PARAMETER
    }

    /**
     * protobuf 中 oneof value 的存储槽
     */
    public enum WireSlot {
        NONE,
        INT,
        LONG,
        FLOAT,
        DOUBLE,
        BOOLEAN,
        STRING,
        BYTES,
        DATASET,
        TEMPLATE,
        PROPERTY_SET,
        PROPERTY_SET_LIST
    }

    private static final SparkplugDataType[] BY_CODE = new SparkplugDataType[35];

    static {
        for (SparkplugDataType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;
    private final WireSlot slot;
    private final Class<?> logicalType;

    SparkplugDataType(int code, WireSlot slot, Class<?> logicalType) {
        this.code = code;
        this.slot = slot;
        this.logicalType = logicalType;
    }

    /**
     * 根据线上编码获取类型，未知编码抛出解码异常
     */
    public static SparkplugDataType fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length || BY_CODE[code] == null) {
            throw SparkplugDecodeException.unknownDataType(code);
        }
        return BY_CODE[code];
    }

    /**
     * 基础标量类型（Int8 到 Text），DataSet、模板参数只允许这些类型
     */
    public boolean isBasicScalar() {
        return code >= Int8.code && code <= Text.code;
    }

    public boolean isAllowedIn(Context context) {
        return switch (context) {
            case METRIC -> this != Unknown && this != PropertySet && this != PropertySetList;
            case DATASET_CELL, TEMPLATE_PARAMETER -> isBasicScalar();
            case PROPERTY_VALUE -> isBasicScalar() || this == PropertySet || this == PropertySetList;
        };
    }

    /**
     * 校验类型可用于指定位置，否则抛出解码异常
     */
    public SparkplugDataType requireAllowedIn(Context context) {
        if (!isAllowedIn(context)) {
            throw SparkplugDecodeException.unsupportedDataType(this, context.name());
        }
        return this;
    }

    public static Set<SparkplugDataType> allowedIn(Context context) {
        Set<SparkplugDataType> result = EnumSet.noneOf(SparkplugDataType.class);
        for (SparkplugDataType type : values()) {
            if (type.isAllowedIn(context)) {
                result.add(type);
            }
        }
        return result;
    }
}
