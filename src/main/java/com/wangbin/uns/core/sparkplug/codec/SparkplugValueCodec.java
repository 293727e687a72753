package com.wangbin.uns.core.sparkplug.codec;

import com.wangbin.uns.common.exception.SparkplugDecodeException;
import com.wangbin.uns.core.sparkplug.model.DataSet;
import com.wangbin.uns.core.sparkplug.model.PropertySet;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.Template;
import com.wangbin.uns.core.sparkplug.model.TypedValue;
import com.wangbin.uns.core.sparkplug.model.WireValue;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * 逻辑值与线上存储槽之间的双向转换。
 * <p>
 * 有符号整数在线上以对应宽度的无符号数保存：编码时负数加 2^bits，解码时超出有符号范围的值减去 2^bits。
 * 解码同时兼容其它实现按 int32 符号扩展写入的 Int8 / Int16。
 */
public final class SparkplugValueCodec {

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private SparkplugValueCodec() {
    }

    public static WireValue encode(TypedValue value) {
        return encode(value.dataType(), value.value());
    }

    /**
     * 编码逻辑值，null 编码为空槽
     */
    public static WireValue encode(SparkplugDataType type, Object value) {
        if (value == null) {
            return new WireValue.Empty();
        }
        return switch (type) {
            case Int8 -> new WireValue.IntSlot((int) toUnsigned(expect(type, value, Byte.class), 8));
            case Int16 -> new WireValue.IntSlot((int) toUnsigned(expect(type, value, Short.class), 16));
            case Int32 -> new WireValue.IntSlot((int) toUnsigned(expect(type, value, Integer.class), 32));
            case Int64 -> new WireValue.LongSlot(expect(type, value, Long.class));
            case UInt8 -> new WireValue.IntSlot((int) checkUnsigned(type, expect(type, value, Integer.class), 0xFFL));
            case UInt16 -> new WireValue.IntSlot((int) checkUnsigned(type, expect(type, value, Integer.class), 0xFFFFL));
            case UInt32 -> new WireValue.IntSlot((int) checkUnsigned(type, expect(type, value, Long.class), 0xFFFFFFFFL));
            case UInt64 -> {
                BigInteger unsigned = expect(type, value, BigInteger.class);
                if (unsigned.signum() < 0 || unsigned.compareTo(UINT64_MAX) > 0) {
                    throw SparkplugDecodeException.invalidValue(type, value);
                }
                yield new WireValue.LongSlot(unsigned.longValue());
            }
            case Float -> new WireValue.FloatSlot(expect(type, value, Float.class));
            case Double -> new WireValue.DoubleSlot(expect(type, value, Double.class));
            case Boolean -> new WireValue.BooleanSlot(expect(type, value, Boolean.class));
            case String, Text, UUID -> new WireValue.StringSlot(expect(type, value, String.class));
            case DateTime -> new WireValue.LongSlot(expect(type, value, Instant.class).toEpochMilli());
            case Bytes, File -> {
                byte[] bytes = expect(type, value, byte[].class);
                yield new WireValue.BytesSlot(Arrays.copyOf(bytes, bytes.length));
            }
            case DataSet -> new WireValue.DataSetSlot(expect(type, value, DataSet.class));
            case Template -> new WireValue.TemplateSlot(expect(type, value, Template.class));
            case PropertySet -> new WireValue.PropertySetSlot(expect(type, value, PropertySet.class));
            case PropertySetList -> new WireValue.PropertySetListSlot(propertySets(type, value));
            case Int8Array, Int16Array, Int32Array, Int64Array,
                    UInt8Array, UInt16Array, UInt32Array, UInt64Array,
                    FloatArray, DoubleArray, BooleanArray, StringArray, DateTimeArray ->
                    new WireValue.BytesSlot(SparkplugArrays.pack(type, expect(type, value, List.class)));
            case Unknown -> throw SparkplugDecodeException.unsupportedDataType(type, "value encoding");
        };
    }

    /**
     * 解码线上值；isNull 为 true 时无论槽内是什么都返回显式空值
     */
    public static TypedValue decode(SparkplugDataType type, WireValue wire, boolean isNull) {
        if (isNull) {
            return TypedValue.ofNull(type);
        }
        return new TypedValue(type, decode(type, wire));
    }

    /**
     * 解码线上值，空槽解码为 null
     */
    public static Object decode(SparkplugDataType type, WireValue wire) {
        if (type == SparkplugDataType.Unknown) {
            throw SparkplugDecodeException.unsupportedDataType(type, "value decoding");
        }
        if (wire instanceof WireValue.Empty) {
            return null;
        }
        if (wire.slot() != type.getSlot()) {
            throw SparkplugDecodeException.slotMismatch(type, type.getSlot().name(), wire.slot().name());
        }
        return switch (type) {
            case Int8 -> (byte) fromUnsigned(type, ((WireValue.IntSlot) wire).bits(), 8);
            case Int16 -> (short) fromUnsigned(type, ((WireValue.IntSlot) wire).bits(), 16);
            case Int32 -> ((WireValue.IntSlot) wire).bits();
            case Int64 -> ((WireValue.LongSlot) wire).bits();
            case UInt8 -> (int) checkUnsigned(type, ((WireValue.IntSlot) wire).unsigned(), 0xFFL);
            case UInt16 -> (int) checkUnsigned(type, ((WireValue.IntSlot) wire).unsigned(), 0xFFFFL);
            case UInt32 -> ((WireValue.IntSlot) wire).unsigned();
            case UInt64 -> new BigInteger(Long.toUnsignedString(((WireValue.LongSlot) wire).bits()));
            case Float -> ((WireValue.FloatSlot) wire).value();
            case Double -> ((WireValue.DoubleSlot) wire).value();
            case Boolean -> ((WireValue.BooleanSlot) wire).value();
            case String, Text, UUID -> ((WireValue.StringSlot) wire).value();
            case DateTime -> Instant.ofEpochMilli(((WireValue.LongSlot) wire).bits());
            case Bytes, File -> {
                byte[] bytes = ((WireValue.BytesSlot) wire).value();
                yield Arrays.copyOf(bytes, bytes.length);
            }
            case DataSet -> ((WireValue.DataSetSlot) wire).value();
            case Template -> ((WireValue.TemplateSlot) wire).value();
            case PropertySet -> ((WireValue.PropertySetSlot) wire).value();
            case PropertySetList -> ((WireValue.PropertySetListSlot) wire).value();
            case Int8Array, Int16Array, Int32Array, Int64Array,
                    UInt8Array, UInt16Array, UInt32Array, UInt64Array,
                    FloatArray, DoubleArray, BooleanArray, StringArray, DateTimeArray ->
                    SparkplugArrays.unpack(type, ((WireValue.BytesSlot) wire).value());
            case Unknown -> throw SparkplugDecodeException.unsupportedDataType(type, "value decoding");
        };
    }

    /**
     * 有符号数转为 bits 位无符号表示：负数加 2^bits
     */
    static long toUnsigned(long signed, int bits) {
        return signed < 0 ? signed + (1L << bits) : signed;
    }

    /**
     * bits 位无符号表示转为有符号数：超出有符号范围时减去 2^bits。
     * 按 int32 符号扩展写入的负数（如 0xFFFFFFF6）同样接受。
     */
    static long fromUnsigned(SparkplugDataType type, int wireBits, int bits) {
        long unsigned = Integer.toUnsignedLong(wireBits);
        long range = 1L << bits;
        if (unsigned < range) {
            return unsigned >= range / 2 ? unsigned - range : unsigned;
        }
        if (wireBits < 0 && wireBits >= -(range / 2)) {
            return wireBits;
        }
        throw new SparkplugDecodeException("Wire value " + unsigned + " is out of range for " + type);
    }

    private static long checkUnsigned(SparkplugDataType type, Number value, long max) {
        long unsigned = value.longValue();
        if (unsigned < 0 || unsigned > max) {
            throw new SparkplugDecodeException("Value " + value + " is out of range for " + type);
        }
        return unsigned;
    }

    private static <T> T expect(SparkplugDataType type, Object value, Class<T> expected) {
        if (!expected.isInstance(value)) {
            throw SparkplugDecodeException.invalidValue(type, value);
        }
        return expected.cast(value);
    }

    private static List<PropertySet> propertySets(SparkplugDataType type, Object value) {
        List<?> list = expect(type, value, List.class);
        for (Object item : list) {
            if (!(item instanceof PropertySet)) {
                throw SparkplugDecodeException.invalidValue(type, item);
            }
        }
        @SuppressWarnings("unchecked")
        List<PropertySet> sets = (List<PropertySet>) list;
        return List.copyOf(sets);
    }
}
