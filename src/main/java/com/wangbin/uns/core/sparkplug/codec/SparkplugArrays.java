package com.wangbin.uns.core.sparkplug.codec;

import com.wangbin.uns.common.exception.SparkplugDecodeException;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sparkplug 数组类型的打包与解包，所有数值均为小端序。
 * <ul>
 *     <li>BooleanArray：4 字节元素个数，随后按位打包，每字节高位在前</li>
 *     <li>StringArray：以 0x00 结尾的 UTF-8 字符串依次拼接</li>
 * </ul>
 */
final class SparkplugArrays {

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private SparkplugArrays() {
    }

    static byte[] pack(SparkplugDataType type, List<?> values) {
        return switch (type) {
            case Int8Array -> {
                ByteBuffer buffer = allocate(values.size());
                for (Object value : values) {
                    buffer.put(element(type, value, Byte.class));
                }
                yield buffer.array();
            }
            case Int16Array -> {
                ByteBuffer buffer = allocate(values.size() * 2);
                for (Object value : values) {
                    buffer.putShort(element(type, value, Short.class));
                }
                yield buffer.array();
            }
            case Int32Array -> {
                ByteBuffer buffer = allocate(values.size() * 4);
                for (Object value : values) {
                    buffer.putInt(element(type, value, Integer.class));
                }
                yield buffer.array();
            }
            case Int64Array -> {
                ByteBuffer buffer = allocate(values.size() * 8);
                for (Object value : values) {
                    buffer.putLong(element(type, value, Long.class));
                }
                yield buffer.array();
            }
            case UInt8Array -> {
                ByteBuffer buffer = allocate(values.size());
                for (Object value : values) {
                    buffer.put((byte) unsignedInRange(type, element(type, value, Integer.class), 0xFFL));
                }
                yield buffer.array();
            }
            case UInt16Array -> {
                ByteBuffer buffer = allocate(values.size() * 2);
                for (Object value : values) {
                    buffer.putShort((short) unsignedInRange(type, element(type, value, Integer.class), 0xFFFFL));
                }
                yield buffer.array();
            }
            case UInt32Array -> {
                ByteBuffer buffer = allocate(values.size() * 4);
                for (Object value : values) {
                    buffer.putInt((int) unsignedInRange(type, element(type, value, Long.class), 0xFFFFFFFFL));
                }
                yield buffer.array();
            }
            case UInt64Array -> {
                ByteBuffer buffer = allocate(values.size() * 8);
                for (Object value : values) {
                    BigInteger unsigned = element(type, value, BigInteger.class);
                    if (unsigned.signum() < 0 || unsigned.compareTo(UINT64_MAX) > 0) {
                        throw SparkplugDecodeException.invalidValue(type, unsigned);
                    }
                    buffer.putLong(unsigned.longValue());
                }
                yield buffer.array();
            }
            case FloatArray -> {
                ByteBuffer buffer = allocate(values.size() * 4);
                for (Object value : values) {
                    buffer.putFloat(element(type, value, Float.class));
                }
                yield buffer.array();
            }
            case DoubleArray -> {
                ByteBuffer buffer = allocate(values.size() * 8);
                for (Object value : values) {
                    buffer.putDouble(element(type, value, Double.class));
                }
                yield buffer.array();
            }
            case DateTimeArray -> {
                ByteBuffer buffer = allocate(values.size() * 8);
                for (Object value : values) {
                    buffer.putLong(element(type, value, Instant.class).toEpochMilli());
                }
                yield buffer.array();
            }
            case BooleanArray -> packBooleans(type, values);
            case StringArray -> packStrings(type, values);
            default -> throw SparkplugDecodeException.unsupportedDataType(type, "array packing");
        };
    }

    static List<?> unpack(SparkplugDataType type, byte[] bytes) {
        return switch (type) {
            case Int8Array -> {
                ByteBuffer buffer = wrap(type, bytes, 1);
                List<Byte> result = new ArrayList<>(bytes.length);
                while (buffer.hasRemaining()) {
                    result.add(buffer.get());
                }
                yield result;
            }
            case Int16Array -> {
                ByteBuffer buffer = wrap(type, bytes, 2);
                List<Short> result = new ArrayList<>(bytes.length / 2);
                while (buffer.hasRemaining()) {
                    result.add(buffer.getShort());
                }
                yield result;
            }
            case Int32Array -> {
                ByteBuffer buffer = wrap(type, bytes, 4);
                List<Integer> result = new ArrayList<>(bytes.length / 4);
                while (buffer.hasRemaining()) {
                    result.add(buffer.getInt());
                }
                yield result;
            }
            case Int64Array -> {
                ByteBuffer buffer = wrap(type, bytes, 8);
                List<Long> result = new ArrayList<>(bytes.length / 8);
                while (buffer.hasRemaining()) {
                    result.add(buffer.getLong());
                }
                yield result;
            }
            case UInt8Array -> {
                ByteBuffer buffer = wrap(type, bytes, 1);
                List<Integer> result = new ArrayList<>(bytes.length);
                while (buffer.hasRemaining()) {
                    result.add(Byte.toUnsignedInt(buffer.get()));
                }
                yield result;
            }
            case UInt16Array -> {
                ByteBuffer buffer = wrap(type, bytes, 2);
                List<Integer> result = new ArrayList<>(bytes.length / 2);
                while (buffer.hasRemaining()) {
                    result.add(Short.toUnsignedInt(buffer.getShort()));
                }
                yield result;
            }
            case UInt32Array -> {
                ByteBuffer buffer = wrap(type, bytes, 4);
                List<Long> result = new ArrayList<>(bytes.length / 4);
                while (buffer.hasRemaining()) {
                    result.add(Integer.toUnsignedLong(buffer.getInt()));
                }
                yield result;
            }
            case UInt64Array -> {
                ByteBuffer buffer = wrap(type, bytes, 8);
                List<BigInteger> result = new ArrayList<>(bytes.length / 8);
                while (buffer.hasRemaining()) {
                    result.add(new BigInteger(Long.toUnsignedString(buffer.getLong())));
                }
                yield result;
            }
            case FloatArray -> {
                ByteBuffer buffer = wrap(type, bytes, 4);
                List<Float> result = new ArrayList<>(bytes.length / 4);
                while (buffer.hasRemaining()) {
                    result.add(buffer.getFloat());
                }
                yield result;
            }
            case DoubleArray -> {
                ByteBuffer buffer = wrap(type, bytes, 8);
                List<Double> result = new ArrayList<>(bytes.length / 8);
                while (buffer.hasRemaining()) {
                    result.add(buffer.getDouble());
                }
                yield result;
            }
            case DateTimeArray -> {
                ByteBuffer buffer = wrap(type, bytes, 8);
                List<Instant> result = new ArrayList<>(bytes.length / 8);
                while (buffer.hasRemaining()) {
                    result.add(Instant.ofEpochMilli(buffer.getLong()));
                }
                yield result;
            }
            case BooleanArray -> unpackBooleans(type, bytes);
            case StringArray -> unpackStrings(bytes);
            default -> throw SparkplugDecodeException.unsupportedDataType(type, "array unpacking");
        };
    }

    private static byte[] packBooleans(SparkplugDataType type, List<?> values) {
        int count = values.size();
        ByteBuffer buffer = allocate(4 + (count + 7) / 8);
        buffer.putInt(count);
        for (int i = 0; i < count; i++) {
            if (element(type, values.get(i), Boolean.class)) {
                int index = 4 + i / 8;
                buffer.put(index, (byte) (buffer.get(index) | (0x80 >>> (i % 8))));
            }
        }
        return buffer.array();
    }

    private static List<Boolean> unpackBooleans(SparkplugDataType type, byte[] bytes) {
        if (bytes.length < 4) {
            throw new SparkplugDecodeException(type + " payload too short: " + bytes.length + " byte(s)");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        long count = Integer.toUnsignedLong(buffer.getInt());
        if (4 + (count + 7) / 8 > bytes.length) {
            throw new SparkplugDecodeException(type + " declares " + count + " element(s) but only "
                    + (bytes.length - 4) + " packed byte(s) follow");
        }
        List<Boolean> result = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            int packed = bytes[4 + i / 8];
            result.add((packed & (0x80 >>> (i % 8))) != 0);
        }
        return result;
    }

    private static byte[] packStrings(SparkplugDataType type, List<?> values) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Object value : values) {
            byte[] encoded = element(type, value, String.class).getBytes(StandardCharsets.UTF_8);
            out.write(encoded, 0, encoded.length);
            out.write(0);
        }
        return out.toByteArray();
    }

    private static List<String> unpackStrings(byte[] bytes) {
        List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 0) {
                result.add(new String(bytes, start, i - start, StandardCharsets.UTF_8));
                start = i + 1;
            }
        }
        // 最后一个字符串缺少结尾的 0x00 时依然保留
        if (start < bytes.length) {
            result.add(new String(bytes, start, bytes.length - start, StandardCharsets.UTF_8));
        }
        return result;
    }

    private static <T> T element(SparkplugDataType type, Object value, Class<T> expected) {
        if (!expected.isInstance(value)) {
            throw SparkplugDecodeException.invalidValue(type, value);
        }
        return expected.cast(value);
    }

    private static long unsignedInRange(SparkplugDataType type, Number value, long max) {
        long unsigned = value.longValue();
        if (unsigned < 0 || unsigned > max) {
            throw SparkplugDecodeException.invalidValue(type, value);
        }
        return unsigned;
    }

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static ByteBuffer wrap(SparkplugDataType type, byte[] bytes, int width) {
        if (bytes.length % width != 0) {
            throw new SparkplugDecodeException(type + " payload length " + bytes.length
                    + " is not a multiple of " + width);
        }
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }
}
