package com.wangbin.uns.core.sparkplug.model;

import java.util.Arrays;
import java.util.List;

/**
 * protobuf oneof value 的线上表示，同一时刻只有一个存储槽有值。
 * <p>
 * int 槽保存 uint32 的位模式，long 槽保存 uint64 的位模式。
 */
public sealed interface WireValue {

    SparkplugDataType.WireSlot slot();

    record IntSlot(int bits) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.INT;
        }

        public long unsigned() {
            return Integer.toUnsignedLong(bits);
        }
    }

    record LongSlot(long bits) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.LONG;
        }
    }

    record FloatSlot(float value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.FLOAT;
        }
    }

    record DoubleSlot(double value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.DOUBLE;
        }
    }

    record BooleanSlot(boolean value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.BOOLEAN;
        }
    }

    record StringSlot(String value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.STRING;
        }
    }

    record BytesSlot(byte[] value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.BYTES;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesSlot other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesSlot[length=" + (value == null ? 0 : value.length) + "]";
        }
    }

    record DataSetSlot(DataSet value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.DATASET;
        }
    }

    record TemplateSlot(Template value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.TEMPLATE;
        }
    }

    record PropertySetSlot(PropertySet value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.PROPERTY_SET;
        }
    }

    record PropertySetListSlot(List<PropertySet> value) implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.PROPERTY_SET_LIST;
        }
    }

    /**
     * 槽未赋值，只在显式 null 时出现
     */
    record Empty() implements WireValue {
        @Override
        public SparkplugDataType.WireSlot slot() {
            return SparkplugDataType.WireSlot.NONE;
        }
    }
}
