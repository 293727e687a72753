package com.wangbin.uns.core.sparkplug.model;

import com.wangbin.uns.common.exception.SparkplugDecodeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SparkplugDataTypeTest {

    @Test
    void codesMatchSparkplugTable() {
        assertEquals(SparkplugDataType.Int8, SparkplugDataType.fromCode(1));
        assertEquals(SparkplugDataType.UUID, SparkplugDataType.fromCode(15));
        assertEquals(SparkplugDataType.PropertySetList, SparkplugDataType.fromCode(21));
        assertEquals(SparkplugDataType.DateTimeArray, SparkplugDataType.fromCode(34));
    }

    @Test
    void unknownTagNamesTheTag() {
        SparkplugDecodeException ex = assertThrows(SparkplugDecodeException.class,
                () -> SparkplugDataType.fromCode(99));
        assertTrue(ex.getMessage().contains("99"));
        assertThrows(SparkplugDecodeException.class, () -> SparkplugDataType.fromCode(-1));
    }

    @Test
    void contextsRestrictDatatypes() {
        assertTrue(SparkplugDataType.DataSet.isAllowedIn(SparkplugDataType.Context.METRIC));
        assertFalse(SparkplugDataType.PropertySet.isAllowedIn(SparkplugDataType.Context.METRIC));
        assertTrue(SparkplugDataType.PropertySetList.isAllowedIn(SparkplugDataType.Context.PROPERTY_VALUE));
        assertFalse(SparkplugDataType.Bytes.isAllowedIn(SparkplugDataType.Context.DATASET_CELL));
        assertFalse(SparkplugDataType.UUID.isAllowedIn(SparkplugDataType.Context.TEMPLATE_PARAMETER));
        assertEquals(14, SparkplugDataType.allowedIn(SparkplugDataType.Context.DATASET_CELL).size());
    }

    @Test
    void typedValueChecksLogicalType() {
        assertThrows(IllegalArgumentException.class, () -> TypedValue.of(SparkplugDataType.Int64, 5));
        assertEquals(TypedValue.of(SparkplugDataType.Bytes, new byte[]{1, 2}),
                TypedValue.of(SparkplugDataType.Bytes, new byte[]{1, 2}));
    }
}
