package com.wangbin.uns.common.exception;

/**
 * DataSet 行的单元格数量与列类型数量不一致。
 */
public class DataSetLengthMismatchException extends SparkplugDecodeException {

    public DataSetLengthMismatchException(String message) {
        super(message);
    }

    public static DataSetLengthMismatchException rowLength(int rowIndex, int expected, int actual) {
        return new DataSetLengthMismatchException(String.format(
                "DataSet row %d has %d elements, expected %d", rowIndex, actual, expected));
    }

    public static DataSetLengthMismatchException columnLength(int columns, int types) {
        return new DataSetLengthMismatchException(String.format(
                "DataSet has %d columns but %d types", columns, types));
    }
}
