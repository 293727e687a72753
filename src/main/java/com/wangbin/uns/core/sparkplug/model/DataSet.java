package com.wangbin.uns.core.sparkplug.model;

import com.wangbin.uns.common.exception.DataSetLengthMismatchException;
import com.wangbin.uns.common.exception.SparkplugDecodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列式数据集：列名、列类型一一对应，每行的单元格数量与列类型数量一致，
 * 第 i 个单元格的值由 types[i] 决定。单元格允许为 null。
 */
public record DataSet(List<String> columns, List<SparkplugDataType> types, List<List<Object>> rows) {

    public DataSet {
        columns = List.copyOf(columns);
        types = List.copyOf(types);
        if (columns.size() != types.size()) {
            throw DataSetLengthMismatchException.columnLength(columns.size(), types.size());
        }
        types.forEach(type -> type.requireAllowedIn(SparkplugDataType.Context.DATASET_CELL));
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row.size() != types.size()) {
                throw DataSetLengthMismatchException.rowLength(i, types.size(), row.size());
            }
            for (int c = 0; c < row.size(); c++) {
                Object cell = row.get(c);
                if (cell != null && !types.get(c).getLogicalType().isInstance(cell)) {
                    throw SparkplugDecodeException.invalidValue(types.get(c), cell);
                }
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int numOfColumns() {
        return columns.size();
    }

    /**
     * 每行转换为以列名为键的 Map
     */
    public List<Map<String, Object>> toRowMaps() {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> mapped = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                mapped.put(columns.get(c), row.get(c));
            }
            result.add(mapped);
        }
        return result;
    }
}
