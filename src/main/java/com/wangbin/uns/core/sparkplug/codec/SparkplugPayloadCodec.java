package com.wangbin.uns.core.sparkplug.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.wangbin.uns.common.exception.DataSetLengthMismatchException;
import com.wangbin.uns.common.exception.SparkplugDecodeException;
import com.wangbin.uns.core.sparkplug.model.DataSet;
import com.wangbin.uns.core.sparkplug.model.MetaData;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.Parameter;
import com.wangbin.uns.core.sparkplug.model.PropertySet;
import com.wangbin.uns.core.sparkplug.model.PropertyValue;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType.Context;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.Template;
import com.wangbin.uns.core.sparkplug.model.TypedValue;
import com.wangbin.uns.core.sparkplug.model.WireValue;
import com.wangbin.uns.core.sparkplug.protobuf.SparkplugBProto.Payload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparkplug B 载荷编解码：protobuf 二进制 &lt;-&gt; {@link SparkplugPayload}。
 * <p>
 * 模板、属性集合的嵌套深度上限为 {@link #MAX_NESTING_DEPTH}，超过时按解码失败处理。
 */
@Slf4j
public final class SparkplugPayloadCodec {

    public static final int MAX_NESTING_DEPTH = 64;

    private SparkplugPayloadCodec() {
    }

    // ==================== 解码 ====================

    public static SparkplugPayload decode(byte[] bytes) {
        if (bytes == null) {
            throw new SparkplugDecodeException("Sparkplug B payload is null");
        }
        Payload proto;
        try {
            proto = Payload.parseFrom(bytes);
        } catch (InvalidProtocolBufferException e) {
            throw new SparkplugDecodeException("Malformed Sparkplug B payload (" + bytes.length + " bytes)", e);
        }
        return fromProto(proto);
    }

    public static SparkplugPayload fromProto(Payload proto) {
        SparkplugPayload.SparkplugPayloadBuilder builder = SparkplugPayload.builder()
                .timestamp(proto.hasTimestamp() ? proto.getTimestamp() : null)
                .seq(proto.hasSeq() ? proto.getSeq() : null)
                .uuid(proto.hasUuid() ? proto.getUuid() : null)
                .body(proto.hasBody() ? proto.getBody().toByteArray() : null);
        for (Payload.Metric metric : proto.getMetricsList()) {
            builder.metric(decodeMetric(metric, 0));
        }
        return builder.build();
    }

    static Metric decodeMetric(Payload.Metric proto, int depth) {
        SparkplugDataType type = SparkplugDataType.fromCode(proto.getDatatype()).requireAllowedIn(Context.METRIC);
        TypedValue value;
        if (proto.getIsNull()) {
            // 显式空值时不解析槽内内容
            value = TypedValue.ofNull(type);
        } else {
            value = SparkplugValueCodec.decode(type, metricWire(proto, depth), false);
        }
        return Metric.builder()
                .name(proto.hasName() ? proto.getName() : null)
                .alias(proto.hasAlias() ? proto.getAlias() : null)
                .timestamp(proto.hasTimestamp() ? proto.getTimestamp() : null)
                .historical(proto.getIsHistorical())
                .transientValue(proto.getIsTransient())
                .metadata(proto.hasMetadata() ? decodeMetaData(proto.getMetadata()) : null)
                .properties(proto.hasProperties() ? decodePropertySet(proto.getProperties(), depth + 1) : null)
                .value(value)
                .build();
    }

    private static WireValue metricWire(Payload.Metric proto, int depth) {
        return switch (proto.getValueCase()) {
            case INT_VALUE -> new WireValue.IntSlot(proto.getIntValue());
            case LONG_VALUE -> new WireValue.LongSlot(proto.getLongValue());
            case FLOAT_VALUE -> new WireValue.FloatSlot(proto.getFloatValue());
            case DOUBLE_VALUE -> new WireValue.DoubleSlot(proto.getDoubleValue());
            case BOOLEAN_VALUE -> new WireValue.BooleanSlot(proto.getBooleanValue());
            case STRING_VALUE -> new WireValue.StringSlot(proto.getStringValue());
            case BYTES_VALUE -> new WireValue.BytesSlot(proto.getBytesValue().toByteArray());
            case DATASET_VALUE -> new WireValue.DataSetSlot(decodeDataSet(proto.getDatasetValue()));
            case TEMPLATE_VALUE -> new WireValue.TemplateSlot(decodeTemplate(proto.getTemplateValue(), depth + 1));
            case EXTENSION_VALUE -> throw SparkplugDecodeException.unsupportedDataType("extension", "metric " + proto.getName());
            case VALUE_NOT_SET -> new WireValue.Empty();
        };
    }

    static DataSet decodeDataSet(Payload.DataSet proto) {
        // 先读取列类型与列名
        List<SparkplugDataType> types = new ArrayList<>(proto.getTypesCount());
        for (Integer code : proto.getTypesList()) {
            types.add(SparkplugDataType.fromCode(code).requireAllowedIn(Context.DATASET_CELL));
        }
        List<String> columns = proto.getColumnsList();
        if (columns.size() != types.size()) {
            throw DataSetLengthMismatchException.columnLength(columns.size(), types.size());
        }
        if (proto.hasNumOfColumns() && proto.getNumOfColumns() != types.size()) {
            throw DataSetLengthMismatchException.columnLength((int) proto.getNumOfColumns(), types.size());
        }
        List<List<Object>> rows = new ArrayList<>(proto.getRowsCount());
        for (int r = 0; r < proto.getRowsCount(); r++) {
            Payload.DataSet.Row row = proto.getRows(r);
            if (row.getElementsCount() != types.size()) {
                throw DataSetLengthMismatchException.rowLength(r, types.size(), row.getElementsCount());
            }
            List<Object> cells = new ArrayList<>(types.size());
            for (int c = 0; c < types.size(); c++) {
                cells.add(SparkplugValueCodec.decode(types.get(c), dataSetWire(row.getElements(c))));
            }
            rows.add(cells);
        }
        return new DataSet(columns, types, rows);
    }

    private static WireValue dataSetWire(Payload.DataSet.DataSetValue proto) {
        return switch (proto.getValueCase()) {
            case INT_VALUE -> new WireValue.IntSlot(proto.getIntValue());
            case LONG_VALUE -> new WireValue.LongSlot(proto.getLongValue());
            case FLOAT_VALUE -> new WireValue.FloatSlot(proto.getFloatValue());
            case DOUBLE_VALUE -> new WireValue.DoubleSlot(proto.getDoubleValue());
            case BOOLEAN_VALUE -> new WireValue.BooleanSlot(proto.getBooleanValue());
            case STRING_VALUE -> new WireValue.StringSlot(proto.getStringValue());
            case EXTENSION_VALUE -> throw SparkplugDecodeException.unsupportedDataType("extension", "dataset cell");
            case VALUE_NOT_SET -> new WireValue.Empty();
        };
    }

    static Template decodeTemplate(Payload.Template proto, int depth) {
        checkDepth(depth);
        List<Metric> metrics = new ArrayList<>(proto.getMetricsCount());
        for (Payload.Metric metric : proto.getMetricsList()) {
            metrics.add(decodeMetric(metric, depth));
        }
        List<Parameter> parameters = new ArrayList<>(proto.getParametersCount());
        for (Payload.Template.Parameter parameter : proto.getParametersList()) {
            SparkplugDataType type = SparkplugDataType.fromCode(parameter.getType())
                    .requireAllowedIn(Context.TEMPLATE_PARAMETER);
            TypedValue value = SparkplugValueCodec.decode(type, parameterWire(parameter), false);
            parameters.add(new Parameter(parameter.getName(), value));
        }
        return Template.builder()
                .version(proto.hasVersion() ? proto.getVersion() : null)
                .metrics(metrics)
                .parameters(parameters)
                .templateRef(proto.hasTemplateRef() ? proto.getTemplateRef() : null)
                .definition(proto.hasIsDefinition() ? proto.getIsDefinition() : null)
                .build();
    }

    private static WireValue parameterWire(Payload.Template.Parameter proto) {
        return switch (proto.getValueCase()) {
            case INT_VALUE -> new WireValue.IntSlot(proto.getIntValue());
            case LONG_VALUE -> new WireValue.LongSlot(proto.getLongValue());
            case FLOAT_VALUE -> new WireValue.FloatSlot(proto.getFloatValue());
            case DOUBLE_VALUE -> new WireValue.DoubleSlot(proto.getDoubleValue());
            case BOOLEAN_VALUE -> new WireValue.BooleanSlot(proto.getBooleanValue());
            case STRING_VALUE -> new WireValue.StringSlot(proto.getStringValue());
            case EXTENSION_VALUE -> throw SparkplugDecodeException.unsupportedDataType("extension", "template parameter " + proto.getName());
            case VALUE_NOT_SET -> new WireValue.Empty();
        };
    }

    static PropertySet decodePropertySet(Payload.PropertySet proto, int depth) {
        checkDepth(depth);
        if (proto.getKeysCount() != proto.getValuesCount()) {
            throw new SparkplugDecodeException("PropertySet has " + proto.getKeysCount() + " keys but "
                    + proto.getValuesCount() + " values");
        }
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        for (int i = 0; i < proto.getKeysCount(); i++) {
            Payload.PropertyValue value = proto.getValues(i);
            SparkplugDataType type = SparkplugDataType.fromCode(value.getType()).requireAllowedIn(Context.PROPERTY_VALUE);
            TypedValue typed = value.getIsNull()
                    ? TypedValue.ofNull(type)
                    : SparkplugValueCodec.decode(type, propertyWire(value, depth), false);
            properties.put(proto.getKeys(i), new PropertyValue(typed));
        }
        return new PropertySet(properties);
    }

    private static WireValue propertyWire(Payload.PropertyValue proto, int depth) {
        return switch (proto.getValueCase()) {
            case INT_VALUE -> new WireValue.IntSlot(proto.getIntValue());
            case LONG_VALUE -> new WireValue.LongSlot(proto.getLongValue());
            case FLOAT_VALUE -> new WireValue.FloatSlot(proto.getFloatValue());
            case DOUBLE_VALUE -> new WireValue.DoubleSlot(proto.getDoubleValue());
            case BOOLEAN_VALUE -> new WireValue.BooleanSlot(proto.getBooleanValue());
            case STRING_VALUE -> new WireValue.StringSlot(proto.getStringValue());
            case PROPERTYSET_VALUE -> new WireValue.PropertySetSlot(decodePropertySet(proto.getPropertysetValue(), depth + 1));
            case PROPERTYSETS_VALUE -> {
                List<PropertySet> sets = new ArrayList<>();
                for (Payload.PropertySet set : proto.getPropertysetsValue().getPropertysetList()) {
                    sets.add(decodePropertySet(set, depth + 1));
                }
                yield new WireValue.PropertySetListSlot(sets);
            }
            case EXTENSION_VALUE -> throw SparkplugDecodeException.unsupportedDataType("extension", "property value");
            case VALUE_NOT_SET -> new WireValue.Empty();
        };
    }

    static MetaData decodeMetaData(Payload.MetaData proto) {
        return MetaData.builder()
                .multiPart(proto.hasIsMultiPart() ? proto.getIsMultiPart() : null)
                .contentType(proto.hasContentType() ? proto.getContentType() : null)
                .size(proto.hasSize() ? proto.getSize() : null)
                .seq(proto.hasSeq() ? proto.getSeq() : null)
                .fileName(proto.hasFileName() ? proto.getFileName() : null)
                .fileType(proto.hasFileType() ? proto.getFileType() : null)
                .md5(proto.hasMd5() ? proto.getMd5() : null)
                .description(proto.hasDescription() ? proto.getDescription() : null)
                .build();
    }

    private static void checkDepth(int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new SparkplugDecodeException("Sparkplug payload nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
    }

    // ==================== 编码 ====================

    public static byte[] encode(SparkplugPayload payload) {
        return toProto(payload).toByteArray();
    }

    public static Payload toProto(SparkplugPayload payload) {
        Payload.Builder builder = Payload.newBuilder();
        if (payload.getTimestamp() != null) {
            builder.setTimestamp(payload.getTimestamp());
        }
        if (payload.getSeq() != null) {
            builder.setSeq(payload.getSeq());
        }
        if (payload.getUuid() != null) {
            builder.setUuid(payload.getUuid());
        }
        if (payload.getBody() != null) {
            builder.setBody(ByteString.copyFrom(payload.getBody()));
        }
        for (Metric metric : payload.getMetrics()) {
            builder.addMetrics(encodeMetric(metric));
        }
        return builder.build();
    }

    static Payload.Metric encodeMetric(Metric metric) {
        SparkplugDataType type = metric.getDataType().requireAllowedIn(Context.METRIC);
        Payload.Metric.Builder builder = Payload.Metric.newBuilder().setDatatype(type.getCode());
        if (metric.getName() != null) {
            builder.setName(metric.getName());
        }
        if (metric.getAlias() != null) {
            builder.setAlias(metric.getAlias());
        }
        if (metric.getTimestamp() != null) {
            builder.setTimestamp(metric.getTimestamp());
        }
        if (metric.isHistorical()) {
            builder.setIsHistorical(true);
        }
        if (metric.isTransientValue()) {
            builder.setIsTransient(true);
        }
        if (metric.getMetadata() != null) {
            builder.setMetadata(encodeMetaData(metric.getMetadata()));
        }
        if (metric.getProperties() != null) {
            builder.setProperties(encodePropertySet(metric.getProperties()));
        }
        if (metric.isNull()) {
            return builder.setIsNull(true).build();
        }
        WireValue wire = SparkplugValueCodec.encode(metric.getValue());
        if (wire instanceof WireValue.IntSlot slot) {
            builder.setIntValue(slot.bits());
        } else if (wire instanceof WireValue.LongSlot slot) {
            builder.setLongValue(slot.bits());
        } else if (wire instanceof WireValue.FloatSlot slot) {
            builder.setFloatValue(slot.value());
        } else if (wire instanceof WireValue.DoubleSlot slot) {
            builder.setDoubleValue(slot.value());
        } else if (wire instanceof WireValue.BooleanSlot slot) {
            builder.setBooleanValue(slot.value());
        } else if (wire instanceof WireValue.StringSlot slot) {
            builder.setStringValue(slot.value());
        } else if (wire instanceof WireValue.BytesSlot slot) {
            builder.setBytesValue(ByteString.copyFrom(slot.value()));
        } else if (wire instanceof WireValue.DataSetSlot slot) {
            builder.setDatasetValue(encodeDataSet(slot.value()));
        } else if (wire instanceof WireValue.TemplateSlot slot) {
            builder.setTemplateValue(encodeTemplate(slot.value()));
        } else {
            throw SparkplugDecodeException.slotMismatch(type, type.getSlot().name(), wire.slot().name());
        }
        return builder.build();
    }

    static Payload.DataSet encodeDataSet(DataSet dataSet) {
        Payload.DataSet.Builder builder = Payload.DataSet.newBuilder()
                .setNumOfColumns(dataSet.numOfColumns())
                .addAllColumns(dataSet.columns());
        for (SparkplugDataType type : dataSet.types()) {
            builder.addTypes(type.getCode());
        }
        for (List<Object> row : dataSet.rows()) {
            Payload.DataSet.Row.Builder rowBuilder = Payload.DataSet.Row.newBuilder();
            for (int c = 0; c < row.size(); c++) {
                SparkplugDataType type = dataSet.types().get(c);
                WireValue wire = SparkplugValueCodec.encode(type, row.get(c));
                Payload.DataSet.DataSetValue.Builder cell = Payload.DataSet.DataSetValue.newBuilder();
                if (wire instanceof WireValue.IntSlot slot) {
                    cell.setIntValue(slot.bits());
                } else if (wire instanceof WireValue.LongSlot slot) {
                    cell.setLongValue(slot.bits());
                } else if (wire instanceof WireValue.FloatSlot slot) {
                    cell.setFloatValue(slot.value());
                } else if (wire instanceof WireValue.DoubleSlot slot) {
                    cell.setDoubleValue(slot.value());
                } else if (wire instanceof WireValue.BooleanSlot slot) {
                    cell.setBooleanValue(slot.value());
                } else if (wire instanceof WireValue.StringSlot slot) {
                    cell.setStringValue(slot.value());
                } else if (!(wire instanceof WireValue.Empty)) {
                    throw SparkplugDecodeException.slotMismatch(type, type.getSlot().name(), wire.slot().name());
                }
                rowBuilder.addElements(cell);
            }
            builder.addRows(rowBuilder);
        }
        return builder.build();
    }

    static Payload.Template encodeTemplate(Template template) {
        Payload.Template.Builder builder = Payload.Template.newBuilder();
        if (template.version() != null) {
            builder.setVersion(template.version());
        }
        for (Metric metric : template.metrics()) {
            builder.addMetrics(encodeMetric(metric));
        }
        for (Parameter parameter : template.parameters()) {
            SparkplugDataType type = parameter.value().dataType();
            Payload.Template.Parameter.Builder param = Payload.Template.Parameter.newBuilder()
                    .setType(type.getCode());
            if (parameter.name() != null) {
                param.setName(parameter.name());
            }
            WireValue wire = SparkplugValueCodec.encode(parameter.value());
            if (wire instanceof WireValue.IntSlot slot) {
                param.setIntValue(slot.bits());
            } else if (wire instanceof WireValue.LongSlot slot) {
                param.setLongValue(slot.bits());
            } else if (wire instanceof WireValue.FloatSlot slot) {
                param.setFloatValue(slot.value());
            } else if (wire instanceof WireValue.DoubleSlot slot) {
                param.setDoubleValue(slot.value());
            } else if (wire instanceof WireValue.BooleanSlot slot) {
                param.setBooleanValue(slot.value());
            } else if (wire instanceof WireValue.StringSlot slot) {
                param.setStringValue(slot.value());
            } else if (!(wire instanceof WireValue.Empty)) {
                throw SparkplugDecodeException.slotMismatch(type, type.getSlot().name(), wire.slot().name());
            }
            builder.addParameters(param);
        }
        if (template.templateRef() != null) {
            builder.setTemplateRef(template.templateRef());
        }
        if (template.definition() != null) {
            builder.setIsDefinition(template.definition());
        }
        return builder.build();
    }

    static Payload.PropertySet encodePropertySet(PropertySet propertySet) {
        Payload.PropertySet.Builder builder = Payload.PropertySet.newBuilder();
        propertySet.properties().forEach((key, property) -> {
            builder.addKeys(key);
            builder.addValues(encodePropertyValue(property));
        });
        return builder.build();
    }

    private static Payload.PropertyValue encodePropertyValue(PropertyValue property) {
        SparkplugDataType type = property.dataType();
        Payload.PropertyValue.Builder builder = Payload.PropertyValue.newBuilder().setType(type.getCode());
        if (property.isNull()) {
            return builder.setIsNull(true).build();
        }
        WireValue wire = SparkplugValueCodec.encode(property.value());
        if (wire instanceof WireValue.IntSlot slot) {
            builder.setIntValue(slot.bits());
        } else if (wire instanceof WireValue.LongSlot slot) {
            builder.setLongValue(slot.bits());
        } else if (wire instanceof WireValue.FloatSlot slot) {
            builder.setFloatValue(slot.value());
        } else if (wire instanceof WireValue.DoubleSlot slot) {
            builder.setDoubleValue(slot.value());
        } else if (wire instanceof WireValue.BooleanSlot slot) {
            builder.setBooleanValue(slot.value());
        } else if (wire instanceof WireValue.StringSlot slot) {
            builder.setStringValue(slot.value());
        } else if (wire instanceof WireValue.PropertySetSlot slot) {
            builder.setPropertysetValue(encodePropertySet(slot.value()));
        } else if (wire instanceof WireValue.PropertySetListSlot slot) {
            Payload.PropertySetList.Builder list = Payload.PropertySetList.newBuilder();
            for (PropertySet set : slot.value()) {
                list.addPropertyset(encodePropertySet(set));
            }
            builder.setPropertysetsValue(list);
        } else {
            throw SparkplugDecodeException.slotMismatch(type, type.getSlot().name(), wire.slot().name());
        }
        return builder.build();
    }

    static Payload.MetaData encodeMetaData(MetaData metaData) {
        Payload.MetaData.Builder builder = Payload.MetaData.newBuilder();
        if (metaData.getMultiPart() != null) {
            builder.setIsMultiPart(metaData.getMultiPart());
        }
        if (metaData.getContentType() != null) {
            builder.setContentType(metaData.getContentType());
        }
        if (metaData.getSize() != null) {
            builder.setSize(metaData.getSize());
        }
        if (metaData.getSeq() != null) {
            builder.setSeq(metaData.getSeq());
        }
        if (metaData.getFileName() != null) {
            builder.setFileName(metaData.getFileName());
        }
        if (metaData.getFileType() != null) {
            builder.setFileType(metaData.getFileType());
        }
        if (metaData.getMd5() != null) {
            builder.setMd5(metaData.getMd5());
        }
        if (metaData.getDescription() != null) {
            builder.setDescription(metaData.getDescription());
        }
        return builder.build();
    }
}
