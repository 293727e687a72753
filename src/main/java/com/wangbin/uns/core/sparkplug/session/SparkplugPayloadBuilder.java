package com.wangbin.uns.core.sparkplug.session;

import com.wangbin.uns.core.sparkplug.model.DataSet;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.PropertySet;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.Template;
import com.wangbin.uns.core.sparkplug.model.TypedValue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * 载荷构建器，指标按添加顺序输出。未指定时间戳的指标使用载荷时间戳。
 */
public class SparkplugPayloadBuilder {

    private final long timestamp;
    private final List<Metric> metrics = new ArrayList<>();
    private Long seq;
    private String uuid;

    public SparkplugPayloadBuilder(long timestamp) {
        this.timestamp = timestamp;
    }

    public static SparkplugPayloadBuilder create(LongSupplier clock) {
        return new SparkplugPayloadBuilder(clock.getAsLong());
    }

    public SparkplugPayloadBuilder seq(long seq) {
        this.seq = seq;
        return this;
    }

    public SparkplugPayloadBuilder uuid(String uuid) {
        this.uuid = uuid;
        return this;
    }

    public SparkplugPayloadBuilder metric(Metric metric) {
        metrics.add(metric);
        return this;
    }

    public SparkplugPayloadBuilder metrics(List<Metric> more) {
        metrics.addAll(more);
        return this;
    }

    public SparkplugPayloadBuilder addMetric(String name, SparkplugDataType dataType, Object value) {
        return addMetric(name, null, dataType, value, timestamp);
    }

    public SparkplugPayloadBuilder addMetric(String name, Long alias, SparkplugDataType dataType, Object value,
                                             long metricTimestamp) {
        return metric(Metric.builder()
                .name(name)
                .alias(alias)
                .timestamp(metricTimestamp)
                .value(value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value))
                .build());
    }

    /**
     * 显式空值指标
     */
    public SparkplugPayloadBuilder addNullMetric(String name, SparkplugDataType dataType) {
        return addMetric(name, dataType, null);
    }

    /**
     * 历史值指标，消费方不应把它当作当前值
     */
    public SparkplugPayloadBuilder addHistoricalMetric(String name, SparkplugDataType dataType, Object value,
                                                       long metricTimestamp) {
        return metric(Metric.builder()
                .name(name)
                .timestamp(metricTimestamp)
                .historical(true)
                .value(value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value))
                .build());
    }

    public SparkplugPayloadBuilder addDataSetMetric(String name, DataSet dataSet) {
        return addMetric(name, SparkplugDataType.DataSet, dataSet);
    }

    public SparkplugPayloadBuilder addTemplateMetric(String name, Template template) {
        return addMetric(name, SparkplugDataType.Template, template);
    }

    public SparkplugPayloadBuilder addMetricWithProperties(String name, SparkplugDataType dataType, Object value,
                                                           PropertySet properties) {
        return metric(Metric.builder()
                .name(name)
                .timestamp(timestamp)
                .properties(properties)
                .value(value == null ? TypedValue.ofNull(dataType) : TypedValue.of(dataType, value))
                .build());
    }

    public SparkplugPayload build() {
        return SparkplugPayload.builder()
                .timestamp(timestamp)
                .seq(seq)
                .uuid(uuid)
                .metrics(metrics)
                .build();
    }
}
