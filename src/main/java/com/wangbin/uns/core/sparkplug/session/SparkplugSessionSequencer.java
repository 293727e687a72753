package com.wangbin.uns.core.sparkplug.session;

import com.wangbin.uns.common.constant.SparkplugConstant;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * 单个边缘节点的 Sparkplug 会话序号生成器。
 * <p>
 * seq 与 bdSeq 是两个独立的计数器，取值 0-255 循环，首次调用返回 0。
 * 每个边缘节点一个实例，方法均为同步方法。
 */
@Slf4j
public class SparkplugSessionSequencer {

    private final LongSupplier clock;
    private int seq;
    private int bdSeq;

    public SparkplugSessionSequencer() {
        this(System::currentTimeMillis);
    }

    public SparkplugSessionSequencer(LongSupplier clock) {
        this.clock = clock;
    }

    /**
     * 返回当前 seq 并前进一位
     */
    public synchronized int nextSeq() {
        int current = seq;
        seq = (seq + 1) % SparkplugConstant.SEQUENCE_MODULUS;
        return current;
    }

    /**
     * 返回当前 bdSeq 并前进一位
     */
    public synchronized int nextBdSeq() {
        int current = bdSeq;
        bdSeq = (bdSeq + 1) % SparkplugConstant.SEQUENCE_MODULUS;
        return current;
    }

    /**
     * NDEATH 载荷（连接时作为遗嘱注册），只包含 bdSeq 指标
     */
    public synchronized SparkplugPayload buildDeathPayload() {
        SparkplugPayload payload = SparkplugPayloadBuilder.create(clock)
                .addMetric(SparkplugConstant.BD_SEQ_METRIC, SparkplugDataType.Int64, (long) nextBdSeq())
                .build();
        log.debug("生成 NDEATH 载荷, bdSeq={}", payload.getMetrics().get(0).getLogicalValue().orElse(null));
        return payload;
    }

    /**
     * NBIRTH 载荷：bdSeq 指标在前，随后是调用方提供的指标。出生消息会再消耗一次 bdSeq。
     */
    public synchronized SparkplugPayload buildBirthPayload(Metric... metrics) {
        return buildBirthPayload(List.of(metrics));
    }

    public synchronized SparkplugPayload buildBirthPayload(List<Metric> metrics) {
        SparkplugPayload payload = SparkplugPayloadBuilder.create(clock)
                .seq(nextSeq())
                .addMetric(SparkplugConstant.BD_SEQ_METRIC, SparkplugDataType.Int64, (long) nextBdSeq())
                .metrics(metrics)
                .build();
        log.debug("生成 NBIRTH 载荷, seq={}, 指标数={}", payload.getSeq(), payload.getMetrics().size());
        return payload;
    }

    public synchronized SparkplugPayload buildNodeDataPayload(List<Metric> metrics) {
        return withSeq(metrics);
    }

    public synchronized SparkplugPayload buildDeviceBirthPayload(List<Metric> metrics) {
        return withSeq(metrics);
    }

    public synchronized SparkplugPayload buildDeviceDataPayload(List<Metric> metrics) {
        return withSeq(metrics);
    }

    private SparkplugPayload withSeq(List<Metric> metrics) {
        return SparkplugPayloadBuilder.create(clock)
                .seq(nextSeq())
                .metrics(metrics)
                .build();
    }
}
