package com.wangbin.uns.core.sparkplug.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Sparkplug B 载荷
 */
@Value
@Builder(toBuilder = true)
public class SparkplugPayload {
    Long timestamp;
    @Singular
    List<Metric> metrics;
    Long seq;
    String uuid;
    byte[] body;

    public Optional<Metric> findMetric(String name) {
        return metrics.stream().filter(metric -> name.equals(metric.getName())).findFirst();
    }

    public byte[] getBody() {
        return body == null ? null : Arrays.copyOf(body, body.length);
    }
}
