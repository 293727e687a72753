package com.wangbin.uns.core.sparkplug.model;

import lombok.Builder;

import java.util.List;

/**
 * 模板：定义（definition）或实例（instance）。实例通过 templateRef 引用定义。
 * 指标列表和参数列表都可以为空。
 */
@Builder(toBuilder = true)
public record Template(String version,
                       List<Metric> metrics,
                       List<Parameter> parameters,
                       String templateRef,
                       Boolean definition) {

    public Template {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean isDefinition() {
        return Boolean.TRUE.equals(definition);
    }
}
