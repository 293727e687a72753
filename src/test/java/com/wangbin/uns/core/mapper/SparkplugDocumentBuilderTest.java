package com.wangbin.uns.core.mapper;

import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.Parameter;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.Template;
import com.wangbin.uns.core.sparkplug.model.TypedValue;
import com.wangbin.uns.core.sparkplug.session.SparkplugPayloadBuilder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SparkplugDocumentBuilderTest {

    @Test
    void templateRendersMembersAndParameters() {
        Template template = Template.builder()
                .templateRef("Motor")
                .metrics(List.of(Metric.of("rpm", SparkplugDataType.Int16, (short) 900, 1L)))
                .parameters(List.of(new Parameter("maxRpm", TypedValue.of(SparkplugDataType.Int32, 3000))))
                .build();

        Object rendered = SparkplugDocumentBuilder.render(TypedValue.of(SparkplugDataType.Template, template));

        assertEquals(Map.of("rpm", (short) 900, "parameters", Map.of("maxRpm", 3000)), rendered);
    }

    @Test
    void dateTimeRendersAsEpochMillis() {
        assertEquals(1234L, SparkplugDocumentBuilder.render(
                TypedValue.of(SparkplugDataType.DateTime, Instant.ofEpochMilli(1234L))));
        assertNull(SparkplugDocumentBuilder.render(TypedValue.ofNull(SparkplugDataType.DateTime)));
    }

    @Test
    void messageMapListsMetricsByName() {
        SparkplugPayload payload = new SparkplugPayloadBuilder(5L)
                .addMetric("a", SparkplugDataType.Boolean, true)
                .addNullMetric("b", SparkplugDataType.String)
                .build();

        Map<String, Object> message = SparkplugDocumentBuilder.toMessageMap(payload);

        assertEquals(5L, message.get("timestamp"));
        assertFalse(message.containsKey("seq"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> metrics = (List<Map<String, Object>>) message.get("metrics");
        assertEquals("a", metrics.get(0).get("name"));
        assertEquals(true, metrics.get(0).get("value"));
        assertEquals("Boolean", metrics.get(0).get("datatype"));
        assertEquals(true, metrics.get(1).get("is_null"));
        assertNull(metrics.get(1).get("value"));
    }
}
