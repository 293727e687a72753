package com.wangbin.uns.core.mapper;

import com.wangbin.uns.common.exception.SparkplugDecodeException;
import com.wangbin.uns.common.exception.TopicFormatException;
import com.wangbin.uns.common.utils.JsonUtil;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.mqtt.MqttClientAdapter;
import com.wangbin.uns.core.sparkplug.codec.SparkplugPayloadCodec;
import com.wangbin.uns.core.sparkplug.model.DataSet;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import com.wangbin.uns.core.sparkplug.model.SparkplugTopic;
import com.wangbin.uns.core.sparkplug.session.SparkplugPayloadBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SparkplugUnsPublisherTest {

    private RecordingClient client;
    private UnsProperties.SparkplugConfig config;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
        config = new UnsProperties.SparkplugConfig();
    }

    private SparkplugUnsPublisher publisher() {
        return new SparkplugUnsPublisher(client, config, "timestamp");
    }

    private static byte[] devicePayload() {
        return SparkplugPayloadCodec.encode(new SparkplugPayloadBuilder(2000L)
                .seq(3)
                .addMetric("temperature", null, SparkplugDataType.Int32, 21, 1500L)
                .addMetric("motor/rpm", null, SparkplugDataType.Int32, 1200, 1800L)
                .addMetric("motor/state", null, SparkplugDataType.String, "RUNNING", 1700L)
                .build());
    }

    @Test
    void metricNamesBecomeSubTopics() {
        int published = publisher().transformAndPublish("spBv1.0/G1/DDATA/E1/D1", devicePayload());

        assertEquals(2, published);
        assertEquals(List.of("G1/E1/D1", "G1/E1/D1/motor"), client.topics());
        Map<String, Object> root = client.document(0);
        assertEquals(21, root.get("temperature"));
        assertEquals(1500, ((Number) root.get("timestamp")).intValue());
        Map<String, Object> motor = client.document(1);
        assertEquals(1200, motor.get("rpm"));
        assertEquals("RUNNING", motor.get("state"));
        assertEquals(1800, ((Number) motor.get("timestamp")).intValue());
    }

    @Test
    void prefixIsPrependedWithoutTrailingSeparator() {
        config.setUnsPrefix("uns/");

        publisher().transformAndPublish("spBv1.0/G1/NDATA/E1", devicePayload());

        assertEquals(List.of("uns/G1/E1", "uns/G1/E1/motor"), client.topics());
    }

    @Test
    void flatModeKeepsFullMetricName() {
        config.setMetricNameMode(MetricNameMode.FLAT);

        publisher().transformAndPublish("spBv1.0/G1/DBIRTH/E1/D1", devicePayload());

        assertEquals(List.of("G1/E1/D1"), client.topics());
        Map<String, Object> document = client.document(0);
        assertEquals(1200, document.get("motor/rpm"));
        assertEquals("RUNNING", document.get("motor/state"));
    }

    @Test
    void deathAndCommandMessagesAreNotRepublished() {
        assertEquals(0, publisher().transformAndPublish("spBv1.0/G1/NDEATH/E1", devicePayload()));
        assertEquals(0, publisher().transformAndPublish("spBv1.0/G1/DCMD/E1/D1", devicePayload()));
        assertTrue(client.published.isEmpty());
    }

    @Test
    void historicalMetricsAreSkipped() {
        SparkplugPayload payload = new SparkplugPayloadBuilder(2000L)
                .addMetric("live", null, SparkplugDataType.Int64, 5L, 1000L)
                .addHistoricalMetric("live", SparkplugDataType.Int64, 4L, 3000L)
                .build();

        Map<String, Map<String, Object>> documents =
                publisher().transform(SparkplugTopic.parse("spBv1.0/G1/NDATA/E1"), payload);

        assertEquals(Map.of("live", 5L, "timestamp", 1000L), documents.get("G1/E1"));
    }

    @Test
    void compositeValuesAreRendered() {
        DataSet dataSet = new DataSet(List.of("id", "label"),
                List.of(SparkplugDataType.Int32, SparkplugDataType.String),
                List.of(List.of(1, "a"), Arrays.asList(2, null)));
        SparkplugPayload payload = new SparkplugPayloadBuilder(2000L)
                .addDataSetMetric("table", dataSet)
                .addMetric("raw", SparkplugDataType.Bytes, new byte[]{1, 2, 3})
                .addNullMetric("missing", SparkplugDataType.Double)
                .build();

        Map<String, Object> document = publisher()
                .transform(SparkplugTopic.parse("spBv1.0/G1/NDATA/E1"), payload)
                .get("G1/E1");

        Map<String, Object> secondRow = new LinkedHashMap<>();
        secondRow.put("id", 2);
        secondRow.put("label", null);
        assertEquals(List.of(Map.of("id", 1, "label", "a"), secondRow), document.get("table"));
        assertEquals("AQID", document.get("raw"));
        assertTrue(document.containsKey("missing"));
        assertNull(document.get("missing"));
        assertEquals(2000L, document.get("timestamp"));
    }

    @Test
    void invalidTopicIsRejected() {
        SparkplugUnsPublisher publisher = publisher();

        assertThrows(TopicFormatException.class,
                () -> publisher.transformAndPublish("spBv1.0/G1/NDATA", devicePayload()));
        assertThrows(TopicFormatException.class,
                () -> publisher.transformAndPublish("spBv2.0/G1/NDATA/E1", devicePayload()));
    }

    @Test
    void undecodablePayloadIsRejected() {
        SparkplugUnsPublisher publisher = publisher();

        assertThrows(SparkplugDecodeException.class,
                () -> publisher.transformAndPublish("spBv1.0/G1/NDATA/E1", new byte[]{0x0A, 0x05, 0x01}));
        assertTrue(client.published.isEmpty());
    }

    @Test
    void failedPublishDoesNotStopOtherDocuments() {
        client.failOn = "G1/E1/D1";

        int published = publisher().transformAndPublish("spBv1.0/G1/DDATA/E1/D1", devicePayload());

        assertEquals(1, published);
        assertEquals(List.of("G1/E1/D1/motor"), client.topics());
    }

    private static class RecordingClient implements MqttClientAdapter {
        private final List<Object[]> published = new ArrayList<>();
        private String failOn;

        @Override
        public void connect() {
        }

        @Override
        public void disconnect() {
        }

        @Override
        public void publish(String topic, byte[] payload, int qos, boolean retained) throws Exception {
            if (topic.equals(failOn)) {
                throw new IllegalStateException("broker rejected " + topic);
            }
            published.add(new Object[]{topic, payload});
        }

        @Override
        public void subscribe(String topic, int qos) {
        }

        @Override
        public void unsubscribe(String topic) {
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        List<String> topics() {
            return published.stream().map(entry -> (String) entry[0]).toList();
        }

        Map<String, Object> document(int index) {
            return JsonUtil.parseMap(new String((byte[]) published.get(index)[1], StandardCharsets.UTF_8));
        }
    }
}
