package com.wangbin.uns.core.config;

import com.wangbin.uns.common.constant.SparkplugConstant;
import com.wangbin.uns.common.constant.UnsConstant;
import com.wangbin.uns.core.graph.NestedAttributeMode;
import com.wangbin.uns.core.graph.TopicGraphTransformer;
import com.wangbin.uns.core.mapper.MetricNameMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UNS 集成服务配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "uns")
public class UnsProperties {

    /**
     * MQTT配置
     */
    private MqttConfig mqtt = new MqttConfig();

    /**
     * 图数据库配置
     */
    private GraphDbConfig graphdb = new GraphDbConfig();

    /**
     * Sparkplug 转 UNS 配置
     */
    private SparkplugConfig sparkplug = new SparkplugConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class MqttConfig {
        private String brokerUrl = "tcp://localhost:1883";
        private String clientId;
        private String username;
        private String password;
        private String version = "v5";
        private int qos = 1;
        private boolean cleanSession = true;
        private int connectionTimeout = 30;
        private int keepAliveInterval = 60;
        private boolean automaticReconnect = true;
        /**
         * 转换为属性 Map 时忽略的属性，键为 topic 过滤器（支持 + 和 #），值为属性名，嵌套属性用 "." 连接
         */
        private Map<String, List<String>> ignoredAttributes = new LinkedHashMap<>();
        /**
         * 作为时间戳的属性名
         */
        private String timestampAttribute = UnsConstant.DEFAULT_TIMESTAMP_ATTRIBUTE;
    }

    @Data
    public static class GraphDbConfig {
        private boolean enabled = false;
        private String uri = "bolt://localhost:7687";
        private String user = "neo4j";
        private String password;
        private String database;
        private List<String> topics = new ArrayList<>(List.of("#"));
        private List<String> unsNodeTypes = new ArrayList<>(UnsConstant.DEFAULT_UNS_NODE_TYPES);
        private List<String> spbNodeTypes = new ArrayList<>(UnsConstant.DEFAULT_SPB_NODE_TYPES);
        private String nestedAttributeNodeType = UnsConstant.DEFAULT_NESTED_ATTRIBUTE_NODE_TYPE;
        private NestedAttributeMode nestedAttributeMode = NestedAttributeMode.NODES;
        private int maxNestingDepth = TopicGraphTransformer.DEFAULT_MAX_NESTING_DEPTH;
        private int maxRetry = 5;
        /**
         * 重试间隔（毫秒）
         */
        private long retryInterval = 10000;
    }

    @Data
    public static class SparkplugConfig {
        private boolean enabled = false;
        private String topic = SparkplugConstant.SPARKPLUG_WILDCARD_TOPIC;
        /**
         * 转发到的 UNS topic 前缀，为空时不加前缀
         */
        private String unsPrefix;
        private MetricNameMode metricNameMode = MetricNameMode.SUB_TOPIC;
        private int publishQos = 1;
        private boolean retained = false;
    }
}
