package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.exception.GraphPersistenceException;
import com.wangbin.uns.common.exception.GraphStoreException;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.sparkplug.model.SparkplugTopic;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * 将 MQTT 消息持久化到图数据库。
 * <p>
 * 可重试的错误（服务不可用、瞬时错误、会话过期）最多重试 maxRetry 次，每次间隔 retryInterval 毫秒，
 * 超过次数后抛出 {@link GraphPersistenceException}；其它错误直接抛出。
 */
@Slf4j
public class GraphDbHandler {

    private final GraphDatabase database;
    private final TopicGraphTransformer transformer;
    private final UnsProperties.GraphDbConfig config;

    public GraphDbHandler(GraphDatabase database, UnsProperties.GraphDbConfig config) {
        this(database, new TopicGraphTransformer(config.getMaxNestingDepth()), config);
    }

    public GraphDbHandler(GraphDatabase database, TopicGraphTransformer transformer, UnsProperties.GraphDbConfig config) {
        this.database = database;
        this.transformer = transformer;
        this.config = config;
    }

    /**
     * 持久化一条消息，topic 的每一层成为一个节点，消息属性保存在叶子节点上
     *
     * @param topic     消息 topic
     * @param message   消息属性
     * @param timestamp 接收时间（毫秒）
     */
    public void persistMessage(String topic, Map<String, ?> message, long timestamp) {
        List<String> levelNames = SparkplugTopic.isSparkplugTopic(topic)
                ? config.getSpbNodeTypes()
                : config.getUnsNodeTypes();
        Map<String, ?> attributes = config.getNestedAttributeMode() == NestedAttributeMode.FLATTEN
                ? AttributeFlattener.flatten(message)
                : message;
        String compositeLabel = config.getNestedAttributeNodeType();

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                database.executeWrite(store ->
                        transformer.transform(store, topic, attributes, levelNames, compositeLabel, timestamp));
                log.debug("消息已写入图数据库: topic={}, 尝试次数={}", topic, attempt);
                return;
            } catch (GraphStoreException e) {
                if (!e.isTransientError()) {
                    log.error("图数据库写入失败, 不可重试: topic={}, error={}", topic, e.getMessage());
                    throw e;
                }
                if (attempt > config.getMaxRetry()) {
                    log.error("图数据库写入重试次数超过 {}: topic={}", config.getMaxRetry(), topic, e);
                    throw new GraphPersistenceException(topic, attempt, e);
                }
                log.warn("图数据库写入失败, {}ms 后第 {} 次重试: topic={}, error={}",
                        config.getRetryInterval(), attempt, topic, e.getMessage());
                pause(topic, attempt, e);
            }
        }
    }

    private void pause(String topic, int attempt, GraphStoreException cause) {
        if (config.getRetryInterval() <= 0) {
            return;
        }
        try {
            Thread.sleep(config.getRetryInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphPersistenceException(topic, attempt, cause);
        }
    }

    public void close() {
        database.close();
    }
}
