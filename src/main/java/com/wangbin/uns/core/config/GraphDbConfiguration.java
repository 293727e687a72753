package com.wangbin.uns.core.config;

import com.wangbin.uns.core.graph.GraphDatabase;
import com.wangbin.uns.core.graph.GraphDbHandler;
import com.wangbin.uns.core.graph.neo4j.Neo4jGraphDatabase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 图数据库配置类，uns.graphdb.enabled=true 时生效
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "uns.graphdb", name = "enabled", havingValue = "true")
public class GraphDbConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(GraphDatabase.class)
    public GraphDatabase graphDatabase(UnsProperties properties) {
        log.info("连接图数据库: {}", properties.getGraphdb().getUri());
        return new Neo4jGraphDatabase(properties.getGraphdb());
    }

    @Bean
    public GraphDbHandler graphDbHandler(GraphDatabase graphDatabase, UnsProperties properties) {
        return new GraphDbHandler(graphDatabase, properties.getGraphdb());
    }
}
