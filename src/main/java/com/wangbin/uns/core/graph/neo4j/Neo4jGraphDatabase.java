package com.wangbin.uns.core.graph.neo4j;

import com.wangbin.uns.common.exception.GraphStoreException;
import com.wangbin.uns.core.config.UnsProperties;
import com.wangbin.uns.core.graph.GraphDatabase;
import com.wangbin.uns.core.graph.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;

import java.util.function.Consumer;

/**
 * Neo4j 图数据库连接
 */
@Slf4j
public class Neo4jGraphDatabase implements GraphDatabase {

    private final Driver driver;
    private final SessionConfig sessionConfig;

    public Neo4jGraphDatabase(UnsProperties.GraphDbConfig config) {
        this(org.neo4j.driver.GraphDatabase.driver(config.getUri(),
                        AuthTokens.basic(config.getUser(), config.getPassword() == null ? "" : config.getPassword())),
                config.getDatabase());
    }

    public Neo4jGraphDatabase(Driver driver, String database) {
        this.driver = driver;
        this.sessionConfig = database == null || database.isBlank()
                ? SessionConfig.defaultConfig()
                : SessionConfig.forDatabase(database);
    }

    @Override
    public void executeWrite(Consumer<GraphStore> work) {
        try (Session session = driver.session(sessionConfig)) {
            session.executeWriteWithoutResult(tx -> work.accept(new Neo4jGraphStore(tx)));
        } catch (TransientException | SessionExpiredException | ServiceUnavailableException e) {
            throw GraphStoreException.transientError("Neo4j temporarily unavailable: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw GraphStoreException.fatal("Neo4j write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (RuntimeException e) {
            log.warn("关闭 Neo4j 连接失败: {}", e.getMessage());
        }
    }
}
