package com.wangbin.uns.core.graph;

import java.util.function.Consumer;

/**
 * 图数据库连接，一条消息的所有合并操作在同一个写事务中完成。
 */
public interface GraphDatabase extends AutoCloseable {

    /**
     * 在一个写事务中执行 work，work 抛出异常时事务回滚
     *
     * @throws com.wangbin.uns.common.exception.GraphStoreException 写入失败
     */
    void executeWrite(Consumer<GraphStore> work);

    @Override
    default void close() {
    }
}
