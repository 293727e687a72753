package com.wangbin.uns.common.exception;

/**
 * 消息无法转换为图节点（嵌套过深等）。
 */
public class GraphTransformException extends BusinessException {

    public static final int CODE = 4003;

    public GraphTransformException(String message) {
        super(CODE, message);
    }

    public static GraphTransformException nestingTooDeep(String topic, int maxDepth) {
        return new GraphTransformException("Message on topic " + topic
                + " exceeds the maximum attribute nesting depth of " + maxDepth);
    }
}
