package com.wangbin.uns.common.constant;

public class SparkplugConstant {

    // 命名空间
    public static final String SPARKPLUG_NAMESPACE = "spBv1.0";
    public static final String SPARKPLUG_WILDCARD_TOPIC = SPARKPLUG_NAMESPACE + "/#";
    public static final String TOPIC_SEPARATOR = "/";

    // spBv1.0/<group_id>/<message_type>/<edge_node_id>/[<device_id>]
    public static final int NODE_TOPIC_DEPTH = 4;
    public static final int DEVICE_TOPIC_DEPTH = 5;

    // 会话指标
    public static final String BD_SEQ_METRIC = "bdSeq";

    // seq 与 bdSeq 取值范围 0-255
    public static final int SEQUENCE_MODULUS = 256;

    private SparkplugConstant() {
    }
}
