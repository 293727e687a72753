package com.wangbin.uns.common.constant;

import java.util.List;

public class UnsConstant {

    // 图节点属性
    public static final String NODE_NAME_KEY = "node_name";
    public static final String NODE_NAME_ATTRIBUTE_ALIAS = "NODE_NAME";
    public static final String CREATED_TIMESTAMP_KEY = "_created_timestamp";
    public static final String MODIFIED_TIMESTAMP_KEY = "_modified_timestamp";
    public static final String NODE_RELATION_NAME = "PARENT_OF";

    // 数组元素命名时优先使用的字段
    public static final String LIST_ITEM_NAME_KEY = "name";

    // 默认节点类型
    public static final List<String> DEFAULT_UNS_NODE_TYPES =
            List.of("ENTERPRISE", "FACILITY", "AREA", "LINE", "DEVICE");
    public static final List<String> DEFAULT_SPB_NODE_TYPES =
            List.of("spBv1_0", "GROUP", "MESSAGE_TYPE", "EDGE_NODE", "DEVICE");
    public static final String DEFAULT_NESTED_ATTRIBUTE_NODE_TYPE = "NESTED_ATTRIBUTE";
    public static final String FALLBACK_NODE_TYPE = "NODE";
    public static final String DEPTH_SUFFIX = "_depth_";

    public static final String DEFAULT_TIMESTAMP_ATTRIBUTE = "timestamp";

    private UnsConstant() {
    }
}
