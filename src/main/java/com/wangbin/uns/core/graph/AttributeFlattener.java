package com.wangbin.uns.core.graph;

import com.wangbin.uns.common.constant.UnsConstant;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 嵌套属性展平：{"c": {"k1": "v1"}, "b": [10, 23]} -&gt; {"c_k1": "v1", "b_0": 10, "b_1": 23}。
 * 保留属性 node_name 改名为 NODE_NAME。
 */
public final class AttributeFlattener {

    private static final String SEPARATOR = "_";

    private AttributeFlattener() {
    }

    public static Map<String, Object> flatten(Map<String, ?> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes == null) {
            return result;
        }
        attributes.forEach((key, value) -> {
            String target = UnsConstant.NODE_NAME_KEY.equals(key) ? UnsConstant.NODE_NAME_ATTRIBUTE_ALIAS : key;
            flattenInto(result, target, value);
        });
        return result;
    }

    private static void flattenInto(Map<String, Object> result, String key, Object value) {
        if (value instanceof Map<?, ?> map) {
            map.forEach((childKey, childValue) -> flattenInto(result, key + SEPARATOR + childKey, childValue));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                flattenInto(result, key + SEPARATOR + i, list.get(i));
            }
        } else {
            result.put(key, value);
        }
    }
}
