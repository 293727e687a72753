package com.wangbin.uns.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.wangbin.uns.common.exception.PayloadFormatException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.WriteMapNullValue);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * 对象转UTF-8字节，用于MQTT发布
     *
     * @throws PayloadFormatException 对象无法序列化
     */
    public static byte[] toJsonBytes(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.WriteMapNullValue).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw PayloadFormatException.notSerializable(e);
        }
    }

    /**
     * JSON字符串转Map，保持字段顺序
     */
    public static Map<String, Object> parseMap(String json) {
        try {
            return JSON.parseObject(json);
        } catch (Exception e) {
            log.error("JSON字符串转Map失败: {}", json, e);
            return null;
        }
    }

    /**
     * 判断是否为JSON对象
     */
    public static boolean isJsonObject(String json) {
        try {
            Object obj = JSON.parse(json);
            return obj instanceof JSONObject;
        } catch (Exception e) {
            return false;
        }
    }
}
