package com.wangbin.uns.core.mqtt;

import java.util.Locale;

/**
 * 支持的 MQTT 协议版本，默认 v5。
 */
public enum MqttProtocolVersion {
    V3,
    V5;

    public static MqttProtocolVersion fromText(String text) {
        if (text == null) {
            return V5;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("v3".equals(normalized) || "3".equals(normalized) || "3.1.1".equals(normalized)
                || "mqtt3".equals(normalized) || "mqttv311".equals(normalized)) {
            return V3;
        }
        return V5;
    }
}
