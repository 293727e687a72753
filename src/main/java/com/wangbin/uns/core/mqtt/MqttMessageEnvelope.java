package com.wangbin.uns.core.mqtt;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 入站消息
 */
@Getter
public class MqttMessageEnvelope {
    private final byte[] payload;
    private final int qos;
    private final boolean retained;
    private final Map<String, String> properties;
    private final long receivedAt;

    public MqttMessageEnvelope(byte[] payload, int qos, boolean retained, Map<String, String> properties) {
        this.payload = payload != null ? payload : new byte[0];
        this.qos = qos;
        this.retained = retained;
        this.properties = properties != null ? properties : Collections.emptyMap();
        this.receivedAt = System.currentTimeMillis();
    }

    public int getPayloadLength() {
        return payload.length;
    }
}
