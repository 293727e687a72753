package com.wangbin.uns.core.mqtt;

import lombok.extern.slf4j.Slf4j;

/**
 * 按协议版本创建 Paho 客户端
 */
@Slf4j
public final class MqttClientFactory {

    private MqttClientFactory() {
    }

    public static MqttClientAdapter create(MqttConnectionConfig config, IncomingMessageHandler handler) throws Exception {
        log.info("创建 MQTT 客户端: broker={}, clientId={}, version={}",
                config.getBrokerUrl(), config.getClientId(), config.getVersion());
        return switch (config.getVersion()) {
            case V3 -> new PahoV3ClientAdapter(config, handler);
            case V5 -> new PahoV5ClientAdapter(config, handler);
        };
    }
}
