package com.wangbin.uns.core.mqtt;

import com.wangbin.uns.core.config.UnsProperties;
import lombok.Getter;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 单个 MQTT 连接的参数
 */
@Getter
public class MqttConnectionConfig {

    private final String brokerUrl;
    private final String clientId;
    private final String username;
    private final String password;
    private final boolean cleanSession;
    private final int connectionTimeoutSeconds;
    private final int keepAliveIntervalSeconds;
    private final boolean automaticReconnect;
    private final MqttProtocolVersion version;

    private MqttConnectionConfig(String brokerUrl,
                                 String clientId,
                                 String username,
                                 String password,
                                 boolean cleanSession,
                                 int connectionTimeoutSeconds,
                                 int keepAliveIntervalSeconds,
                                 boolean automaticReconnect,
                                 MqttProtocolVersion version) {
        this.brokerUrl = brokerUrl;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
        this.cleanSession = cleanSession;
        this.connectionTimeoutSeconds = connectionTimeoutSeconds;
        this.keepAliveIntervalSeconds = keepAliveIntervalSeconds;
        this.automaticReconnect = automaticReconnect;
        this.version = version;
    }

    /**
     * 根据全局配置生成连接参数；未配置 clientId 时以 clientIdPrefix 加时间戳和随机数生成
     */
    public static MqttConnectionConfig from(UnsProperties.MqttConfig mqtt, String clientIdPrefix) {
        String clientId = mqtt.getClientId();
        if (clientId == null || clientId.isBlank()) {
            clientId = clientIdPrefix + "-" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1000);
        } else {
            clientId = clientId + "-" + clientIdPrefix;
        }
        return new MqttConnectionConfig(mqtt.getBrokerUrl(), clientId, mqtt.getUsername(), mqtt.getPassword(),
                mqtt.isCleanSession(), mqtt.getConnectionTimeout(), mqtt.getKeepAliveInterval(),
                mqtt.isAutomaticReconnect(), MqttProtocolVersion.fromText(mqtt.getVersion()));
    }
}
