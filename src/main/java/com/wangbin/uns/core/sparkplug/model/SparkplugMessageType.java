package com.wangbin.uns.core.sparkplug.model;

import java.util.Locale;

/**
 * Sparkplug B 消息类型
 */
public enum SparkplugMessageType {
    NBIRTH,
    NDEATH,
    DBIRTH,
    DDEATH,
    NDATA,
    DDATA,
    NCMD,
    DCMD,
    STATE,
    UNKNOWN;

    public static SparkplugMessageType fromText(String text) {
        if (text == null) {
            return UNKNOWN;
        }
        try {
            return SparkplugMessageType.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isBirth() {
        return this == NBIRTH || this == DBIRTH;
    }

    public boolean isData() {
        return this == NDATA || this == DDATA;
    }
}
