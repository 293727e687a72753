package com.wangbin.uns.common.utils;

import com.wangbin.uns.common.exception.PayloadFormatException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilTest {

    @Test
    void nullValuesAreWritten() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("a", 1);
        document.put("b", null);

        assertEquals("{\"a\":1,\"b\":null}", new String(JsonUtil.toJsonBytes(document), StandardCharsets.UTF_8));
    }

    @Test
    void unserializableDocumentIsRejected() {
        Map<String, Object> document = Map.of("broken", new Broken());

        assertThrows(PayloadFormatException.class, () -> JsonUtil.toJsonBytes(document));
    }

    public static class Broken {
        public String getValue() {
            throw new IllegalStateException("not readable");
        }
    }
}
