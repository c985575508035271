package io.github.yok.flexetl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class SinkConfigTest {

    @Test
    void defaults_正常ケース_未設定の場合_TLS有効かつ証明書検証無効であること() {
        SinkConfig config = new SinkConfig();

        assertEquals("grupox", config.getTable());
        assertTrue(config.isSecure());
        assertFalse(config.isVerifyCertificate());
    }

    @Test
    void requireUrl_異常ケース_URLが未設定の場合_IllegalStateExceptionが送出されること() {
        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> new SinkConfig().requireUrl());
        assertTrue(ex.getMessage().contains("sink.url"));
    }
}
