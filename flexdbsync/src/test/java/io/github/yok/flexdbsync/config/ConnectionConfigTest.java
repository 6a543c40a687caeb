package io.github.yok.flexdbsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

    @Test
    void コンストラクタ_正常ケース_既定値で生成する_primaryとsecondaryのIDが設定されること() {
        ConnectionConfig config = new ConnectionConfig();
        assertEquals("primary", config.getPrimary().getId());
        assertEquals("secondary", config.getSecondary().getId());
    }

    @Test
    void hasPlaceholderCredentials_正常ケース_既定の資格情報を指定する_trueが返ること() {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry("primary");
        entry.setUser(ConnectionConfig.PLACEHOLDER_USER);
        entry.setPassword(ConnectionConfig.PLACEHOLDER_PASSWORD);
        assertTrue(entry.hasPlaceholderCredentials());
    }

    @Test
    void hasPlaceholderCredentials_正常ケース_独自の資格情報を指定する_falseが返ること() {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry("primary");
        entry.setUser("replicator");
        entry.setPassword("password");
        assertFalse(entry.hasPlaceholderCredentials());

        entry.setUser("user");
        entry.setPassword(null);
        assertFalse(entry.hasPlaceholderCredentials());
    }
}
