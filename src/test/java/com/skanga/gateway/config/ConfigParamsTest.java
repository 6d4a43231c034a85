package com.skanga.gateway.config;

import com.skanga.gateway.db.ConfigurationException;
import com.skanga.gateway.db.DatabaseBackend;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigParamsTest {

    @Test
    void testDefaultConfig() {
        ConfigParams config = ConfigParams.defaultConfig("postgres", "localhost", 0, "app", "secret", "appdb");

        assertEquals(1, config.minPoolSize());
        assertEquals(10, config.maxPoolSize());
        assertEquals(30000, config.connectionTimeoutMs());
        assertEquals("admin", config.authSource());
    }

    @Test
    void testPortOrDefault() {
        ConfigParams defaultPort = ConfigParams.defaultConfig("mysql", "localhost", 0, "u", "p", "db");
        ConfigParams explicitPort = ConfigParams.defaultConfig("mysql", "localhost", 13306, "u", "p", "db");

        assertEquals(3306, defaultPort.portOrDefault(DatabaseBackend.MYSQL));
        assertEquals(27017, defaultPort.portOrDefault(DatabaseBackend.MONGODB));
        assertEquals(13306, explicitPort.portOrDefault(DatabaseBackend.MYSQL));
    }

    @Test
    void testNullCredentialsNormalized() {
        ConfigParams config = new ConfigParams("mongodb", "localhost", 0, null, null, "db", 0, 5, 1000, null);

        assertEquals("", config.dbUser());
        assertEquals("", config.dbPassword());
        assertEquals(ConfigParams.DEFAULT_AUTH_SOURCE, config.authSource());
    }

    @Test
    void testInvalidPort() {
        assertThrows(ConfigurationException.class,
                () -> ConfigParams.defaultConfig("postgres", "localhost", 70000, "u", "p", "db"));
        assertThrows(ConfigurationException.class,
                () -> ConfigParams.defaultConfig("postgres", "localhost", -1, "u", "p", "db"));
    }

    @Test
    void testInvalidPoolSizes() {
        assertThrows(ConfigurationException.class,
                () -> new ConfigParams("postgres", "h", 0, "u", "p", "db", 5, 2, 1000, null));
        assertThrows(ConfigurationException.class,
                () -> new ConfigParams("postgres", "h", 0, "u", "p", "db", 0, 0, 1000, null));
        assertThrows(ConfigurationException.class,
                () -> new ConfigParams("postgres", "h", 0, "u", "p", "db", -1, 3, 1000, null));
    }

    @Test
    void testInvalidTimeout() {
        assertThrows(ConfigurationException.class,
                () -> new ConfigParams("postgres", "h", 0, "u", "p", "db", 1, 2, 0, null));
    }

    @Test
    void testPasswordNeverInStringForm() {
        ConfigParams config = ConfigParams.defaultConfig("postgres", "db.internal", 5432, "app", "hunter2", "sales");

        assertEquals("app@db.internal:5432/sales", config.maskSensitive());
        assertFalse(config.toString().contains("hunter2"));
        assertTrue(config.toString().contains("dbPassword=***"));
    }

    @Test
    void testMaskSensitive_NoUserDefaultPort() {
        ConfigParams config = ConfigParams.defaultConfig("mongodb", "mongo", 0, "", "", "catalog");

        assertEquals("mongo:default/catalog", config.maskSensitive());
    }
}
