package com.skanga.gateway.config;

import com.skanga.gateway.db.ConfigurationException;
import com.skanga.gateway.db.DatabaseBackend;

/**
 * Connection settings for one gateway instance.
 *
 * @param dbBackend           backend identity as configured, resolved on connect
 * @param dbHost              database host
 * @param dbPort              database port, 0 selects the backend's default port
 * @param dbUser              user name, may be empty for an unauthenticated MongoDB
 * @param dbPassword          password
 * @param dbName              database (namespace) to connect to
 * @param minPoolSize         minimum pooled connections
 * @param maxPoolSize         maximum pooled connections
 * @param connectionTimeoutMs how long to wait for a pooled connection
 * @param authSource          MongoDB authentication database
 */
public record ConfigParams(
        String dbBackend,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        int minPoolSize,
        int maxPoolSize,
        int connectionTimeoutMs,
        String authSource) {

    public static final int DEFAULT_MIN_POOL_SIZE = 1;
    public static final int DEFAULT_MAX_POOL_SIZE = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 30000;
    public static final String DEFAULT_AUTH_SOURCE = "admin";

    public ConfigParams {
        if (dbPort < 0 || dbPort > 65535) {
            throw new ConfigurationException(ResourceManager.getErrorMessage("config.port.invalid", dbPort));
        }
        if (minPoolSize < 0 || maxPoolSize < 1 || minPoolSize > maxPoolSize) {
            throw new ConfigurationException(
                    ResourceManager.getErrorMessage("config.pool.size.invalid", minPoolSize, maxPoolSize));
        }
        if (connectionTimeoutMs <= 0) {
            throw new ConfigurationException(
                    ResourceManager.getErrorMessage("config.timeout.invalid", connectionTimeoutMs));
        }
        dbUser = dbUser == null ? "" : dbUser;
        dbPassword = dbPassword == null ? "" : dbPassword;
        authSource = authSource == null || authSource.isBlank() ? DEFAULT_AUTH_SOURCE : authSource;
    }

    /**
     * Creates settings with default pool sizes and timeout.
     */
    public static ConfigParams defaultConfig(String dbBackend, String dbHost, int dbPort,
                                             String dbUser, String dbPassword, String dbName) {
        return new ConfigParams(dbBackend, dbHost, dbPort, dbUser, dbPassword, dbName,
                DEFAULT_MIN_POOL_SIZE, DEFAULT_MAX_POOL_SIZE, DEFAULT_CONNECTION_TIMEOUT_MS, DEFAULT_AUTH_SOURCE);
    }

    public int portOrDefault(DatabaseBackend backend) {
        return dbPort > 0 ? dbPort : backend.defaultPort();
    }

    /**
     * Describes the connection target without the password, for logs and error messages.
     *
     * @return {@code user@host:port/database}
     */
    public String maskSensitive() {
        String port = dbPort > 0 ? String.valueOf(dbPort) : "default";
        String user = dbUser.isEmpty() ? "" : dbUser + "@";
        return user + dbHost + ":" + port + "/" + dbName;
    }

    @Override
    public String toString() {
        return "ConfigParams[dbBackend=" + dbBackend + ", target=" + maskSensitive()
                + ", dbPassword=***, minPoolSize=" + minPoolSize + ", maxPoolSize=" + maxPoolSize
                + ", connectionTimeoutMs=" + connectionTimeoutMs + ", authSource=" + authSource + "]";
    }
}
