package com.skanga.gateway.db;

import java.util.Locale;

/**
 * The database technologies the gateway can front. Chosen once from configuration.
 */
public enum DatabaseBackend {
    POSTGRES("postgres", 5432),
    MYSQL("mysql", 3306),
    MONGODB("mongodb", 27017);

    private final String configName;
    private final int defaultPort;

    DatabaseBackend(String configName, int defaultPort) {
        this.configName = configName;
        this.defaultPort = defaultPort;
    }

    public String configName() {
        return configName;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public boolean isRelational() {
        return this != MONGODB;
    }

    /**
     * Resolves a configured backend identity. Matching is case-insensitive and accepts
     * the common aliases {@code postgresql} and {@code mongo}.
     *
     * @param backendName identity as it appears in configuration
     * @return the matching backend
     * @throws UnsupportedBackendException if the name matches no backend
     */
    public static DatabaseBackend fromConfig(String backendName) {
        if (backendName == null) {
            throw new UnsupportedBackendException(null);
        }
        return switch (backendName.trim().toLowerCase(Locale.ROOT)) {
            case "postgres", "postgresql" -> POSTGRES;
            case "mysql" -> MYSQL;
            case "mongodb", "mongo" -> MONGODB;
            default -> throw new UnsupportedBackendException(backendName);
        };
    }
}
