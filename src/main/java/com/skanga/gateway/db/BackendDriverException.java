package com.skanga.gateway.db;

/**
 * Labels a native driver failure with the backend that raised it.
 * The driver's exception is kept untouched as the cause; callers that need
 * backend specific details (SQL state, Mongo error codes) should inspect it.
 */
public class BackendDriverException extends GatewayException {
    private final DatabaseBackend backend;

    public BackendDriverException(DatabaseBackend backend, Throwable cause) {
        super("[" + backend.configName() + "] " + cause.getMessage(), cause);
        this.backend = backend;
    }

    public DatabaseBackend getBackend() {
        return backend;
    }
}
