package com.skanga.gateway.db;

/**
 * Base class for every failure raised by the gateway itself.
 * Driver failures are carried as the cause of a {@link BackendDriverException}.
 */
public class GatewayException extends RuntimeException {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
