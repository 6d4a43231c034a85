package com.skanga.gateway.db;

/**
 * A document command could not be parsed or one of its payloads has the wrong shape.
 */
public class MalformedQueryException extends GatewayException {
    public MalformedQueryException(String message) {
        super(message);
    }

    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
