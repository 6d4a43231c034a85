package com.skanga.gateway.db;

import com.skanga.gateway.config.ResourceManager;

/**
 * The active client was requested before {@code connect()} or after {@code disconnect()}.
 */
public class NotConnectedException extends GatewayException {
    public NotConnectedException() {
        super(ResourceManager.getErrorMessage("connection.not.connected"));
    }
}
