package com.skanga.gateway.db;

import com.skanga.gateway.config.ResourceManager;

/**
 * The {@code operation} of a document command is not one of the supported operations.
 */
public class UnsupportedQueryOperationException extends GatewayException {
    private final String operation;

    public UnsupportedQueryOperationException(String operation) {
        super(ResourceManager.getErrorMessage("query.operation.unsupported", operation));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
