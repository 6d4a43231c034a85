package com.skanga.gateway.db;

import com.skanga.gateway.config.ResourceManager;

public class MissingCollectionException extends GatewayException {
    public MissingCollectionException() {
        super(ResourceManager.getErrorMessage("query.collection.missing"));
    }
}
