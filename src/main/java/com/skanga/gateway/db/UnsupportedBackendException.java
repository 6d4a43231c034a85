package com.skanga.gateway.db;

import com.skanga.gateway.config.ResourceManager;

/**
 * The configured backend identity does not match any known {@link DatabaseBackend}.
 */
public class UnsupportedBackendException extends ConfigurationException {
    private final String backendName;

    public UnsupportedBackendException(String backendName) {
        super(ResourceManager.getErrorMessage("backend.unsupported", backendName));
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
