package com.skanga.gateway.db;

/**
 * A document is cyclic or nested deeper than the walkers accept.
 */
public class UnsupportedDocumentStructureException extends GatewayException {
    public UnsupportedDocumentStructureException(String message) {
        super(message);
    }
}
