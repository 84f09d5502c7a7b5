package com.txarchive.ingestion.config;

/**
 * Settings are individually valid but inconsistent with each other. The engine does not start.
 */
public class ArchiveConfigurationException extends RuntimeException {

    public ArchiveConfigurationException(String message) {
        super(message);
    }
}
