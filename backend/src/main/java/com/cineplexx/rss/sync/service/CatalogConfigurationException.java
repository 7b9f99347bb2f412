package com.cineplexx.rss.sync.service;

public class CatalogConfigurationException extends RuntimeException {
    public CatalogConfigurationException(String message) {
        super(message);
    }

    public CatalogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
