package com.delivery.console.common.model;

/**
 * Client configuration cannot serve the call, e.g. no method key for the requested method.
 * Raised before any network I/O.
 */
public class ConfigurationException extends DeliveryException {

    public ConfigurationException(String userMessage) {
        super(userMessage);
    }
}
