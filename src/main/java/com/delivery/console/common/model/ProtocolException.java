package com.delivery.console.common.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The API answered with {@code "status": "error"}. Keeps the server's error field and the whole
 * response for diagnostics.
 */
public class ProtocolException extends DeliveryException {
    private final String errorCode;
    private final JsonNode response;

    public ProtocolException(String method, String errorCode, JsonNode response) {
        super("Delivery API " + method + " responded with error " + errorCode + ". Full output: " + response);
        this.errorCode = errorCode;
        this.response = response;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public JsonNode getResponse() {
        return response;
    }
}
