package com.delivery.console.common.model;

public class MalformedResponseException extends DeliveryException {
    private final String rawBody;

    public MalformedResponseException(String userMessage, String rawBody, Throwable cause) {
        super(userMessage, cause);
        this.rawBody = rawBody;
    }

    public String getRawBody() {
        return rawBody;
    }
}
