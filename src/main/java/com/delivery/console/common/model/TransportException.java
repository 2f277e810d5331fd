package com.delivery.console.common.model;

public class TransportException extends DeliveryException {
    private final Integer statusCode;
    private final String responseBody;

    public TransportException(String userMessage, Throwable cause) {
        this(userMessage, null, null, cause);
    }

    public TransportException(String userMessage, Integer statusCode, String responseBody, Throwable cause) {
        super(userMessage, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * HTTP status of the failed exchange, or {@code null} when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
