package com.delivery.console.common.model;

public class DeliveryException extends RuntimeException {
    private final String userMessage;

    public DeliveryException(String userMessage) {
        super(userMessage);
        this.userMessage = userMessage;
    }

    public DeliveryException(String userMessage, Throwable cause) {
        super(userMessage, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
