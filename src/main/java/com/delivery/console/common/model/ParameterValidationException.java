package com.delivery.console.common.model;

public class ParameterValidationException extends DeliveryException {

    public ParameterValidationException(String userMessage) {
        super(userMessage);
    }
}
