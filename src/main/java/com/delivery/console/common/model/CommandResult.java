package com.delivery.console.common.model;

import com.fasterxml.jackson.databind.JsonNode;

public class CommandResult {
    public final boolean success;
    public final String message;
    public final JsonNode response;

    public CommandResult(boolean success, String message, JsonNode response) {
        this.success = success;
        this.message = message;
        this.response = response;
    }

    public static CommandResult success(String message) {
        return new CommandResult(true, message, null);
    }

    public static CommandResult success(String message, JsonNode response) {
        return new CommandResult(true, message, response);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message, null);
    }
}
