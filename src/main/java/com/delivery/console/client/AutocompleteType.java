package com.delivery.console.client;

import com.delivery.console.common.model.ParameterValidationException;

public enum AutocompleteType {
    ADDRESS("address"),
    LOCALITY("locality"),
    STREET("street"),
    HOUSE("house");

    private final String id;

    AutocompleteType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    boolean requiresLocality() {
        return this == STREET || this == HOUSE;
    }

    public static AutocompleteType from(String value) {
        if (value == null || value.isBlank()) {
            return ADDRESS;
        }
        String normalized = value.trim().toLowerCase();
        for (AutocompleteType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new ParameterValidationException("Unsupported autocomplete type: " + value);
    }
}
