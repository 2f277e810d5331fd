package com.delivery.console.common.request;

import com.delivery.console.common.model.ConfigurationException;

import java.util.Map;
import java.util.Set;

/**
 * Method name to method key, fixed for the lifetime of the client.
 */
public final class MethodSecretRegistry {
    private final Map<String, String> secrets;

    private MethodSecretRegistry(Map<String, String> secrets) {
        this.secrets = secrets;
    }

    public static MethodSecretRegistry of(Map<String, String> secrets) {
        return new MethodSecretRegistry(secrets == null ? Map.of() : Map.copyOf(secrets));
    }

    public String require(String method) {
        String secret = secrets.get(method);
        if (secret == null) {
            throw new ConfigurationException("Method " + method + " has no method key configured");
        }
        return secret;
    }

    public boolean contains(String method) {
        return secrets.containsKey(method);
    }

    public Set<String> methods() {
        return secrets.keySet();
    }
}
