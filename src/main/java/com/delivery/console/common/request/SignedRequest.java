package com.delivery.console.common.request;

import java.util.Map;

/**
 * A POST ready for the transport. {@code signature} is kept for logging and tests only; it is
 * already part of {@code body}.
 */
public record SignedRequest(String method, String url, String body, Map<String, String> headers, String signature) {
    public SignedRequest {
        headers = Map.copyOf(headers);
    }
}
