package com.delivery.console.common.transport;

import java.util.Map;

/**
 * Performs the HTTP POST. Implementations block until the full response body is read and report
 * failures as {@link com.delivery.console.common.model.TransportException}.
 */
public interface DeliveryTransport {

    byte[] send(String url, String body, Map<String, String> headers);
}
