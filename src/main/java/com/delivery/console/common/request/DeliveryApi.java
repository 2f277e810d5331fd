package com.delivery.console.common.request;

import com.delivery.console.common.model.MalformedResponseException;
import com.delivery.console.common.model.ProtocolException;
import com.delivery.console.common.param.ParamValue;
import com.delivery.console.common.transport.DeliveryTransport;
import com.delivery.console.common.util.LogSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Signs, sends and classifies a single API call. Holds no per-request state.
 */
@Slf4j
public class DeliveryApi {
    private static final String STATUS = "status";
    private static final String STATUS_ERROR = "error";
    private static final String ERROR = "error";

    private final RequestBuilder requestBuilder;
    private final DeliveryTransport transport;
    private final ObjectMapper objectMapper;

    public DeliveryApi(RequestBuilder requestBuilder, DeliveryTransport transport, ObjectMapper objectMapper) {
        this.requestBuilder = requestBuilder;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the parsed response when its {@code status} is not {@code "error"}
     * @throws com.delivery.console.common.model.ConfigurationException no method key for {@code method}
     * @throws com.delivery.console.common.model.TransportException     network or HTTP failure
     * @throws MalformedResponseException                               response is not JSON
     * @throws ProtocolException                                        response reports an error
     */
    public JsonNode request(String method, ParamValue.Mapping params) {
        SignedRequest request = requestBuilder.build(method, params);
        LOG.info("delivery POST {} {}", request.url(), LogSanitizer.sanitize(request.body()));
        byte[] raw = transport.send(request.url(), request.body(), request.headers());
        JsonNode response = parse(method, raw);
        if (isError(response)) {
            String errorCode = response.path(ERROR).asText(null);
            LOG.warn("delivery {} failed: {}", method, errorCode);
            throw new ProtocolException(method, errorCode, response);
        }
        return response;
    }

    private JsonNode parse(String method, byte[] raw) {
        String text = raw == null ? "" : new String(raw, StandardCharsets.UTF_8);
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new MalformedResponseException("Empty response from delivery API " + method, text, null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response from delivery API " + method + " is not valid JSON", text, e);
        }
    }

    private boolean isError(JsonNode response) {
        JsonNode status = response.get(STATUS);
        return status != null && STATUS_ERROR.equals(status.asText());
    }
}
