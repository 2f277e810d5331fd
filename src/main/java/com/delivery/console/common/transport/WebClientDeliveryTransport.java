package com.delivery.console.common.transport;

import com.delivery.console.common.model.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;

@Slf4j
public class WebClientDeliveryTransport implements DeliveryTransport {
    private static final int MAX_IN_MEMORY_SIZE = 10 * 1024 * 1024;

    private final WebClient webClient;

    public WebClientDeliveryTransport() {
        this(WebClient.builder()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build());
    }

    public WebClientDeliveryTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public byte[] send(String url, String body, Map<String, String> headers) {
        try {
            byte[] response = webClient.post()
                    .uri(url)
                    .headers(httpHeaders -> headers.forEach(httpHeaders::set))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
            return response == null ? new byte[0] : response;
        } catch (WebClientResponseException ex) {
            String bodyText = ex.getResponseBodyAsString();
            String msg = "Delivery request failed: HTTP " + ex.getStatusCode().value();
            if (bodyText != null && !bodyText.isBlank()) {
                msg = msg + " body=" + bodyText;
            }
            LOG.warn("{} {}", url, msg);
            throw new TransportException(msg, ex.getStatusCode().value(), bodyText, ex);
        } catch (WebClientException ex) {
            LOG.warn("{} request failed: {}", url, ex.getMessage());
            throw new TransportException("Delivery request failed: " + ex.getMessage(), ex);
        }
    }
}
