package com.delivery.console.common.transport;

import com.delivery.console.common.model.TransportException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientDeliveryTransportTest {

    private static final String URL = "https://delivery.example.test/api/1.0/getSenderInfo";
    private static final Map<String, String> HEADERS = Map.of(
            HttpHeaders.USER_AGENT, "DeliveryConsole/Test",
            HttpHeaders.CONTENT_TYPE, "application/x-www-form-urlencoded");

    @Test
    void postsBodyWithHeadersAndReturnsRawResponse() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body("{\"status\":\"ok\"}")
                            .build());
                })
                .build();

        byte[] response = new WebClientDeliveryTransport(webClient).send(URL, "a=1&", HEADERS);

        assertThat(new String(response, StandardCharsets.UTF_8)).isEqualTo("{\"status\":\"ok\"}");
        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).isEqualTo(URI.create(URL));
        assertThat(request.headers().getFirst(HttpHeaders.USER_AGENT)).isEqualTo("DeliveryConsole/Test");
        assertThat(request.headers().getFirst(HttpHeaders.CONTENT_TYPE)).startsWith("application/x-www-form-urlencoded");
    }

    @Test
    void httpErrorStatusBecomesTransportException() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY)
                        .body("upstream down")
                        .build()))
                .build();

        assertThatThrownBy(() -> new WebClientDeliveryTransport(webClient).send(URL, "a=1&", HEADERS))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(502);
                    assertThat(e.getResponseBody()).isEqualTo("upstream down");
                    assertThat(e.getUserMessage()).contains("HTTP 502");
                });
    }

    @Test
    void connectionFailureBecomesTransportException() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new WebClientRequestException(
                        new ConnectException("Connection refused"), request.method(), request.url(), request.headers())))
                .build();

        assertThatThrownBy(() -> new WebClientDeliveryTransport(webClient).send(URL, "a=1&", HEADERS))
                .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.getStatusCode()).isNull())
                .hasMessageContaining("Connection refused");
    }
}
