package com.delivery.console.common.config;

import com.delivery.console.client.DeliveryClient;
import com.delivery.console.common.command.impl.CommandParser;
import com.delivery.console.common.encoding.QueryEncoder;
import com.delivery.console.common.properties.AppProperties;
import com.delivery.console.common.properties.SecretsProperties;
import com.delivery.console.common.request.ClientIdentity;
import com.delivery.console.common.request.DeliveryApi;
import com.delivery.console.common.request.MethodSecretRegistry;
import com.delivery.console.common.request.RequestBuilder;
import com.delivery.console.common.service.CommandExecutor;
import com.delivery.console.common.signing.Canonicalizer;
import com.delivery.console.common.signing.SignatureComputer;
import com.delivery.console.common.transport.DeliveryTransport;
import com.delivery.console.common.transport.WebClientDeliveryTransport;
import com.delivery.console.repl.ReplRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({AppProperties.class, SecretsProperties.class})
public class ApplicationConfiguration {
    @Bean
    public Canonicalizer canonicalizer() {
        return new Canonicalizer();
    }

    @Bean
    public SignatureComputer signatureComputer(Canonicalizer canonicalizer) {
        return new SignatureComputer(canonicalizer);
    }

    @Bean
    public QueryEncoder queryEncoder() {
        return new QueryEncoder();
    }

    @Bean
    public ClientIdentity clientIdentity(SecretsProperties secretsProperties) {
        return new ClientIdentity(secretsProperties.getClientId(), secretsProperties.getSenderId());
    }

    @Bean
    public MethodSecretRegistry methodSecretRegistry(SecretsProperties secretsProperties) {
        return MethodSecretRegistry.of(secretsProperties.getMethodKeys());
    }

    @Bean
    public RequestBuilder requestBuilder(AppProperties appProperties, ClientIdentity identity, MethodSecretRegistry secrets,
                                         SignatureComputer signatureComputer, QueryEncoder queryEncoder) {
        AppProperties.ApiConfig api = appProperties.getApi();
        return new RequestBuilder(api.getBaseUrl(), api.getVersion(), api.getUserAgent(), identity, secrets,
                signatureComputer, queryEncoder);
    }

    @Bean
    public DeliveryApi deliveryApi(RequestBuilder requestBuilder, ObjectProvider<DeliveryTransport> transport,
                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new DeliveryApi(requestBuilder, transport.getIfAvailable(WebClientDeliveryTransport::new),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public DeliveryClient deliveryClient(DeliveryApi deliveryApi, SecretsProperties secretsProperties) {
        return new DeliveryClient(deliveryApi, secretsProperties.getWarehouseIds(), secretsProperties.getRequisiteIds());
    }

    @Bean
    public CommandParser commandParser() {
        return new CommandParser();
    }

    @Bean
    public CommandExecutor commandExecutor(DeliveryClient deliveryClient, ObjectProvider<ObjectMapper> objectMapper) {
        return new CommandExecutor(deliveryClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public ReplRunner replRunner(CommandParser parser, CommandExecutor executor) {
        return new ReplRunner(parser, executor);
    }
}
