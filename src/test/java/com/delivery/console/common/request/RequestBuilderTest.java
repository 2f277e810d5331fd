package com.delivery.console.common.request;

import com.delivery.console.common.encoding.QueryEncoder;
import com.delivery.console.common.model.ConfigurationException;
import com.delivery.console.common.param.ParamValue;
import com.delivery.console.common.signing.Canonicalizer;
import com.delivery.console.common.signing.SignatureComputer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestBuilderTest {

    private final RequestBuilder builder = new RequestBuilder(
            "https://delivery.example.test/api/", "1.0", "DeliveryConsole/Test",
            new ClientIdentity("10", "20"),
            MethodSecretRegistry.of(Map.of("searchDeliveryList", "k")),
            new SignatureComputer(new Canonicalizer()),
            new QueryEncoder());

    @Test
    void buildsSignedFormPost() {
        ParamValue.Mapping params = ParamValue.mapping()
                .put("city", "Moscow")
                .put("empty", "")
                .put("weight", new BigDecimal("1.5"))
                .build();

        SignedRequest request = builder.build("searchDeliveryList", params);

        assertThat(request.url()).isEqualTo("https://delivery.example.test/api/1.0/searchDeliveryList");
        assertThat(request.signature()).isEqualTo("cb9d966f5404a5cfa18fb5290f2b2525");
        assertThat(request.body()).isEqualTo(
                "city=Moscow&weight=1.5&client_id=10&sender_id=20&secret_key=cb9d966f5404a5cfa18fb5290f2b2525&");
        assertThat(request.headers())
                .containsEntry("User-Agent", "DeliveryConsole/Test")
                .containsEntry("Content-Type", "application/x-www-form-urlencoded");
    }

    @Test
    void identityOverridesCallerSuppliedIds() {
        ParamValue.Mapping params = ParamValue.mapping().put("client_id", "999").build();

        SignedRequest request = builder.build("searchDeliveryList", params);

        assertThat(request.body()).startsWith("client_id=10&sender_id=20&secret_key=");
    }

    @Test
    void doesNotMutateCallerParams() {
        ParamValue.Mapping params = ParamValue.mapping().put("city", "Moscow").build();

        builder.build("searchDeliveryList", params);

        assertThat(params.entries()).containsOnlyKeys("city");
    }

    @Test
    void nullParamsAreTreatedAsEmpty() {
        SignedRequest request = builder.build("searchDeliveryList", null);

        assertThat(request.body()).startsWith("client_id=10&sender_id=20&secret_key=").endsWith("&");
    }

    @Test
    void missingMethodKeyFailsBeforeSigning() {
        assertThatThrownBy(() -> builder.build("unregisteredMethod", ParamValue.mapping().build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unregisteredMethod");
    }

    @Test
    void blankUserAgentFallsBackToDefault() {
        RequestBuilder defaults = new RequestBuilder("https://h/api", "1.0", " ",
                new ClientIdentity("1", "2"), MethodSecretRegistry.of(Map.of("m", "s")),
                new SignatureComputer(new Canonicalizer()), new QueryEncoder());

        assertThat(defaults.build("m", null).headers()).containsEntry("User-Agent", RequestBuilder.DEFAULT_USER_AGENT);
    }
}
