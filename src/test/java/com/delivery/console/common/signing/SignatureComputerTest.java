package com.delivery.console.common.signing;

import com.delivery.console.common.param.ParamValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureComputerTest {

    private final SignatureComputer signatureComputer = new SignatureComputer(new Canonicalizer());

    private final ParamValue.Mapping data = ParamValue.mapping()
            .put("x", "5")
            .put("y", ParamValue.mapping().put("z", "6").build())
            .build();

    @Test
    void appendsSecretToCanonicalString() {
        assertThat(signatureComputer.signingInput(data, "abc")).isEqualTo("56abc");
    }

    @Test
    void signatureIsLowercaseHexMd5() {
        assertThat(signatureComputer.sign(data, "abc")).isEqualTo("aba3fa0cc39bab2779fab33417e9ab5c");
    }

    @Test
    void changingRetainedValueChangesSignature() {
        ParamValue.Mapping changed = data.with("x", ParamValue.of("7"));

        assertThat(signatureComputer.sign(changed, "abc")).isNotEqualTo(signatureComputer.sign(data, "abc"));
    }

    @Test
    void changingOnlyEmptyValueKeepsSignature() {
        ParamValue.Mapping withEmpty = data.with("comment", ParamValue.of(""));
        ParamValue.Mapping withZero = data.with("comment", ParamValue.of(0));

        assertThat(signatureComputer.sign(withEmpty, "abc")).isEqualTo(signatureComputer.sign(data, "abc"));
        assertThat(signatureComputer.sign(withZero, "abc")).isEqualTo(signatureComputer.sign(data, "abc"));
    }

    @Test
    void secretIsPartOfSignature() {
        assertThat(signatureComputer.sign(data, "abd")).isNotEqualTo(signatureComputer.sign(data, "abc"));
    }
}
