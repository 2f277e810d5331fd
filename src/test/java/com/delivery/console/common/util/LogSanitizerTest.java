package com.delivery.console.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void masksSignatureInFormBody() {
        String body = "city=Moscow&client_id=10&secret_key=cb9d966f5404a5cfa18fb5290f2b2525&";

        assertThat(LogSanitizer.sanitize(body)).isEqualTo("city=Moscow&client_id=10&secret_key=***&");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        assertThat(LogSanitizer.sanitize("warehouse 12")).isEqualTo("warehouse 12");
        assertThat(LogSanitizer.sanitize(null)).isNull();
    }
}
