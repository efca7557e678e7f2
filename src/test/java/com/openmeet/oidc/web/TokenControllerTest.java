package com.openmeet.oidc.web;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class TokenControllerTest {

    private static String basic(String raw) {
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void basic_credentials_are_form_decoded() {
        assertThat(TokenController.decodeBasic(basic("matrix_synapse:s%3Acret")))
            .get()
            .satisfies(credentials -> assertThat(credentials).containsExactly("matrix_synapse", "s:cret"));
    }

    @Test
    void malformed_basic_header_decodes_to_nothing() {
        assertThat(TokenController.decodeBasic("%%%")).as("not base64").isEmpty();
        assertThat(TokenController.decodeBasic(basic("no-colon"))).as("no separator").isEmpty();
    }

    @Test
    void bad_percent_escape_in_basic_credentials_decodes_to_nothing() {
        assertThat(TokenController.decodeBasic(basic("client%zz:secret"))).isEmpty();
        assertThat(TokenController.decodeBasic(basic("client:secret%"))).isEmpty();
    }
}
