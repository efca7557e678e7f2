package com.openmeet.oidc.test.technical.token;

import com.openmeet.oidc.test.util.MutableClock;
import com.openmeet.oidc.test.util.OidcFlowClient;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Clock;
import java.time.Duration;

import static com.openmeet.oidc.test.util.OidcFlowClient.CLIENT_ID;
import static com.openmeet.oidc.test.util.OidcFlowClient.CLIENT_SECRET;
import static com.openmeet.oidc.test.util.OidcFlowClient.REDIRECT_URI;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_A;
import static com.openmeet.oidc.test.util.OidcFlowClient.json;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * BLACK-BOX HTTP test of code and token lifetimes, with the server clock
 * replaced by a {@link MutableClock}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthorizationCodeExpiryTechnicalTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock mutableClock() {
            return MutableClock.startingNow();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private Clock clock;

    @Test
    void http_code_redeemed_after_sixty_five_seconds_is_expired() throws Exception {
        OidcFlowClient client = new OidcFlowClient(mockMvc);
        Cookie[] cookies = client.login(TENANT_A, "alice@example.com", "alice-password");
        String code = client.obtainCode(cookies, TENANT_A, CLIENT_ID, REDIRECT_URI);

        ((MutableClock) clock).advance(Duration.ofSeconds(65));
        MvcResult result = client.token(code, REDIRECT_URI, CLIENT_ID, CLIENT_SECRET);

        assertThat(result.getResponse().getStatus()).isEqualTo(401);
        assertThat(json(result))
            .containsEntry("error", "invalid_grant")
            .containsEntry("error_description", "Authorization code has expired");
    }

    @Test
    void http_access_token_stops_resolving_after_one_hour() throws Exception {
        OidcFlowClient client = new OidcFlowClient(mockMvc);
        Cookie[] cookies = client.login(TENANT_A, "bob@example.com", "bob-password");
        String code = client.obtainCode(cookies, TENANT_A, CLIENT_ID, REDIRECT_URI);
        String accessToken = (String) json(client.token(code, REDIRECT_URI, CLIENT_ID, CLIENT_SECRET))
            .get("access_token");

        assertThat(client.userInfo(accessToken).getResponse().getStatus()).isEqualTo(200);

        ((MutableClock) clock).advance(Duration.ofHours(1));

        MvcResult expired = client.userInfo(accessToken);
        assertThat(expired.getResponse().getStatus()).isEqualTo(401);
        assertThat(json(expired)).containsEntry("error_description", "Access token has expired");
    }
}
