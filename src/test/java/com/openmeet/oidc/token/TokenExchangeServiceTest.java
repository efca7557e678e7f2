package com.openmeet.oidc.token;

import com.openmeet.oidc.error.OidcErrorKind;
import com.openmeet.oidc.error.OidcException;
import com.openmeet.oidc.ratelimit.InMemoryRateLimiter;
import com.openmeet.oidc.test.util.MutableClock;
import com.openmeet.oidc.test.util.OidcTestFixture;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Authorization code redemption against the in-memory stack.
 */
class TokenExchangeServiceTest {

    private final OidcTestFixture fixture = new OidcTestFixture();
    private final TokenExchangeService service = fixture.tokenExchangeService;

    private static TokenRequest confidentialRequest(String code) {
        return new TokenRequest("authorization_code", code, OidcTestFixture.REDIRECT_URI,
            OidcTestFixture.CONFIDENTIAL_CLIENT, OidcTestFixture.CONFIDENTIAL_SECRET, "10.0.0.1");
    }

    @Test
    void valid_code_yields_tokens_bound_to_the_code() {
        IssuedTokens tokens = service.exchange(confidentialRequest(fixture.codeFor("101")));

        Jwt accessToken = fixture.jwtDecoder.decode(tokens.getAccessToken());
        Jwt idToken = fixture.jwtDecoder.decode(tokens.getIdToken());

        assertThat(accessToken.getSubject()).isEqualTo("101");
        assertThat(accessToken.getClaimAsString(OidcClaimNames.TENANT_ID)).isEqualTo(OidcTestFixture.TENANT_A);
        assertThat(accessToken.getClaimAsString(OidcClaimNames.CLIENT_ID)).isEqualTo(OidcTestFixture.CONFIDENTIAL_CLIENT);
        assertThat(accessToken.getClaimAsString(OidcClaimNames.TOKEN_USE)).isEqualTo(OidcClaimNames.USE_ACCESS);
        assertThat(accessToken.getClaimAsString(OidcClaimNames.SCOPE)).isEqualTo("openid profile email");

        assertThat(idToken.getSubject()).isEqualTo("101");
        assertThat(idToken.getAudience()).containsExactly(OidcTestFixture.CONFIDENTIAL_CLIENT);
        assertThat(idToken.getClaimAsString(OidcClaimNames.NONCE)).isEqualTo("nonce-1");
        assertThat(idToken.getClaimAsString(OidcClaimNames.AZP)).isEqualTo(OidcTestFixture.CONFIDENTIAL_CLIENT);
        assertThat(idToken.getClaimAsString(OidcClaimNames.EMAIL)).isEqualTo("alice@example.com");
        assertThat(idToken.getClaimAsString(OidcClaimNames.PREFERRED_USERNAME)).isEqualTo("alice-wonder_tenant-a");

        assertThat(tokens.getExpiresIn()).isEqualTo(3600);
    }

    @Test
    void second_redemption_is_refused_as_already_used() {
        String code = fixture.codeFor("101");
        service.exchange(confidentialRequest(code));

        assertThatThrownBy(() -> service.exchange(confidentialRequest(code)))
            .isInstanceOf(OidcException.class)
            .hasMessageContaining("already been used")
            .extracting("kind").isEqualTo(OidcErrorKind.INVALID_OR_EXPIRED_CODE);
    }

    @Test
    void concurrent_redemptions_yield_exactly_one_token_set() throws Exception {
        String code = fixture.codeFor("101");
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IssuedTokens>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<IssuedTokens> attempt = () -> {
                    start.await();
                    return service.exchange(confidentialRequest(code));
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            int alreadyUsed = 0;
            for (Future<IssuedTokens> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(OidcException.class)
                        .hasMessageContaining("already been used");
                    alreadyUsed++;
                }
            }
            assertThat(successes).as("Exactly one redemption may succeed").isEqualTo(1);
            assertThat(alreadyUsed).isEqualTo(threads - 1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void code_presented_after_sixty_five_seconds_is_expired() {
        String code = fixture.codeFor("101");

        fixture.clock.advance(Duration.ofSeconds(65));

        assertThatThrownBy(() -> service.exchange(confidentialRequest(code)))
            .isInstanceOf(OidcException.class)
            .hasMessage("Authorization code has expired");
    }

    @Test
    void redirect_uri_must_equal_the_authorization_request() {
        String code = fixture.codeFor("101");
        TokenRequest request = new TokenRequest("authorization_code", code, "https://evil.com/callback",
            OidcTestFixture.CONFIDENTIAL_CLIENT, OidcTestFixture.CONFIDENTIAL_SECRET, "10.0.0.1");

        assertThatThrownBy(() -> service.exchange(request))
            .isInstanceOf(OidcException.class)
            .hasMessageContaining("redirect_uri");

        assertThat(service.exchange(confidentialRequest(code)).getAccessToken())
            .as("A rejected attempt must not burn the code")
            .isNotBlank();
    }

    @Test
    void missing_or_wrong_client_secret_is_refused_without_burning_the_code() {
        String code = fixture.codeFor("101");

        assertThatThrownBy(() -> service.exchange(new TokenRequest("authorization_code", code,
            OidcTestFixture.REDIRECT_URI, OidcTestFixture.CONFIDENTIAL_CLIENT, null, "10.0.0.1")))
            .isInstanceOf(OidcException.class)
            .hasMessageContaining("client_secret")
            .extracting("kind").isEqualTo(OidcErrorKind.CLIENT_AUTH_FAILURE);

        assertThatThrownBy(() -> service.exchange(new TokenRequest("authorization_code", code,
            OidcTestFixture.REDIRECT_URI, OidcTestFixture.CONFIDENTIAL_CLIENT, "wrong", "10.0.0.1")))
            .isInstanceOf(OidcException.class)
            .hasMessageContaining("Invalid client credentials");

        assertThat(service.exchange(confidentialRequest(code)).getIdToken()).isNotBlank();
    }

    @Test
    void code_issued_to_one_client_cannot_be_redeemed_by_another() {
        String code = fixture.codeFor("101");
        TokenRequest request = new TokenRequest("authorization_code", code, OidcTestFixture.REDIRECT_URI,
            OidcTestFixture.PUBLIC_CLIENT, null, "10.0.0.1");

        assertThatThrownBy(() -> service.exchange(request))
            .isInstanceOf(OidcException.class)
            .extracting("kind").isEqualTo(OidcErrorKind.UNKNOWN_OR_MISMATCHED_CLIENT);
    }

    @Test
    void client_id_defaults_to_the_one_in_the_code() {
        String code = fixture.codeFor("102");
        TokenRequest request = new TokenRequest("authorization_code", code, OidcTestFixture.REDIRECT_URI,
            null, OidcTestFixture.CONFIDENTIAL_SECRET, "10.0.0.1");

        assertThat(fixture.jwtDecoder.decode(service.exchange(request).getAccessToken()).getSubject())
            .isEqualTo("102");
    }

    @Test
    void public_client_redeems_without_a_secret() {
        String code = fixture.codeCodec.issue(fixture.codeCodec.mint(OidcTestFixture.TENANT_A, "102",
            OidcTestFixture.PUBLIC_CLIENT, OidcTestFixture.PUBLIC_REDIRECT_URI, "openid", null, null));

        IssuedTokens tokens = service.exchange(new TokenRequest("authorization_code", code,
            OidcTestFixture.PUBLIC_REDIRECT_URI, OidcTestFixture.PUBLIC_CLIENT, null, "10.0.0.1"));

        assertThat(fixture.jwtDecoder.decode(tokens.getIdToken()).getClaimAsString(OidcClaimNames.NONCE)).isNull();
    }

    @Test
    void unsupported_grant_type_and_missing_parameters_are_malformed() {
        assertThatThrownBy(() -> service.exchange(new TokenRequest("client_credentials", "c",
            OidcTestFixture.REDIRECT_URI, OidcTestFixture.CONFIDENTIAL_CLIENT, "s", "10.0.0.1")))
            .isInstanceOf(OidcException.class)
            .extracting("errorCode").isEqualTo("unsupported_grant_type");

        assertThatThrownBy(() -> service.exchange(new TokenRequest("authorization_code", null,
            OidcTestFixture.REDIRECT_URI, OidcTestFixture.CONFIDENTIAL_CLIENT, "s", "10.0.0.1")))
            .isInstanceOf(OidcException.class)
            .extracting("kind").isEqualTo(OidcErrorKind.MALFORMED_REQUEST);
    }

    @Test
    void garbage_code_is_invalid() {
        assertThatThrownBy(() -> service.exchange(confidentialRequest("garbage")))
            .isInstanceOf(OidcException.class)
            .hasMessage("Invalid or expired authorization code");
    }

    @Test
    void user_deleted_after_authorization_gets_no_tokens() {
        String code = fixture.codeCodec.issue(fixture.codeCodec.mint(OidcTestFixture.TENANT_A, "999",
            OidcTestFixture.CONFIDENTIAL_CLIENT, OidcTestFixture.REDIRECT_URI, "openid", null, null));

        assertThatThrownBy(() -> service.exchange(confidentialRequest(code)))
            .isInstanceOf(OidcException.class)
            .hasMessageContaining("User not found");
    }

    @Test
    void eleventh_request_in_a_window_is_rate_limited_before_validation() {
        MutableClock clock = MutableClock.startingNow();
        OidcTestFixture limited = new OidcTestFixture(new InMemoryRateLimiter(clock, 10, Duration.ofSeconds(60)));
        TokenRequest junk = new TokenRequest("authorization_code", "garbage", OidcTestFixture.REDIRECT_URI,
            OidcTestFixture.CONFIDENTIAL_CLIENT, "s", "10.0.0.9");

        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> limited.tokenExchangeService.exchange(junk))
                .extracting("kind").isEqualTo(OidcErrorKind.INVALID_OR_EXPIRED_CODE);
        }

        assertThatThrownBy(() -> limited.tokenExchangeService.exchange(junk))
            .isInstanceOf(OidcException.class)
            .satisfies(e -> {
                OidcException oidc = (OidcException) e;
                assertThat(oidc.getKind()).isEqualTo(OidcErrorKind.RATE_LIMITED);
                assertThat(oidc.getRetryAfter()).isPositive();
            });
    }

    @Test
    void malformed_basic_credentials_are_refused_only_after_counting_against_the_limit() {
        MutableClock clock = MutableClock.startingNow();
        OidcTestFixture limited = new OidcTestFixture(new InMemoryRateLimiter(clock, 2, Duration.ofSeconds(60)));
        TokenRequest malformed = new TokenRequest("authorization_code", "garbage", OidcTestFixture.REDIRECT_URI,
            null, null, "10.0.0.7", true);

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> limited.tokenExchangeService.exchange(malformed))
                .isInstanceOf(OidcException.class)
                .hasMessage("Malformed Basic authorization header")
                .extracting("kind").isEqualTo(OidcErrorKind.CLIENT_AUTH_FAILURE);
        }

        assertThatThrownBy(() -> limited.tokenExchangeService.exchange(malformed))
            .extracting("kind").isEqualTo(OidcErrorKind.RATE_LIMITED);
    }
}
