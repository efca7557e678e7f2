package com.openmeet.oidc.test.technical.flow;

import com.openmeet.oidc.test.util.OidcFlowClient;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.openmeet.oidc.test.util.OidcFlowClient.CLIENT_ID;
import static com.openmeet.oidc.test.util.OidcFlowClient.CLIENT_SECRET;
import static com.openmeet.oidc.test.util.OidcFlowClient.REDIRECT_URI;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_A;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_B;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_B_REDIRECT_URI;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_B_SECRET;
import static com.openmeet.oidc.test.util.OidcFlowClient.json;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * BLACK-BOX HTTP test: many users run login → /authorize → /token → /userinfo
 * at the same time and each ends up with exactly their own identity.
 *
 * carol (tenant-b) shares alice's user id 101, so a lookup that loses the
 * tenant would show up as a wrong email or tenant_id.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ConcurrentIdentityTechnicalTest {

    private static final int ROUNDS_PER_USER = 8;

    @Autowired
    private MockMvc mockMvc;

    private static final class Identity {
        final String tenantId;
        final String email;
        final String password;
        final String sub;
        final String clientSecret;
        final String redirectUri;

        Identity(String tenantId, String email, String password, String sub, String clientSecret,
                 String redirectUri) {
            this.tenantId = tenantId;
            this.email = email;
            this.password = password;
            this.sub = sub;
            this.clientSecret = clientSecret;
            this.redirectUri = redirectUri;
        }
    }

    private static final List<Identity> USERS = List.of(
        new Identity(TENANT_A, "alice@example.com", "alice-password", "101", CLIENT_SECRET, REDIRECT_URI),
        new Identity(TENANT_A, "bob@example.com", "bob-password", "102", CLIENT_SECRET, REDIRECT_URI),
        new Identity(TENANT_B, "carol@example.com", "carol-password", "101", TENANT_B_SECRET, TENANT_B_REDIRECT_URI));

    @Test
    void http_concurrent_flows_never_cross_identities() throws Exception {
        int tasks = USERS.size() * ROUNDS_PER_USER;
        ExecutorService pool = Executors.newFixedThreadPool(tasks);
        CountDownLatch start = new CountDownLatch(1);
        List<Identity> expected = new ArrayList<>();
        List<Future<Map<String, Object>>> results = new ArrayList<>();
        try {
            for (int round = 0; round < ROUNDS_PER_USER; round++) {
                for (Identity user : USERS) {
                    Callable<Map<String, Object>> flow = () -> {
                        start.await();
                        return runFlow(user);
                    };
                    expected.add(user);
                    results.add(pool.submit(flow));
                }
            }
            start.countDown();

            for (int i = 0; i < tasks; i++) {
                Identity user = expected.get(i);
                Map<String, Object> userInfo = results.get(i).get(60, TimeUnit.SECONDS);
                assertThat(userInfo)
                    .as("flow %s of %s in %s", i, user.email, user.tenantId)
                    .containsEntry("sub", user.sub)
                    .containsEntry("email", user.email)
                    .containsEntry("tenant_id", user.tenantId);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private Map<String, Object> runFlow(Identity user) throws Exception {
        OidcFlowClient client = new OidcFlowClient(mockMvc);
        Cookie[] cookies = client.login(user.tenantId, user.email, user.password);
        String code = client.obtainCode(cookies, user.tenantId, CLIENT_ID, user.redirectUri);

        MvcResult token = client.token(code, user.redirectUri, CLIENT_ID, user.clientSecret);
        assertThat(token.getResponse().getStatus()).as("token for %s", user.email).isEqualTo(200);
        String accessToken = (String) json(token).get("access_token");

        MvcResult userInfo = client.userInfo(accessToken);
        assertThat(userInfo.getResponse().getStatus()).isEqualTo(200);
        return json(userInfo);
    }
}
