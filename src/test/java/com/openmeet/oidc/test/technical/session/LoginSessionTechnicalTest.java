package com.openmeet.oidc.test.technical.session;

import com.openmeet.oidc.test.util.OidcFlowClient;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;

import static com.openmeet.oidc.test.util.OidcFlowClient.CLIENT_ID;
import static com.openmeet.oidc.test.util.OidcFlowClient.REDIRECT_URI;
import static com.openmeet.oidc.test.util.OidcFlowClient.TENANT_A;
import static com.openmeet.oidc.test.util.OidcFlowClient.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

/**
 * BLACK-BOX HTTP test of the login session lifecycle: /login, /logout and
 * /bootstrap-token.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LoginSessionTechnicalTest {

    @Autowired
    private MockMvc mockMvc;

    private OidcFlowClient client;

    @BeforeEach
    void setUp() {
        client = new OidcFlowClient(mockMvc);
    }

    @Test
    void http_login_sets_http_only_session_and_tenant_cookies() throws Exception {
        MvcResult result = mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("tenant_id", TENANT_A)
                .param("email", "alice@example.com")
                .param("password", "alice-password"))
            .andReturn();

        assertThat(result.getResponse().getStatus()).isEqualTo(204);
        List<String> setCookies = result.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        String sessionCookie = setCookies.stream().filter(c -> c.startsWith("OIDC_SESSION=")).findFirst().orElse(null);
        assertThat(sessionCookie)
            .as("Session cookie must be set. Available Set-Cookie: %s", setCookies)
            .isNotNull()
            .contains("Path=/")
            .containsIgnoringCase("HttpOnly")
            .contains("SameSite=Lax")
            .matches("^OIDC_SESSION=[A-Za-z0-9_-]{43};.*");
        assertThat(setCookies).anyMatch(c -> c.startsWith("OIDC_TENANT=" + TENANT_A + ";"));
    }

    @Test
    void http_login_with_wrong_password_is_rejected_without_cookies() throws Exception {
        MvcResult result = mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("tenant_id", TENANT_A)
                .param("email", "alice@example.com")
                .param("password", "nope"))
            .andReturn();

        assertThat(result.getResponse().getStatus()).isEqualTo(401);
        assertThat(result.getResponse().getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
    }

    @Test
    void http_login_continues_to_local_authorize_url_only() throws Exception {
        MvcResult local = mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("tenant_id", TENANT_A)
                .param("email", "alice@example.com")
                .param("password", "alice-password")
                .param("continue", "/authorize?client_id=" + CLIENT_ID))
            .andReturn();
        MvcResult foreign = mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("tenant_id", TENANT_A)
                .param("email", "alice@example.com")
                .param("password", "alice-password")
                .param("continue", "https://evil.com/phish"))
            .andReturn();

        assertThat(local.getResponse().getStatus()).isEqualTo(302);
        assertThat(local.getResponse().getHeader(HttpHeaders.LOCATION)).isEqualTo("/authorize?client_id=" + CLIENT_ID);
        assertThat(foreign.getResponse().getStatus()).isEqualTo(204);
        assertThat(foreign.getResponse().getHeader(HttpHeaders.LOCATION)).isNull();
    }

    @Test
    void http_authorize_uses_the_tenant_cookie_when_no_tenant_parameter_is_given() throws Exception {
        Cookie[] cookies = client.login(TENANT_A, "bob@example.com", "bob-password");

        String code = client.obtainCode(cookies, null, CLIENT_ID, REDIRECT_URI);

        assertThat(code).isNotBlank();
    }

    @Test
    void http_logout_invalidates_the_session() throws Exception {
        Cookie[] cookies = client.login(TENANT_A, "alice@example.com", "alice-password");

        MvcResult logout = mockMvc.perform(post("/logout").cookie(cookies)).andReturn();
        assertThat(logout.getResponse().getStatus()).isEqualTo(204);
        assertThat(logout.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
            .anyMatch(c -> c.startsWith("OIDC_SESSION=;") && c.contains("Max-Age=0"));

        MvcResult authorize = client.authorize(cookies, TENANT_A, CLIENT_ID, REDIRECT_URI, "s", null);
        assertThat(authorize.getResponse().getHeader(HttpHeaders.LOCATION))
            .as("The old session cookie must no longer authorize")
            .startsWith("https://platform.test/auth/login?");
    }

    @Test
    void http_bootstrap_token_authorizes_once_without_cookies() throws Exception {
        Cookie[] cookies = client.login(TENANT_A, "alice@example.com", "alice-password");
        MvcResult issued = mockMvc.perform(post("/bootstrap-token").cookie(cookies)).andReturn();
        assertThat(issued.getResponse().getStatus()).isEqualTo(200);
        Map<String, Object> body = json(issued);
        assertThat(body).containsEntry("expires_in", 60);
        String token = (String) body.get("bootstrap_token");

        MvcResult first = mockMvc.perform(get("/authorize")
                .param("tenant_id", TENANT_A)
                .param("client_id", CLIENT_ID)
                .param("redirect_uri", REDIRECT_URI)
                .param("response_type", "code")
                .param("bootstrap_token", token))
            .andReturn();
        MvcResult second = mockMvc.perform(get("/authorize")
                .param("tenant_id", TENANT_A)
                .param("client_id", CLIENT_ID)
                .param("redirect_uri", REDIRECT_URI)
                .param("response_type", "code")
                .param("bootstrap_token", token))
            .andReturn();

        assertThat(first.getResponse().getStatus()).isEqualTo(302);
        assertThat(first.getResponse().getHeader(HttpHeaders.LOCATION)).startsWith(REDIRECT_URI + "?code=");
        assertThat(second.getResponse().getStatus()).isEqualTo(401);
    }

    @Test
    void http_bootstrap_token_requires_a_session() throws Exception {
        MvcResult result = mockMvc.perform(post("/bootstrap-token")).andReturn();

        assertThat(result.getResponse().getStatus()).isEqualTo(401);
        assertThat(json(result)).containsEntry("error", "login_required");
    }
}
