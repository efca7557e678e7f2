package com.openmeet.oidc.web;

import com.openmeet.oidc.error.OidcErrorKind;
import com.openmeet.oidc.error.OidcException;
import com.openmeet.oidc.config.properties.OidcProperties;
import com.openmeet.oidc.ratelimit.RateLimitResult;
import com.openmeet.oidc.ratelimit.RateLimiter;
import com.openmeet.oidc.session.BootstrapTokenStore;
import com.openmeet.oidc.session.LoginSession;
import com.openmeet.oidc.session.SessionCookies;
import com.openmeet.oidc.session.SessionStore;
import com.openmeet.oidc.user.UserClaims;
import com.openmeet.oidc.user.UserDirectory;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Login session lifecycle.
 *
 * - POST /login            email/password within a tenant; writes the session and tenant cookies
 * - POST /logout           deletes the session and expires both cookies
 * - POST /bootstrap-token  trades a live session for a single-use token accepted by /authorize
 *
 * After login the browser is sent back to {@code continue} when it points at
 * this server's /authorize endpoint; any other target is ignored so the login
 * form cannot be used as an open redirect.
 */
@RestController
public class LoginController {

    private static final Logger log = LoggerFactory.getLogger(LoginController.class);

    private final UserDirectory userDirectory;
    private final SessionStore sessionStore;
    private final BootstrapTokenStore bootstrapTokenStore;
    private final SessionCookies sessionCookies;
    private final RateLimiter rateLimiter;
    private final OidcProperties properties;

    public LoginController(UserDirectory userDirectory, SessionStore sessionStore,
                           BootstrapTokenStore bootstrapTokenStore, SessionCookies sessionCookies,
                           RateLimiter rateLimiter, OidcProperties properties) {
        this.userDirectory = userDirectory;
        this.sessionStore = sessionStore;
        this.bootstrapTokenStore = bootstrapTokenStore;
        this.sessionCookies = sessionCookies;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> login(
            @RequestParam(name = "tenant_id", required = false) String tenantId,
            @RequestParam(name = "email", required = false) String email,
            @RequestParam(name = "password", required = false) String password,
            @RequestParam(name = "continue", required = false) String continueUrl,
            HttpServletRequest request) {

        if (isBlank(tenantId) || isBlank(email) || isBlank(password)) {
            throw OidcException.malformed("Missing required parameters: tenant_id, email, password");
        }
        RateLimitResult limit = rateLimiter.hit("login:" + tenantId + ':' + request.getRemoteAddr());
        if (!limit.isPermitted()) {
            log.warn("Login rate limited for tenant {} from {}", tenantId, request.getRemoteAddr());
            throw OidcException.rateLimited(limit.getRetryAfter());
        }

        UserClaims user = userDirectory.authenticate(tenantId, email, password)
            .orElseThrow(() -> {
                log.warn("Login failed in tenant {}", tenantId);
                return new OidcException(OidcErrorKind.INVALID_SESSION, "access_denied", "Invalid email or password");
            });
        LoginSession session = sessionStore.create(tenantId, user.getUserId());
        log.info("User {} logged in to tenant {}", user.getUserId(), tenantId);

        ResponseEntity.BodyBuilder response = isLocalAuthorizeUrl(continueUrl)
            ? ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, continueUrl)
            : ResponseEntity.status(HttpStatus.NO_CONTENT);
        return response
            .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(session).toArray(new String[0]))
            .cacheControl(CacheControl.noStore())
            .build();
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        String tenantId = sessionCookies.readTenantId(request);
        String sessionId = sessionCookies.readSessionId(request);
        if (tenantId != null && sessionId != null) {
            sessionStore.delete(tenantId, sessionId);
            log.debug("Session ended in tenant {}", tenantId);
        }
        List<String> cleared = sessionCookies.clear();
        return ResponseEntity.status(HttpStatus.NO_CONTENT)
            .header(HttpHeaders.SET_COOKIE, cleared.toArray(new String[0]))
            .build();
    }

    @PostMapping(path = "/bootstrap-token", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> bootstrapToken(HttpServletRequest request) {
        String tenantId = sessionCookies.readTenantId(request);
        String sessionId = sessionCookies.readSessionId(request);
        if (tenantId == null || sessionId == null) {
            throw OidcException.invalidSession("Login session required");
        }
        LoginSession session = sessionStore.get(tenantId, sessionId)
            .orElseThrow(() -> OidcException.invalidSession("Login session is invalid or has expired"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bootstrap_token", bootstrapTokenStore.issue(tenantId, session.getUserId()));
        body.put("tenant_id", tenantId);
        body.put("expires_in", properties.getBootstrapTokenTtl().getSeconds());
        return ResponseEntity.ok()
            .cacheControl(CacheControl.noStore())
            .body(body);
    }

    static boolean isLocalAuthorizeUrl(String url) {
        if (url == null) {
            return false;
        }
        return url.equals("/authorize") || url.startsWith("/authorize?");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
