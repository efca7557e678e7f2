package com.openmeet.oidc.web;

import com.openmeet.oidc.authorize.AuthorizationOutcome;
import com.openmeet.oidc.authorize.AuthorizationRequest;
import com.openmeet.oidc.authorize.AuthorizationService;
import com.openmeet.oidc.authorize.CallerCredentials;
import com.openmeet.oidc.session.SessionCookies;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /authorize
 *
 * Tenant comes from the tenant_id parameter, falling back to the tenant cookie
 * written at login. Always answers with a 302: either back to the client with a
 * code, or to the login page.
 */
@RestController
public class AuthorizationController {

    private final AuthorizationService authorizationService;
    private final SessionCookies sessionCookies;

    public AuthorizationController(AuthorizationService authorizationService, SessionCookies sessionCookies) {
        this.authorizationService = authorizationService;
        this.sessionCookies = sessionCookies;
    }

    @GetMapping("/authorize")
    public ResponseEntity<Void> authorize(
            @RequestParam(name = "client_id", required = false) String clientId,
            @RequestParam(name = "redirect_uri", required = false) String redirectUri,
            @RequestParam(name = "response_type", required = false) String responseType,
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "state", required = false) String state,
            @RequestParam(name = "nonce", required = false) String nonce,
            @RequestParam(name = "tenant_id", required = false) String tenantId,
            @RequestParam(name = "bootstrap_token", required = false) String bootstrapToken,
            HttpServletRequest request) {

        String tenant = tenantId != null && !tenantId.isBlank() ? tenantId : sessionCookies.readTenantId(request);
        AuthorizationRequest authorizationRequest = new AuthorizationRequest(tenant, clientId, redirectUri,
            responseType, scope, state, nonce);
        CallerCredentials credentials = CallerCredentials.of(sessionCookies.readSessionId(request), bootstrapToken);

        AuthorizationOutcome outcome = authorizationService.authorize(authorizationRequest, credentials);
        return ResponseEntity.status(HttpStatus.FOUND)
            .header(HttpHeaders.LOCATION, outcome.getLocation().toString())
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .build();
    }
}
