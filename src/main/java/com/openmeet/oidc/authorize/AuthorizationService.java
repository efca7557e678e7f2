package com.openmeet.oidc.authorize;

import com.openmeet.oidc.client.ClientRegistry;
import com.openmeet.oidc.client.OAuthClient;
import com.openmeet.oidc.code.AuthCodeCodec;
import com.openmeet.oidc.code.AuthorizationCode;
import com.openmeet.oidc.error.OidcErrorKind;
import com.openmeet.oidc.error.OidcException;
import com.openmeet.oidc.session.BootstrapTokenStore;
import com.openmeet.oidc.session.LoginSession;
import com.openmeet.oidc.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization endpoint logic (GET /authorize).
 *
 * Order of checks:
 * 1. Required parameters and response_type=code (400)
 * 2. Client and exact redirect_uri match, before any session is looked at (401)
 * 3. Caller identity from the session cookie or a bootstrap token; a missing or
 *    invalid session sends the browser to the login page, never to another identity
 * 4. Mint a 60-second code bound to the request and redirect to redirect_uri
 */
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final ClientRegistry clientRegistry;
    private final SessionStore sessionStore;
    private final BootstrapTokenStore bootstrapTokenStore;
    private final AuthCodeCodec codeCodec;
    private final String loginPageUrl;

    public AuthorizationService(ClientRegistry clientRegistry, SessionStore sessionStore,
                                BootstrapTokenStore bootstrapTokenStore, AuthCodeCodec codeCodec,
                                String loginPageUrl) {
        this.clientRegistry = clientRegistry;
        this.sessionStore = sessionStore;
        this.bootstrapTokenStore = bootstrapTokenStore;
        this.codeCodec = codeCodec;
        this.loginPageUrl = loginPageUrl;
    }

    public AuthorizationOutcome authorize(AuthorizationRequest request, CallerCredentials credentials) {
        // Step 1: well-formedness
        if (isBlank(request.getClientId()) || isBlank(request.getRedirectUri())) {
            throw OidcException.malformed("Missing required parameters: client_id, redirect_uri");
        }
        if (!"code".equals(request.getResponseType())) {
            throw new OidcException(OidcErrorKind.MALFORMED_REQUEST, "unsupported_response_type",
                "Unsupported response_type; only 'code' is supported");
        }
        if (isBlank(request.getTenantId())) {
            throw OidcException.malformed("Missing tenant_id");
        }
        String tenantId = request.getTenantId();

        // Step 2: client + redirect_uri, before touching the session
        OAuthClient client = clientRegistry.lookup(tenantId, request.getClientId())
            .orElseThrow(() -> {
                log.warn("Authorize rejected: unknown client {} in tenant {}", request.getClientId(), tenantId);
                return OidcException.unknownClient("Invalid client_id");
            });
        if (!clientRegistry.validateRedirectUri(client, request.getRedirectUri())) {
            log.warn("Authorize rejected: redirect_uri not registered for client {} in tenant {}",
                client.getClientId(), tenantId);
            throw OidcException.unknownClient("Invalid redirect_uri");
        }
        String scope = resolveScope(client, request.getScope());

        // Step 3: caller identity
        Optional<String> userId = resolveUser(tenantId, credentials);
        if (userId.isEmpty()) {
            if (credentials.usesBootstrapToken()) {
                log.warn("Authorize rejected: invalid bootstrap token for tenant {}", tenantId);
                throw OidcException.invalidSession("Invalid or expired bootstrap token");
            }
            return AuthorizationOutcome.loginRequired(loginRedirect(request));
        }

        // Step 4: mint code and redirect back to the client
        AuthorizationCode code = codeCodec.mint(tenantId, userId.get(), client.getClientId(),
            request.getRedirectUri(), scope, request.getState(), request.getNonce());
        String signedCode = codeCodec.issue(code);
        log.debug("Issued authorization code for client {} in tenant {}", client.getClientId(), tenantId);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", signedCode);
        // null state is skipped entirely, never sent as ""
        params.put("state", request.getState());
        return AuthorizationOutcome.codeIssued(withQuery(request.getRedirectUri(), params));
    }

    private Optional<String> resolveUser(String tenantId, CallerCredentials credentials) {
        if (credentials.usesBootstrapToken()) {
            return bootstrapTokenStore.consume(tenantId, credentials.getBootstrapToken());
        }
        if (credentials.getSessionId() == null) {
            return Optional.empty();
        }
        return sessionStore.get(tenantId, credentials.getSessionId()).map(LoginSession::getUserId);
    }

    /**
     * Requested scopes must all be registered for the client. A missing scope defaults to "openid".
     */
    private String resolveScope(OAuthClient client, String requested) {
        if (isBlank(requested)) {
            return "openid";
        }
        Set<String> scopes = new LinkedHashSet<>(Arrays.asList(requested.trim().split("\\s+")));
        for (String scope : scopes) {
            if (!client.getScopes().contains(scope)) {
                throw new OidcException(OidcErrorKind.MALFORMED_REQUEST, "invalid_scope",
                    "Scope not allowed for this client: " + scope);
            }
        }
        return String.join(" ", scopes);
    }

    private URI loginRedirect(AuthorizationRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("tenant_id", request.getTenantId());
        params.put("client_id", request.getClientId());
        params.put("redirect_uri", request.getRedirectUri());
        params.put("response_type", request.getResponseType());
        params.put("scope", request.getScope());
        params.put("state", request.getState());
        params.put("nonce", request.getNonce());
        return withQuery(loginPageUrl, params);
    }

    /**
     * Appends the non-null params to base. Values go in as URI variables so they
     * are strictly encoded ('&', '=', '+' included).
     */
    private static URI withQuery(String base, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base);
        Map<String, String> values = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (value != null) {
                builder.queryParam(name, "{" + name + "}");
                values.put(name, value);
            }
        });
        return builder.encode().buildAndExpand(values).toUri();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
