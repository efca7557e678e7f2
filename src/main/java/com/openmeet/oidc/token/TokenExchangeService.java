package com.openmeet.oidc.token;

import com.openmeet.oidc.client.ClientRegistry;
import com.openmeet.oidc.client.OAuthClient;
import com.openmeet.oidc.code.AuthCodeCodec;
import com.openmeet.oidc.code.AuthCodeVerificationException;
import com.openmeet.oidc.code.AuthorizationCode;
import com.openmeet.oidc.error.OidcErrorKind;
import com.openmeet.oidc.error.OidcException;
import com.openmeet.oidc.ratelimit.RateLimitResult;
import com.openmeet.oidc.ratelimit.RateLimiter;
import com.openmeet.oidc.replay.ReplayGuard;
import com.openmeet.oidc.user.UserClaims;
import com.openmeet.oidc.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token endpoint logic (POST /token, grant_type=authorization_code).
 *
 * Steps, each terminal on failure:
 * 1. Rate limit per client and caller address (429), ahead of everything else
 * 2. Parameter shape (400) and a decodable Basic header (401)
 * 3. Code signature, issuer and 60-second expiry
 * 4. Early replay report ("already been used")
 * 5. redirect_uri equals the one bound into the code
 * 6. Client matches the code and authenticates
 * 7. User still exists in the code's tenant
 * 8. Atomic consumption in the ReplayGuard, the only state change
 * 9. Access and ID tokens bound to the code's tenant, user, client and scope
 */
public class TokenExchangeService {

    private static final Logger log = LoggerFactory.getLogger(TokenExchangeService.class);

    static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    static final String ALREADY_USED_MESSAGE = "Authorization code has already been used";
    static final String MALFORMED_BASIC_MESSAGE = "Malformed Basic authorization header";

    private final RateLimiter rateLimiter;
    private final AuthCodeCodec codeCodec;
    private final ReplayGuard replayGuard;
    private final ClientRegistry clientRegistry;
    private final ClientAuthenticator clientAuthenticator;
    private final UserDirectory userDirectory;
    private final TokenIssuer tokenIssuer;

    public TokenExchangeService(RateLimiter rateLimiter, AuthCodeCodec codeCodec, ReplayGuard replayGuard,
                                ClientRegistry clientRegistry, ClientAuthenticator clientAuthenticator,
                                UserDirectory userDirectory, TokenIssuer tokenIssuer) {
        this.rateLimiter = rateLimiter;
        this.codeCodec = codeCodec;
        this.replayGuard = replayGuard;
        this.clientRegistry = clientRegistry;
        this.clientAuthenticator = clientAuthenticator;
        this.userDirectory = userDirectory;
        this.tokenIssuer = tokenIssuer;
    }

    public IssuedTokens exchange(TokenRequest request) {
        // Step 1: rate limit before any validation
        String rateKey = "token:" + (request.getClientId() != null ? request.getClientId() : "-")
            + ':' + (request.getCallerAddress() != null ? request.getCallerAddress() : "-");
        RateLimitResult limit = rateLimiter.hit(rateKey);
        if (!limit.isPermitted()) {
            log.warn("Token request rate limited for client {} from {}", request.getClientId(), request.getCallerAddress());
            throw OidcException.rateLimited(limit.getRetryAfter());
        }

        // Step 2: parameter shape
        if (request.hasMalformedClientCredentials()) {
            log.warn("Token request with malformed Basic authorization header from {}", request.getCallerAddress());
            throw OidcException.clientAuthFailure(MALFORMED_BASIC_MESSAGE);
        }
        if (!GRANT_AUTHORIZATION_CODE.equals(request.getGrantType())) {
            throw new OidcException(OidcErrorKind.MALFORMED_REQUEST, "unsupported_grant_type",
                "Unsupported grant_type; only 'authorization_code' is supported");
        }
        if (isBlank(request.getCode()) || isBlank(request.getRedirectUri())) {
            throw OidcException.malformed("Missing required token parameters: code, redirect_uri");
        }

        // Step 3: verify code
        AuthorizationCode code;
        try {
            code = codeCodec.verify(request.getCode());
        } catch (AuthCodeVerificationException e) {
            log.warn("Rejected authorization code for client {}: {}", request.getClientId(), e.getMessage());
            if (e.getReason() == AuthCodeVerificationException.Reason.EXPIRED) {
                throw OidcException.invalidCode("Authorization code has expired");
            }
            throw OidcException.invalidCode("Invalid or expired authorization code");
        }

        // Step 4: report a replay before anything else about the code
        if (replayGuard.isConsumed(code.getTenantId(), code.getCodeId())) {
            log.warn("SECURITY: authorization code reuse detected for client {} in tenant {}",
                code.getClientId(), code.getTenantId());
            throw OidcException.invalidCode(ALREADY_USED_MESSAGE);
        }

        // Step 5: redirect_uri binding
        if (!code.getRedirectUri().equals(request.getRedirectUri())) {
            log.warn("SECURITY: redirect_uri mismatch for client {} in tenant {}", code.getClientId(), code.getTenantId());
            throw OidcException.invalidCode("redirect_uri does not match authorization request");
        }

        // Step 6: client binding + authentication
        String clientId = request.getClientId() != null ? request.getClientId() : code.getClientId();
        if (!clientId.equals(code.getClientId())) {
            log.warn("SECURITY: client {} tried to redeem a code issued to {} in tenant {}",
                clientId, code.getClientId(), code.getTenantId());
            throw OidcException.unknownClient("client_id does not match authorization request");
        }
        OAuthClient client = clientRegistry.lookup(code.getTenantId(), clientId)
            .orElseThrow(() -> OidcException.clientAuthFailure("Invalid client_id"));
        clientAuthenticator.authenticate(client, request.getClientSecret());

        // Step 7: user
        UserClaims user = userDirectory.findById(code.getTenantId(), code.getUserId())
            .orElseThrow(() -> {
                log.warn("User of authorization code no longer exists in tenant {}", code.getTenantId());
                return OidcException.invalidCode("User not found");
            });

        // Step 8: last irreversible step
        if (!replayGuard.tryConsume(code.getTenantId(), code.getCodeId())) {
            log.warn("SECURITY: concurrent redemption of one authorization code for client {} in tenant {}",
                code.getClientId(), code.getTenantId());
            throw OidcException.invalidCode(ALREADY_USED_MESSAGE);
        }

        // Step 9
        IssuedTokens tokens = tokenIssuer.issue(user, client.getClientId(), code.getScope(), code.getNonce());
        log.debug("Issued tokens for client {} in tenant {}", client.getClientId(), code.getTenantId());
        return tokens;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
