package com.openmeet.oidc.code;

import com.openmeet.oidc.token.JwtSigner;
import com.openmeet.oidc.token.OidcClaimNames;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Signs and verifies authorization codes as self-contained JWTs.
 *
 * A code is valid when its signature verifies with this server's key, its
 * issuer is this server, it is marked {@code token_use=auth_code}, every binding
 * claim is present, and the clock has not reached its expiry. Single use is
 * enforced separately by the ReplayGuard.
 */
public class AuthCodeCodec {

    private final JwtSigner signer;
    private final JwtDecoder decoder;
    private final String issuer;
    private final Clock clock;
    private final Duration ttl;

    public AuthCodeCodec(JwtSigner signer, JwtDecoder decoder, String issuer, Clock clock, Duration ttl) {
        this.signer = signer;
        this.decoder = decoder;
        this.issuer = issuer;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Build a fresh code bound to the given request, issued now and expiring after the code lifetime.
     */
    public AuthorizationCode mint(String tenantId, String userId, String clientId, String redirectUri,
                                  String scope, String state, String nonce) {
        Instant now = clock.instant();
        return new AuthorizationCode(UUID.randomUUID().toString(), tenantId, userId, clientId, redirectUri,
            scope, state, nonce, now, now.plus(ttl));
    }

    public String issue(AuthorizationCode code) {
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
            .id(code.getCodeId())
            .issuer(issuer)
            .audience(List.of(issuer))
            .subject(code.getUserId())
            .issuedAt(code.getIssuedAt())
            .expiresAt(code.getExpiresAt())
            .claim(OidcClaimNames.TOKEN_USE, OidcClaimNames.USE_AUTH_CODE)
            .claim(OidcClaimNames.TENANT_ID, code.getTenantId())
            .claim(OidcClaimNames.CLIENT_ID, code.getClientId())
            .claim(OidcClaimNames.REDIRECT_URI, code.getRedirectUri());
        if (code.getScope() != null) {
            claims.claim(OidcClaimNames.SCOPE, code.getScope());
        }
        if (code.getState() != null) {
            claims.claim(OidcClaimNames.STATE, code.getState());
        }
        if (code.getNonce() != null) {
            claims.claim(OidcClaimNames.NONCE, code.getNonce());
        }
        return signer.sign(claims.build());
    }

    public AuthorizationCode verify(String signedCode) throws AuthCodeVerificationException {
        if (signedCode == null || signedCode.isBlank()) {
            throw invalid("Authorization code is empty");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(signedCode);
        } catch (JwtException e) {
            throw new AuthCodeVerificationException(AuthCodeVerificationException.Reason.INVALID,
                "Authorization code failed verification", e);
        }

        if (!OidcClaimNames.USE_AUTH_CODE.equals(jwt.getClaimAsString(OidcClaimNames.TOKEN_USE))) {
            throw invalid("Not an authorization code");
        }
        if (!issuer.equals(jwt.getClaimAsString("iss"))) {
            throw invalid("Authorization code was issued by another issuer");
        }
        String codeId = jwt.getId();
        String tenantId = jwt.getClaimAsString(OidcClaimNames.TENANT_ID);
        String userId = jwt.getSubject();
        String clientId = jwt.getClaimAsString(OidcClaimNames.CLIENT_ID);
        String redirectUri = jwt.getClaimAsString(OidcClaimNames.REDIRECT_URI);
        Instant issuedAt = jwt.getIssuedAt();
        Instant expiresAt = jwt.getExpiresAt();
        if (isBlank(codeId) || isBlank(tenantId) || isBlank(userId) || isBlank(clientId)
            || isBlank(redirectUri) || issuedAt == null || expiresAt == null) {
            throw invalid("Authorization code is missing required claims");
        }
        if (!expiresAt.isAfter(issuedAt) || Duration.between(issuedAt, expiresAt).compareTo(ttl) > 0) {
            throw invalid("Authorization code lifetime exceeds " + ttl.getSeconds() + " seconds");
        }
        if (!clock.instant().isBefore(expiresAt)) {
            throw new AuthCodeVerificationException(AuthCodeVerificationException.Reason.EXPIRED,
                "Authorization code has expired");
        }

        return new AuthorizationCode(codeId, tenantId, userId, clientId, redirectUri,
            jwt.getClaimAsString(OidcClaimNames.SCOPE),
            jwt.getClaimAsString(OidcClaimNames.STATE),
            jwt.getClaimAsString(OidcClaimNames.NONCE),
            issuedAt, expiresAt);
    }

    private static AuthCodeVerificationException invalid(String message) {
        return new AuthCodeVerificationException(AuthCodeVerificationException.Reason.INVALID, message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
