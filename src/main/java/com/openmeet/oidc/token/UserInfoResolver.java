package com.openmeet.oidc.token;

import com.openmeet.oidc.error.OidcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a bearer access token to userinfo claims.
 *
 * The claims come from the verified token and nothing else: no session,
 * request context or "last authenticated user" is consulted, so two users'
 * tokens can never resolve to each other's identity.
 */
public class UserInfoResolver {

    private static final Logger log = LoggerFactory.getLogger(UserInfoResolver.class);

    private final JwtDecoder decoder;
    private final String issuer;
    private final Clock clock;

    public UserInfoResolver(JwtDecoder decoder, String issuer, Clock clock) {
        this.decoder = decoder;
        this.issuer = issuer;
        this.clock = clock;
    }

    /**
     * @return {sub, email, name, preferred_username, tenant_id}
     * @throws OidcException INVALID_TOKEN when the token is not a live access token of this issuer
     */
    public Map<String, Object> resolve(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw OidcException.invalidToken("Bearer token required");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(accessToken);
        } catch (JwtException e) {
            log.warn("Rejected userinfo request: {}", e.getMessage());
            throw OidcException.invalidToken("Invalid access token");
        }
        if (!OidcClaimNames.USE_ACCESS.equals(jwt.getClaimAsString(OidcClaimNames.TOKEN_USE))
            || !issuer.equals(jwt.getClaimAsString("iss"))) {
            throw OidcException.invalidToken("Invalid access token");
        }
        Instant expiresAt = jwt.getExpiresAt();
        if (expiresAt == null || !clock.instant().isBefore(expiresAt)) {
            throw OidcException.invalidToken("Access token has expired");
        }
        String subject = jwt.getSubject();
        String tenantId = jwt.getClaimAsString(OidcClaimNames.TENANT_ID);
        if (subject == null || tenantId == null) {
            throw OidcException.invalidToken("Invalid access token");
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", subject);
        claims.put(OidcClaimNames.EMAIL, jwt.getClaimAsString(OidcClaimNames.EMAIL));
        claims.put(OidcClaimNames.NAME, jwt.getClaimAsString(OidcClaimNames.NAME));
        claims.put(OidcClaimNames.PREFERRED_USERNAME, jwt.getClaimAsString(OidcClaimNames.PREFERRED_USERNAME));
        claims.put(OidcClaimNames.TENANT_ID, tenantId);
        return claims;
    }
}
