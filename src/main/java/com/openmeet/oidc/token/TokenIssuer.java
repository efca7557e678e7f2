package com.openmeet.oidc.token;

import com.openmeet.oidc.user.UserClaims;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Issues access and ID tokens.
 *
 * Every claim userinfo later returns is written into the access token here,
 * so resolution never needs anything but the token itself.
 */
public class TokenIssuer {

    private final JwtSigner signer;
    private final String issuer;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration idTokenTtl;

    public TokenIssuer(JwtSigner signer, String issuer, Clock clock, Duration accessTokenTtl, Duration idTokenTtl) {
        this.signer = signer;
        this.issuer = issuer;
        this.clock = clock;
        this.accessTokenTtl = accessTokenTtl;
        this.idTokenTtl = idTokenTtl;
    }

    public IssuedTokens issue(UserClaims user, String clientId, String scope, String nonce) {
        Instant now = clock.instant();
        String accessToken = signer.sign(accessTokenClaims(user, clientId, scope, now));
        String idToken = signer.sign(idTokenClaims(user, clientId, nonce, now));
        return new IssuedTokens(accessToken, idToken, accessTokenTtl.getSeconds(), scope);
    }

    private JwtClaimsSet accessTokenClaims(UserClaims user, String clientId, String scope, Instant now) {
        JwtClaimsSet.Builder claims = baseClaims(user, clientId, now, accessTokenTtl)
            .claim(OidcClaimNames.TOKEN_USE, OidcClaimNames.USE_ACCESS)
            .claim(OidcClaimNames.CLIENT_ID, clientId);
        if (scope != null) {
            claims.claim(OidcClaimNames.SCOPE, scope);
        }
        return claims.build();
    }

    private JwtClaimsSet idTokenClaims(UserClaims user, String clientId, String nonce, Instant now) {
        JwtClaimsSet.Builder claims = baseClaims(user, clientId, now, idTokenTtl)
            .claim(OidcClaimNames.TOKEN_USE, OidcClaimNames.USE_ID)
            .claim(OidcClaimNames.AZP, clientId);
        if (nonce != null) {
            claims.claim(OidcClaimNames.NONCE, nonce);
        }
        return claims.build();
    }

    private JwtClaimsSet.Builder baseClaims(UserClaims user, String clientId, Instant now, Duration ttl) {
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
            .id(UUID.randomUUID().toString())
            .issuer(issuer)
            .subject(user.getUserId())
            .audience(List.of(clientId))
            .issuedAt(now)
            .expiresAt(now.plus(ttl))
            .claim(OidcClaimNames.TENANT_ID, user.getTenantId())
            .claim(OidcClaimNames.NAME, user.getDisplayName())
            .claim(OidcClaimNames.PREFERRED_USERNAME, user.getPreferredUsername());
        if (user.getEmail() != null) {
            claims.claim(OidcClaimNames.EMAIL, user.getEmail());
        }
        return claims;
    }
}
