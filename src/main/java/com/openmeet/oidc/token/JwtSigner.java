package com.openmeet.oidc.token;

import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

/**
 * RS256-signs claim sets with the server's signing key.
 * Codes, access tokens and ID tokens all go through here.
 */
public class JwtSigner {

    private final JwtEncoder jwtEncoder;
    private final String keyId;

    public JwtSigner(JwtEncoder jwtEncoder, String keyId) {
        this.jwtEncoder = jwtEncoder;
        this.keyId = keyId;
    }

    public String sign(JwtClaimsSet claims) {
        JwsHeader header = JwsHeader.with(SignatureAlgorithm.RS256)
            .keyId(keyId)
            .build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }
}
