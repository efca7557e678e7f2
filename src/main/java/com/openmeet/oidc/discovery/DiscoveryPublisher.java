package com.openmeet.oidc.discovery;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issuer metadata and public signing keys.
 *
 * Both documents are built once from the issuer and the signing key; they only
 * change when the key does, which means a restart.
 */
public class DiscoveryPublisher {

    private final Map<String, Object> configuration;
    private final Map<String, Object> jwks;

    public DiscoveryPublisher(String issuer, RSAKey signingKey) {
        this.configuration = Collections.unmodifiableMap(buildConfiguration(trimTrailingSlash(issuer)));
        this.jwks = Collections.unmodifiableMap(new JWKSet(signingKey).toPublicJWKSet().toJSONObject());
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    /**
     * {keys: [{kty, use, kid, alg, n, e}]}; never contains private parameters.
     */
    public Map<String, Object> getJwks() {
        return jwks;
    }

    private static Map<String, Object> buildConfiguration(String issuer) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("issuer", issuer);
        doc.put("authorization_endpoint", issuer + "/authorize");
        doc.put("token_endpoint", issuer + "/token");
        doc.put("userinfo_endpoint", issuer + "/userinfo");
        doc.put("jwks_uri", issuer + "/jwks");
        doc.put("scopes_supported", List.of("openid", "profile", "email"));
        doc.put("response_types_supported", List.of("code"));
        doc.put("response_modes_supported", List.of("query"));
        doc.put("grant_types_supported", List.of("authorization_code"));
        doc.put("subject_types_supported", List.of("public"));
        doc.put("id_token_signing_alg_values_supported", List.of("RS256"));
        doc.put("token_endpoint_auth_methods_supported",
            List.of("none", "client_secret_post", "client_secret_basic"));
        doc.put("claims_supported", List.of("sub", "name", "email", "preferred_username", "tenant_id"));
        return doc;
    }

    private static String trimTrailingSlash(String issuer) {
        return issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
    }
}
