package com.openmeet.oidc.token;

/**
 * Claim names used in the JWTs this server signs.
 */
public final class OidcClaimNames {

    public static final String TENANT_ID = "tenant_id";
    public static final String TOKEN_USE = "token_use";
    public static final String CLIENT_ID = "client_id";
    public static final String REDIRECT_URI = "redirect_uri";
    public static final String SCOPE = "scope";
    public static final String STATE = "state";
    public static final String NONCE = "nonce";
    public static final String EMAIL = "email";
    public static final String NAME = "name";
    public static final String PREFERRED_USERNAME = "preferred_username";
    public static final String AZP = "azp";

    // token_use values; a JWT of one kind is never accepted as another
    public static final String USE_AUTH_CODE = "auth_code";
    public static final String USE_ACCESS = "access";
    public static final String USE_ID = "id";

    private OidcClaimNames() {
    }
}
