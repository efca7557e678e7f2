package com.openmeet.oidc.authorize;

import java.net.URI;

/**
 * Where /authorize sends the browser: back to the client with a code, or to the login page.
 */
public final class AuthorizationOutcome {

    private final URI location;
    private final boolean loginRequired;

    private AuthorizationOutcome(URI location, boolean loginRequired) {
        this.location = location;
        this.loginRequired = loginRequired;
    }

    public static AuthorizationOutcome codeIssued(URI location) {
        return new AuthorizationOutcome(location, false);
    }

    public static AuthorizationOutcome loginRequired(URI location) {
        return new AuthorizationOutcome(location, true);
    }

    public URI getLocation() {
        return location;
    }

    public boolean isLoginRequired() {
        return loginRequired;
    }
}
