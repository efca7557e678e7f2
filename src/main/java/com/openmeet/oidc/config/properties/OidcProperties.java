package com.openmeet.oidc.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the OIDC Authorization Server.
 * Defines the issuer, artifact lifetimes, the backing store, the signing key
 * and the per-tenant client catalog.
 * Clients are loaded from properties, NOT from database.
 *
 * Usage in application.yml:
 * <pre>
 * oidc:
 *   issuer: https://api.openmeet.net/oidc
 *   login-page-url: https://platform.openmeet.net/auth/login
 *   tenants:
 *     - tenant-id: lsdfaopkljdfs
 *       clients:
 *         - client-id: matrix_synapse
 *           redirect-uris: [https://matrix.openmeet.net/_synapse/client/oidc/callback]
 *           confidential: true
 *           client-secret: "{bcrypt}$2a$10$..."
 * </pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "oidc")
public class OidcProperties {

    /**
     * Issuer URI, returned in /.well-known/openid-configuration and used as
     * the base of every published endpoint.
     */
    @NotBlank(message = "oidc.issuer is required")
    private String issuer;

    /**
     * Login page browsers are sent to when /authorize finds no valid session.
     * The original authorize parameters are appended to it.
     */
    @NotBlank(message = "oidc.login-page-url is required")
    private String loginPageUrl;

    /**
     * Authorization code lifetime. Fixed at 60 seconds.
     */
    @NotNull
    private Duration authorizationCodeTtl = Duration.ofSeconds(60);

    @NotNull
    private Duration accessTokenTtl = Duration.ofHours(1);

    @NotNull
    private Duration idTokenTtl = Duration.ofHours(1);

    /**
     * Maximum age of a login session.
     */
    @NotNull
    private Duration sessionTtl = Duration.ofHours(24);

    @NotNull
    private Duration bootstrapTokenTtl = Duration.ofSeconds(60);

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Store store = new Store();

    @Valid
    private Signing signing = new Signing();

    @Valid
    @NotEmpty(message = "oidc.tenants cannot be empty; define at least one tenant")
    private List<TenantProperties> tenants = new ArrayList<>();

    @AssertTrue(message = "oidc.authorization-code-ttl must be exactly 60 seconds")
    public boolean isAuthorizationCodeTtlFixed() {
        return Duration.ofSeconds(60).equals(authorizationCodeTtl);
    }

    // Getters/Setters
    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getLoginPageUrl() {
        return loginPageUrl;
    }

    public void setLoginPageUrl(String loginPageUrl) {
        this.loginPageUrl = loginPageUrl;
    }

    public Duration getAuthorizationCodeTtl() {
        return authorizationCodeTtl;
    }

    public void setAuthorizationCodeTtl(Duration authorizationCodeTtl) {
        this.authorizationCodeTtl = authorizationCodeTtl;
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public void setAccessTokenTtl(Duration accessTokenTtl) {
        this.accessTokenTtl = accessTokenTtl;
    }

    public Duration getIdTokenTtl() {
        return idTokenTtl;
    }

    public void setIdTokenTtl(Duration idTokenTtl) {
        this.idTokenTtl = idTokenTtl;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public Duration getBootstrapTokenTtl() {
        return bootstrapTokenTtl;
    }

    public void setBootstrapTokenTtl(Duration bootstrapTokenTtl) {
        this.bootstrapTokenTtl = bootstrapTokenTtl;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Signing getSigning() {
        return signing;
    }

    public void setSigning(Signing signing) {
        this.signing = signing;
    }

    public List<TenantProperties> getTenants() {
        return tenants;
    }

    public void setTenants(List<TenantProperties> tenants) {
        this.tenants = tenants;
    }

    /**
     * Fixed-window limit applied to the token endpoint.
     */
    public static class RateLimit {

        private boolean enabled = true;

        @Min(1)
        private int maxRequests = 10;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    /**
     * Backing store for sessions, bootstrap tokens, consumed codes and rate-limit counters.
     */
    public static class Store {

        /**
         * "redis" (shared across pods) or "memory" (single process).
         */
        @NotBlank
        private String type = "redis";

        /**
         * Prefix of every key written to Redis.
         */
        @NotBlank
        private String keyPrefix = "oidc:";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Signing {

        /**
         * Key ID published in the JWKS and in every JWS header.
         */
        @NotBlank
        private String keyId = "openmeet-oidc-rsa-key";

        @Valid
        private Keystore keystore = new Keystore();

        public String getKeyId() {
            return keyId;
        }

        public void setKeyId(String keyId) {
            this.keyId = keyId;
        }

        public Keystore getKeystore() {
            return keystore;
        }

        public void setKeystore(Keystore keystore) {
            this.keystore = keystore;
        }
    }

    /**
     * PKCS12 keystore holding the RSA signing key.
     * When no location is set, a key pair is generated at startup.
     */
    public static class Keystore {

        private String location;
        private String password;
        private String alias;
        private String keyPassword;

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getAlias() {
            return alias;
        }

        public void setAlias(String alias) {
            this.alias = alias;
        }

        public String getKeyPassword() {
            return keyPassword;
        }

        public void setKeyPassword(String keyPassword) {
            this.keyPassword = keyPassword;
        }
    }

    /**
     * One isolated tenant: its OAuth2 clients and, optionally, seeded users.
     */
    public static class TenantProperties {

        @NotBlank(message = "tenantId is required")
        private String tenantId;

        @Valid
        private List<ClientProperties> clients = new ArrayList<>();

        /**
         * Users seeded into the in-process user directory (development and tests).
         */
        @Valid
        private List<UserProperties> users = new ArrayList<>();

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public List<ClientProperties> getClients() {
            return clients;
        }

        public void setClients(List<ClientProperties> clients) {
            this.clients = clients;
        }

        public List<UserProperties> getUsers() {
            return users;
        }

        public void setUsers(List<UserProperties> users) {
            this.users = users;
        }
    }

    public static class ClientProperties {

        @NotBlank(message = "clientId is required")
        private String clientId;

        /**
         * Client name for logs.
         */
        private String clientName;

        /**
         * Exact-match allowlist of redirect URIs.
         */
        @NotEmpty(message = "redirectUris cannot be empty")
        private Set<String> redirectUris = new HashSet<>();

        /**
         * Confidential clients must authenticate with client_secret at /token.
         */
        private boolean confidential = true;

        /**
         * PasswordEncoder hash of the secret ({bcrypt}..., {noop}..., ...).
         * Required for confidential clients, optional for public ones.
         */
        private String clientSecret;

        private Set<String> scopes = Set.of("openid", "profile", "email");

        @AssertTrue(message = "clientSecret is required for confidential clients")
        public boolean isSecretPresentWhenConfidential() {
            return !confidential || (clientSecret != null && !clientSecret.isBlank());
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }

        public Set<String> getRedirectUris() {
            return redirectUris;
        }

        public void setRedirectUris(Set<String> redirectUris) {
            this.redirectUris = redirectUris;
        }

        public boolean isConfidential() {
            return confidential;
        }

        public void setConfidential(boolean confidential) {
            this.confidential = confidential;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public Set<String> getScopes() {
            return scopes;
        }

        public void setScopes(Set<String> scopes) {
            this.scopes = scopes;
        }
    }

    public static class UserProperties {

        @NotBlank
        private String userId;

        @NotBlank
        private String email;

        private String slug;
        private String firstName;
        private String lastName;

        /**
         * PasswordEncoder hash of the password.
         */
        private String password;

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getSlug() {
            return slug;
        }

        public void setSlug(String slug) {
            this.slug = slug;
        }

        public String getFirstName() {
            return firstName;
        }

        public void setFirstName(String firstName) {
            this.firstName = firstName;
        }

        public String getLastName() {
            return lastName;
        }

        public void setLastName(String lastName) {
            this.lastName = lastName;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
