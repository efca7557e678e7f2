package com.openmeet.oidc.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the login session cookies.
 *
 * Two cookies are written at login: the opaque session id and the tenant id
 * the session belongs to. Both share the attributes below.
 *
 * Usage in application.yml:
 * <pre>
 * app:
 *   session:
 *     cookie:
 *       name: OIDC_SESSION
 *       tenant-name: OIDC_TENANT
 *       domain: ""
 *       path: /
 *       http-only: true
 *       secure: true
 *       same-site: Lax
 *       max-age: ""
 * </pre>
 *
 * @see com.openmeet.oidc.session.SessionCookies
 */
@Component
@ConfigurationProperties(prefix = "app.session.cookie")
public class SessionCookieProperties {

    /**
     * Session id cookie name.
     * Default: OIDC_SESSION
     */
    private String name = "OIDC_SESSION";

    /**
     * Tenant id cookie name.
     * Default: OIDC_TENANT
     */
    private String tenantName = "OIDC_TENANT";

    /**
     * Cookie domain attribute.
     * Empty string = not set (cookie is scoped to current domain).
     */
    private String domain = "";

    private String path = "/";

    private boolean httpOnly = true;

    /**
     * Secure flag (requires HTTPS).
     * Default: true (production), false (test profile)
     */
    private boolean secure = true;

    /**
     * SameSite attribute (Lax, Strict, None).
     * Lax keeps the cookie on the top-level redirect back to /authorize.
     */
    private String sameSite = "Lax";

    /**
     * Cookie max-age in seconds.
     * Empty string = not set (session cookie, expires when browser closes).
     */
    private String maxAge = "";

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTenantName() {
        return tenantName;
    }

    public void setTenantName(String tenantName) {
        this.tenantName = tenantName;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isHttpOnly() {
        return httpOnly;
    }

    public void setHttpOnly(boolean httpOnly) {
        this.httpOnly = httpOnly;
    }

    public boolean isSecure() {
        return secure;
    }

    public void setSecure(boolean secure) {
        this.secure = secure;
    }

    public String getSameSite() {
        return sameSite;
    }

    public void setSameSite(String sameSite) {
        this.sameSite = sameSite;
    }

    public String getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(String maxAge) {
        this.maxAge = maxAge;
    }
}
