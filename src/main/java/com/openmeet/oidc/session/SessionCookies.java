package com.openmeet.oidc.session;

import com.openmeet.oidc.config.properties.SessionCookieProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseCookie;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the two login cookies: the opaque session id and the
 * tenant the session belongs to.
 *
 * All attributes come from application.yml via SessionCookieProperties:
 * - name / tenant-name
 * - domain (only if not empty)
 * - path
 * - HttpOnly, Secure, SameSite
 * - maxAge (only if set; otherwise a browser-session cookie)
 *
 * @see SessionCookieProperties
 */
public class SessionCookies {

    private static final Logger logger = LoggerFactory.getLogger(SessionCookies.class);

    private final SessionCookieProperties cookieProperties;
    private final Duration maxAge;

    public SessionCookies(SessionCookieProperties cookieProperties) {
        this.cookieProperties = cookieProperties;
        this.maxAge = parseMaxAge(cookieProperties.getMaxAge());
        logger.info("[STARTUP] Session cookies: name={}, tenant-name={}, path={}, httpOnly={}, secure={}, sameSite={}, maxAge={}",
            cookieProperties.getName(), cookieProperties.getTenantName(), cookieProperties.getPath(),
            cookieProperties.isHttpOnly(), cookieProperties.isSecure(), cookieProperties.getSameSite(),
            maxAge != null ? maxAge.getSeconds() + "s" : "(browser session)");
    }

    private static Duration parseMaxAge(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            logger.warn("[STARTUP] Invalid app.session.cookie.max-age '{}', using browser-session cookies", raw);
            return null;
        }
    }

    /**
     * Set-Cookie values for a freshly created session.
     */
    public List<String> issue(LoginSession session) {
        List<String> headers = new ArrayList<>(2);
        headers.add(build(cookieProperties.getName(), session.getId(), maxAge).toString());
        headers.add(build(cookieProperties.getTenantName(), session.getTenantId(), maxAge).toString());
        return headers;
    }

    /**
     * Set-Cookie values that expire both cookies.
     */
    public List<String> clear() {
        List<String> headers = new ArrayList<>(2);
        headers.add(build(cookieProperties.getName(), "", Duration.ZERO).toString());
        headers.add(build(cookieProperties.getTenantName(), "", Duration.ZERO).toString());
        return headers;
    }

    public String readSessionId(HttpServletRequest request) {
        return read(request, cookieProperties.getName());
    }

    public String readTenantId(HttpServletRequest request) {
        return read(request, cookieProperties.getTenantName());
    }

    private ResponseCookie build(String name, String value, Duration cookieMaxAge) {
        ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(name, value)
            .path(cookieProperties.getPath())
            .httpOnly(cookieProperties.isHttpOnly())
            .secure(cookieProperties.isSecure());
        if (cookieProperties.getDomain() != null && !cookieProperties.getDomain().isBlank()) {
            builder.domain(cookieProperties.getDomain());
        }
        if (cookieProperties.getSameSite() != null && !cookieProperties.getSameSite().isBlank()) {
            builder.sameSite(cookieProperties.getSameSite());
        }
        if (cookieMaxAge != null) {
            builder.maxAge(cookieMaxAge);
        }
        return builder.build();
    }

    private static String read(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
