package com.openmeet.oidc.user;

import com.openmeet.oidc.config.properties.OidcProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * UserDirectory held in process memory, seeded from oidc.tenants[].users.
 *
 * Stands in for the platform's tenant databases in development and tests;
 * production deployments provide their own UserDirectory bean.
 */
public class InMemoryUserDirectory implements UserDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserDirectory.class);

    private final PasswordEncoder passwordEncoder;
    // tenantId:userId -> account
    private final Map<String, Account> byId = new ConcurrentHashMap<>();
    // tenantId:email -> userId
    private final Map<String, String> idByEmail = new ConcurrentHashMap<>();

    public InMemoryUserDirectory(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public InMemoryUserDirectory(PasswordEncoder passwordEncoder, OidcProperties properties) {
        this(passwordEncoder);
        int count = 0;
        for (OidcProperties.TenantProperties tenant : properties.getTenants()) {
            for (OidcProperties.UserProperties user : tenant.getUsers()) {
                UserClaims claims = new UserClaims(tenant.getTenantId(), user.getUserId(), user.getEmail(),
                    user.getSlug(), user.getFirstName(), user.getLastName());
                store(claims, user.getPassword());
                count++;
            }
        }
        log.info("[STARTUP] Seeded {} users into the in-memory user directory", count);
    }

    /**
     * Register a user with a raw password.
     */
    public UserClaims register(UserClaims user, String rawPassword) {
        return store(user, rawPassword != null ? passwordEncoder.encode(rawPassword) : null);
    }

    private UserClaims store(UserClaims user, String passwordHash) {
        String emailKey = key(user.getTenantId(), normalise(user.getEmail()));
        String previous = idByEmail.putIfAbsent(emailKey, user.getUserId());
        if (previous != null && !previous.equals(user.getUserId())) {
            throw new IllegalArgumentException("Email already registered in tenant " + user.getTenantId());
        }
        byId.put(key(user.getTenantId(), user.getUserId()), new Account(user, passwordHash));
        return user;
    }

    @Override
    public Optional<UserClaims> findById(String tenantId, String userId) {
        Account account = byId.get(key(tenantId, userId));
        return account != null ? Optional.of(account.claims) : Optional.empty();
    }

    @Override
    public Optional<UserClaims> authenticate(String tenantId, String email, String password) {
        if (email == null || password == null) {
            return Optional.empty();
        }
        String userId = idByEmail.get(key(tenantId, normalise(email)));
        Account account = userId != null ? byId.get(key(tenantId, userId)) : null;
        if (account == null || account.passwordHash == null
            || !passwordEncoder.matches(password, account.passwordHash)) {
            return Optional.empty();
        }
        return Optional.of(account.claims);
    }

    private static String normalise(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String key(String tenantId, String value) {
        return tenantId + ':' + value;
    }

    private static final class Account {
        final UserClaims claims;
        final String passwordHash;

        Account(UserClaims claims, String passwordHash) {
            this.claims = claims;
            this.passwordHash = passwordHash;
        }
    }
}
