package com.openmeet.oidc.user;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one user of one tenant, as handed out by the user directory.
 */
public final class UserClaims {

    private final String tenantId;
    private final String userId;
    private final String email;
    private final String slug;
    private final String firstName;
    private final String lastName;

    public UserClaims(String tenantId, String userId, String email, String slug, String firstName, String lastName) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.email = email;
        this.slug = slug;
        this.firstName = firstName;
        this.lastName = lastName;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getSlug() {
        return slug;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    /**
     * "First Last", else the email local part, else the slug, else the user id.
     */
    public String getDisplayName() {
        StringBuilder name = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) {
            name.append(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(lastName.trim());
        }
        if (name.length() > 0) {
            return name.toString();
        }
        String local = emailLocalPart();
        if (local != null) {
            return local;
        }
        return slug != null && !slug.isBlank() ? slug : userId;
    }

    /**
     * Chat handle: {@code <handle>_<tenant>} lower-cased, where the handle is the
     * slug, else the email local part, else {@code user-<id>}, stripped to [a-z0-9._-].
     */
    public String getPreferredUsername() {
        String base;
        if (slug != null && !slug.isBlank()) {
            base = slug;
        } else if (emailLocalPart() != null) {
            base = emailLocalPart();
        } else {
            base = "user-" + userId;
        }
        String handle = base.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "");
        return handle + "_" + tenantId.toLowerCase(Locale.ROOT);
    }

    private String emailLocalPart() {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        String local = at >= 0 ? email.substring(0, at) : email;
        return local.isBlank() ? null : local;
    }

    @Override
    public String toString() {
        return "UserClaims{tenantId=" + tenantId + ", userId=" + userId + "}";
    }
}
