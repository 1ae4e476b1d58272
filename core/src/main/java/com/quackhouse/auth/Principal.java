package com.quackhouse.auth;

import java.util.Objects;

/**
 * The caller identity used for authorization decisions.
 *
 * <p>Derived per request and never persisted. An anonymous principal has no id.
 *
 * @param id caller id, null for anonymous callers
 * @param role caller role
 */
public record Principal(Long id, Role role) {

    private static final Principal ANONYMOUS = new Principal(null, Role.ANONYMOUS);

    public Principal {
        Objects.requireNonNull(role, "role must not be null");
        if (id == null && role != Role.ANONYMOUS) {
            throw new IllegalArgumentException("Role " + role + " requires an id");
        }
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal user(long id) {
        return new Principal(id, Role.USER);
    }

    public static Principal admin(long id) {
        return new Principal(id, Role.ADMIN);
    }

    /**
     * Builds a principal from raw identity values.
     *
     * <p>A missing or unparseable id makes the caller anonymous regardless of
     * the claimed role.
     *
     * @param rawId caller id header value
     * @param rawRole caller role header value
     * @return the principal
     */
    public static Principal fromHeaders(String rawId, String rawRole) {
        if (rawId == null || rawId.isBlank()) {
            return ANONYMOUS;
        }
        long id;
        try {
            id = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            return ANONYMOUS;
        }
        Role role = Role.parse(rawRole);
        return role == Role.ANONYMOUS ? ANONYMOUS : new Principal(id, role);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isAuthenticated() {
        return role != Role.ANONYMOUS;
    }

    @Override
    public String toString() {
        return isAuthenticated() ? role.name().toLowerCase() + ":" + id : "anonymous";
    }
}
