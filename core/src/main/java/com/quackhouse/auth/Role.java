package com.quackhouse.auth;

/**
 * Caller role carried by a {@link Principal}.
 */
public enum Role {
    ADMIN,
    USER,
    ANONYMOUS;

    /**
     * Parse a role header value (case-insensitive).
     *
     * <p>Missing values yield {@link #ANONYMOUS}. Unrecognized values yield
     * {@link #USER} so that a malformed header never elevates a caller.
     */
    public static Role parse(String value) {
        if (value == null || value.isBlank()) {
            return ANONYMOUS;
        }
        return switch (value.trim().toLowerCase()) {
            case "admin" -> ADMIN;
            case "anonymous" -> ANONYMOUS;
            default -> USER;
        };
    }
}
