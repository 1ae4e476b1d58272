package com.quackhouse.auth;

/**
 * Outcome of an authorization check.
 *
 * @param allowed true when the action may proceed
 * @param kind denial category, null when allowed
 * @param reason human-readable denial reason, null when allowed
 */
public record Decision(boolean allowed, DenialKind kind, String reason) {

    private static final Decision ALLOW = new Decision(true, null, null);

    public Decision {
        if (allowed && (kind != null || reason != null)) {
            throw new IllegalArgumentException("An allowing decision carries no denial");
        }
        if (!allowed && kind == null) {
            throw new IllegalArgumentException("A denial needs a kind");
        }
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(DenialKind kind, String reason) {
        return new Decision(false, kind, reason);
    }

    public static Decision forbidden(String reason) {
        return deny(DenialKind.FORBIDDEN, reason);
    }

    public static Decision notFound(String reason) {
        return deny(DenialKind.NOT_FOUND, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
