package com.quackhouse.exception;

import com.quackhouse.auth.Decision;
import com.quackhouse.auth.DenialKind;

import java.util.Objects;

/**
 * Thrown when a principal lacks the rights for an action.
 *
 * <p>The {@link DenialKind} lets callers tell an access denial apart from a
 * (possibly masked) missing catalog entry.
 */
public class AuthorizationDeniedException extends QuackhouseException {

    private final DenialKind kind;

    public AuthorizationDeniedException(DenialKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates an exception from a denying decision.
     *
     * @param decision a decision that is not allowed
     * @return the exception
     * @throws IllegalArgumentException if the decision allows the action
     */
    public static AuthorizationDeniedException from(Decision decision) {
        if (decision.allowed()) {
            throw new IllegalArgumentException("Cannot raise a denial from an allowing decision");
        }
        return new AuthorizationDeniedException(decision.kind(), decision.reason());
    }

    public DenialKind getKind() {
        return kind;
    }
}
