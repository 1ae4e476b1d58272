package com.quackhouse.auth;

/**
 * Why a decision denied an action.
 */
public enum DenialKind {
    /** The caller supplied no identity but the action requires one. */
    UNAUTHENTICATED,
    /** The caller is known but lacks rights. */
    FORBIDDEN,
    /** The target does not exist, or its existence is masked from the caller. */
    NOT_FOUND
}
