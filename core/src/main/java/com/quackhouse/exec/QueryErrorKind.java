package com.quackhouse.exec;

/**
 * Why a query produced no result.
 */
public enum QueryErrorKind {
    /** Empty or missing query text. */
    INVALID_REQUEST,
    /** Rejected by the authorization policy; the engine was not touched. */
    FORBIDDEN,
    /** The engine could not be constructed or is shutting down. */
    ENGINE_UNAVAILABLE,
    /** Cancelled after exceeding the execution timeout. */
    TIMEOUT,
    /** The engine rejected or failed the query. */
    EXECUTION_FAILED
}
