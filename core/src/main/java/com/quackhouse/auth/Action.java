package com.quackhouse.auth;

/**
 * Actions the authorization policy decides on.
 */
public enum Action {
    /** List or get a catalog entry. Target: the entry. */
    READ_CATALOG,
    /** Register a catalog entry. Target: none. */
    CREATE_CATALOG,
    /** Remove a catalog entry. Target: the entry, or nothing when it does not exist. */
    DELETE_CATALOG,
    /** Run query text against the engine. Target: the query text. */
    EXECUTE_QUERY,
    /** Trigger a synchronization pass. Target: none. */
    SYNC_CATALOG
}
