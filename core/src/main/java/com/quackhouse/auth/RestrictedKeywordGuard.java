package com.quackhouse.auth;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort guard against mutating statements from non-admin callers.
 *
 * <p>This is a prefix test on the lowercased, left-trimmed query text, not a
 * SQL validator. A query is restricted if and only if it begins with one of
 * {@link #RESTRICTED_KEYWORDS}. Keywords appearing anywhere else (inside a
 * literal, a subquery, or a second statement after a benign one) are not
 * detected; {@code "select 1; drop table t"} passes.
 */
public final class RestrictedKeywordGuard {

    /** Lead keywords of statements that mutate data, schema, settings or the engine. */
    public static final List<String> RESTRICTED_KEYWORDS = List.of(
        "alter", "attach", "call", "checkpoint", "copy", "create", "delete", "detach",
        "drop", "export", "grant", "import", "insert", "install", "load", "merge",
        "pragma", "replace", "revoke", "set", "truncate", "update", "upsert", "vacuum");

    private RestrictedKeywordGuard() {}

    /**
     * Returns the restricted keyword the query starts with, if any.
     *
     * @param sql query text, may be null
     * @return the matching keyword, empty when the text does not start with one
     */
    public static Optional<String> leadingRestrictedKeyword(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        String normalized = sql.strip().toLowerCase(Locale.ROOT);
        for (String keyword : RESTRICTED_KEYWORDS) {
            if (normalized.startsWith(keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }
}
