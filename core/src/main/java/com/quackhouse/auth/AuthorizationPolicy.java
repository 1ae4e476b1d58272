package com.quackhouse.auth;

import com.quackhouse.catalog.TableEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a principal may perform an action on a target.
 *
 * <p>Rules:
 * <ul>
 *   <li><b>Catalog read:</b> admin, owner, or public entry</li>
 *   <li><b>Catalog create:</b> any authenticated principal</li>
 *   <li><b>Catalog delete:</b> admin or owner. A private entry of another
 *       owner is reported as not found so that its existence does not leak.</li>
 *   <li><b>Query execution:</b> admin runs anything; everyone else is subject
 *       to {@link RestrictedKeywordGuard}</li>
 *   <li><b>Sync trigger:</b> admin only</li>
 * </ul>
 *
 * <p>Decisions reference the entry owner and visibility for catalog actions
 * and only the principal role for query text. The policy holds no state and
 * is safe to share.
 */
public class AuthorizationPolicy {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationPolicy.class);

    /**
     * Generic entry point.
     *
     * @param principal the caller
     * @param action the requested action
     * @param target a {@link TableEntry} for catalog read, an optional entry
     *     (or null) for delete, the query text for execution, ignored otherwise
     * @return the decision
     * @throws IllegalArgumentException if the target type does not fit the action
     */
    public Decision authorize(Principal principal, Action action, Object target) {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(action, "action must not be null");

        Decision decision = switch (action) {
            case READ_CATALOG -> canRead(principal, requireEntry(target));
            case CREATE_CATALOG -> canCreate(principal);
            case DELETE_CATALOG -> canDelete(principal, optionalEntry(target));
            case EXECUTE_QUERY -> canExecute(principal, requireQuery(target));
            case SYNC_CATALOG -> canSync(principal);
        };

        if (decision.denied()) {
            logger.debug("Denied {} for {}: {} ({})", action, principal, decision.kind(), decision.reason());
        }
        return decision;
    }

    public Decision canRead(Principal principal, TableEntry entry) {
        if (principal.isAdmin() || entry.isPublic() || entry.isOwnedBy(principal.id())) {
            return Decision.allow();
        }
        return Decision.forbidden("Not authorized to read table '" + entry.name() + "'");
    }

    public Decision canCreate(Principal principal) {
        if (!principal.isAuthenticated()) {
            return Decision.deny(DenialKind.UNAUTHENTICATED, "Authentication required to register tables");
        }
        return Decision.allow();
    }

    public Decision canDelete(Principal principal, Optional<TableEntry> target) {
        if (target.isEmpty()) {
            return Decision.notFound("Table not found");
        }
        TableEntry entry = target.get();
        if (principal.isAdmin() || entry.isOwnedBy(principal.id())) {
            return Decision.allow();
        }
        if (entry.isPublic()) {
            return Decision.forbidden("You do not have permission to delete this table");
        }
        return Decision.notFound("Table not found");
    }

    public Decision canExecute(Principal principal, String sql) {
        if (principal.isAdmin()) {
            return Decision.allow();
        }
        Optional<String> keyword = RestrictedKeywordGuard.leadingRestrictedKeyword(sql);
        if (keyword.isPresent()) {
            return Decision.forbidden(String.format(
                "Query type not allowed for role %s: %s", principal.role().name().toLowerCase(), keyword.get()));
        }
        return Decision.allow();
    }

    public Decision canSync(Principal principal) {
        if (principal.isAdmin()) {
            return Decision.allow();
        }
        if (!principal.isAuthenticated()) {
            return Decision.deny(DenialKind.UNAUTHENTICATED, "Authentication required to synchronize the catalog");
        }
        return Decision.forbidden("Catalog synchronization requires the admin role");
    }

    private static TableEntry requireEntry(Object target) {
        if (target instanceof TableEntry entry) {
            return entry;
        }
        throw new IllegalArgumentException("Catalog read requires a table entry target");
    }

    @SuppressWarnings("unchecked")
    private static Optional<TableEntry> optionalEntry(Object target) {
        if (target == null) {
            return Optional.empty();
        }
        if (target instanceof TableEntry entry) {
            return Optional.of(entry);
        }
        if (target instanceof Optional<?> optional
                && optional.map(TableEntry.class::isInstance).orElse(true)) {
            return (Optional<TableEntry>) optional;
        }
        throw new IllegalArgumentException("Catalog delete requires an optional table entry target");
    }

    private static String requireQuery(Object target) {
        if (target == null || target instanceof String) {
            return (String) target;
        }
        throw new IllegalArgumentException("Query execution requires the query text as target");
    }
}
