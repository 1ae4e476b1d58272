package com.quackhouse.catalog;

import com.quackhouse.auth.Action;
import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.auth.Decision;
import com.quackhouse.auth.DenialKind;
import com.quackhouse.auth.Principal;
import com.quackhouse.exception.AuthorizationDeniedException;
import com.quackhouse.exception.TableNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry operations on behalf of a principal.
 *
 * <p>Every operation is checked against the {@link AuthorizationPolicy}.
 * Denials surface as {@link AuthorizationDeniedException}; a missing entry, or
 * one whose existence is masked from the caller, as
 * {@link TableNotFoundException}.
 *
 * <p>Registry changes reach the engine namespace on the next synchronization pass.
 */
public class CatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final TableRegistry registry;
    private final AuthorizationPolicy policy;

    public CatalogService(TableRegistry registry, AuthorizationPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Lists the entries the principal may read.
     *
     * @param database restrict to one database, or null for all
     */
    public List<TableEntry> list(Principal principal, String database) {
        return registry.list(database).stream()
            .filter(entry -> policy.authorize(principal, Action.READ_CATALOG, entry).allowed())
            .toList();
    }

    /**
     * @throws TableNotFoundException if no entry has the id
     * @throws AuthorizationDeniedException if the principal may not read the entry
     */
    public TableEntry get(Principal principal, long id) {
        TableEntry entry = registry.findById(id).orElseThrow(() -> TableNotFoundException.forId(id));
        Decision decision = policy.authorize(principal, Action.READ_CATALOG, entry);
        if (decision.denied()) {
            throw AuthorizationDeniedException.from(decision);
        }
        return entry;
    }

    /**
     * Registers a table owned by the principal.
     *
     * @throws AuthorizationDeniedException if the principal is anonymous
     * @throws com.quackhouse.exception.RegistryException if the name is taken in the database
     */
    public TableEntry create(Principal principal, NewTable table) {
        Objects.requireNonNull(table, "table must not be null");
        Decision decision = policy.authorize(principal, Action.CREATE_CATALOG, null);
        if (decision.denied()) {
            throw AuthorizationDeniedException.from(decision);
        }
        TableEntry entry = registry.create(table, principal.id());
        logger.info("{} registered {} ({}, {})", principal, entry.qualifiedName(), entry.format().wireName(),
            entry.visibility().wireName());
        return entry;
    }

    /**
     * Removes an entry from the registry.
     *
     * <p>Removing the table data from storage is not performed; a request for
     * it is logged.
     *
     * @param dropData whether the caller asked for the data to be removed as well
     * @throws TableNotFoundException if the entry is missing or masked from the principal
     * @throws AuthorizationDeniedException if the principal may see but not delete the entry
     */
    public void delete(Principal principal, long id, boolean dropData) {
        Optional<TableEntry> target = registry.findById(id);
        Decision decision = policy.authorize(principal, Action.DELETE_CATALOG, target);
        if (decision.denied()) {
            if (decision.kind() == DenialKind.NOT_FOUND) {
                throw TableNotFoundException.forId(id);
            }
            throw AuthorizationDeniedException.from(decision);
        }

        TableEntry entry = target.get();
        if (!registry.delete(id)) {
            // Removed concurrently
            throw TableNotFoundException.forId(id);
        }
        logger.info("{} removed {} (id {})", principal, entry.qualifiedName(), id);
        if (dropData) {
            // TODO: delete the objects under entry.location() once an S3 client is wired in
            logger.warn("Data removal requested for {} at {} is not performed; data left in place",
                entry.qualifiedName(), entry.location());
        }
    }
}
