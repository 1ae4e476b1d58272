package com.quackhouse.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of table metadata.
 *
 * <p>The registry performs no authorization; {@link CatalogService} wraps it
 * with the access policy. Implementations must be safe for concurrent use.
 */
public interface TableRegistry {

    /**
     * Stores a new entry.
     *
     * @param table the registration request
     * @param ownerId principal id recorded as owner (may be null)
     * @return the stored entry with assigned id, location and timestamps
     * @throws com.quackhouse.exception.RegistryException on conflict or store failure
     */
    TableEntry create(NewTable table, Long ownerId);

    /** Looks up an entry by id. */
    Optional<TableEntry> findById(long id);

    /**
     * Lists entries of one database ordered by name, or all entries ordered by
     * creation time (newest first) when {@code database} is null.
     */
    List<TableEntry> list(String database);

    /**
     * Lists every entry in a stable order (by id). This is the snapshot the
     * synchronizer projects into the engine.
     */
    List<TableEntry> snapshot();

    /**
     * Deletes an entry.
     *
     * @return true if an entry was removed
     */
    boolean delete(long id);
}
