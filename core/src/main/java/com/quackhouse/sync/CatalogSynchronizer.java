package com.quackhouse.sync;

import com.quackhouse.catalog.TableEntry;
import com.quackhouse.catalog.TableRegistry;
import com.quackhouse.exception.EngineUnavailableException;
import com.quackhouse.exception.SyncEntryFailedException;
import com.quackhouse.runtime.EngineHandle;
import com.quackhouse.runtime.PooledConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Makes the engine namespace reflect the registry.
 *
 * <p>Each pass reads a snapshot of all registry entries and binds every entry
 * as a view named after it. Binding uses {@code CREATE OR REPLACE VIEW}, so a
 * pass is an upsert and running it twice yields the same namespace. An entry
 * that cannot be bound is recorded as failed and the pass moves on.
 *
 * <p>Views bound by earlier passes are tracked on the {@link EngineHandle}.
 * With pruning enabled, a tracked view that was not bound in the current pass
 * (its entry was deleted, or failed this time) is dropped. Objects the
 * synchronizer did not create are never touched.
 *
 * <p>Entries from different databases sharing a name map to one view; the
 * entry later in registry order wins.
 *
 * <p>Passes are serialized.
 */
public class CatalogSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSynchronizer.class);

    private final boolean pruneStaleViews;

    public CatalogSynchronizer(boolean pruneStaleViews) {
        this.pruneStaleViews = pruneStaleViews;
    }

    /**
     * Runs one pass.
     *
     * @param registry the source of truth
     * @param engine the engine to bind views in
     * @return per-entry outcomes
     * @throws com.quackhouse.exception.RegistryException if the registry cannot be read
     * @throws EngineUnavailableException if no engine connection can be obtained
     */
    public synchronized SyncReport sync(TableRegistry registry, EngineHandle engine) {
        List<TableEntry> entries = registry.snapshot();
        long start = System.nanoTime();

        try (PooledConnection pooled = engine.borrowConnection();
             Statement stmt = pooled.get().createStatement()) {

            List<SyncStatus> statuses = new ArrayList<>(entries.size());
            // lowercased name -> entry bound under it in this pass
            Map<String, TableEntry> boundThisPass = new HashMap<>();

            for (TableEntry entry : entries) {
                try {
                    bind(stmt, entry);
                    String key = key(entry.name());
                    TableEntry previous = boundThisPass.put(key, entry);
                    if (previous != null) {
                        logger.warn("View '{}' of {} replaced by {} (name collision)",
                            entry.name(), previous.qualifiedName(), entry.qualifiedName());
                    }
                    engine.managedViews().put(key, entry.name());
                    statuses.add(SyncStatus.bound(entry.name(), entry.id()));
                } catch (SyncEntryFailedException e) {
                    logger.warn("SyncEntryFailed: table '{}' (id {}): {}", e.getTableName(), entry.id(), e.getMessage());
                    statuses.add(SyncStatus.failed(entry.name(), entry.id(), e.getMessage()));
                }
            }

            if (pruneStaleViews) {
                statuses.addAll(prune(stmt, engine.managedViews(), boundThisPass));
            }

            SyncReport report = new SyncReport(statuses);
            logger.info("Catalog synchronized in {} ms: {}", (System.nanoTime() - start) / 1_000_000, report.summary());
            return report;
        } catch (SQLException e) {
            throw new EngineUnavailableException("Cannot synchronize catalog: " + e.getMessage(), e);
        }
    }

    private void bind(Statement stmt, TableEntry entry) {
        String sql;
        try {
            sql = ViewDefinitions.createView(entry);
        } catch (IllegalArgumentException e) {
            throw new SyncEntryFailedException(entry.name(), e.getMessage(), e);
        }

        try {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new SyncEntryFailedException(entry.name(), e.getMessage(), e);
        }
    }

    private List<SyncStatus> prune(Statement stmt, Map<String, String> managed, Map<String, TableEntry> keep) {
        List<SyncStatus> pruned = new ArrayList<>();
        Iterator<Map.Entry<String, String>> it = managed.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> view = it.next();
            if (keep.containsKey(view.getKey())) {
                continue;
            }
            try {
                stmt.execute(ViewDefinitions.dropView(view.getValue()));
                it.remove();
                pruned.add(SyncStatus.pruned(view.getValue()));
                logger.info("Pruned stale view '{}'", view.getValue());
            } catch (SQLException e) {
                // Stays tracked; the next pass retries
                logger.warn("Failed to prune view '{}': {}", view.getValue(), e.getMessage());
            }
        }
        return pruned;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean isPruneStaleViews() {
        return pruneStaleViews;
    }
}
