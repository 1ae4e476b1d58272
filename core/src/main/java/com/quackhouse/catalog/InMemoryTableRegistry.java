package com.quackhouse.catalog;

import com.quackhouse.exception.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process-local table registry.
 *
 * <p>Used when no registry database is configured and by tests. Entries are
 * lost on restart.
 */
public class InMemoryTableRegistry implements TableRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTableRegistry.class);

    private final String defaultBucket;
    private final Clock clock;
    private final Map<Long, TableEntry> entries = new TreeMap<>();
    private long nextId = 1;

    public InMemoryTableRegistry(String defaultBucket) {
        this(defaultBucket, Clock.systemUTC());
    }

    public InMemoryTableRegistry(String defaultBucket, Clock clock) {
        this.defaultBucket = Objects.requireNonNull(defaultBucket, "defaultBucket must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized TableEntry create(NewTable table, Long ownerId) {
        Objects.requireNonNull(table, "table must not be null");

        boolean exists = entries.values().stream()
            .anyMatch(e -> e.name().equals(table.name()) && e.database().equals(table.database()));
        if (exists) {
            throw RegistryException.conflict(table.name(), table.database());
        }

        Instant now = clock.instant();
        TableEntry entry = new TableEntry(
            nextId++,
            table.name(),
            table.database(),
            table.format(),
            table.locationOrDefault(defaultBucket),
            ownerId,
            table.visibility(),
            table.schema(),
            now,
            now);
        entries.put(entry.id(), entry);
        logger.debug("Registered table {} with id {}", entry.qualifiedName(), entry.id());
        return entry;
    }

    @Override
    public synchronized Optional<TableEntry> findById(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized List<TableEntry> list(String database) {
        List<TableEntry> result = new ArrayList<>();
        for (TableEntry entry : entries.values()) {
            if (database == null || database.equals(entry.database())) {
                result.add(entry);
            }
        }
        if (database != null) {
            result.sort(Comparator.comparing(TableEntry::name));
        } else {
            result.sort(Comparator.comparing(TableEntry::createdAt).reversed()
                .thenComparing(Comparator.comparingLong(TableEntry::id).reversed()));
        }
        return result;
    }

    @Override
    public synchronized List<TableEntry> snapshot() {
        return List.copyOf(entries.values());
    }

    @Override
    public synchronized boolean delete(long id) {
        return entries.remove(id) != null;
    }
}
