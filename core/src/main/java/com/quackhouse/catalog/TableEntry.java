package com.quackhouse.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A registered logical table.
 *
 * <p>Identity is the registry-assigned {@code id}; {@code (name, database)} is
 * unique across the registry. The engine namespace binds one view per entry,
 * keyed by {@code name} only.
 *
 * @param id registry-assigned identifier
 * @param name table name, also the view name in the engine
 * @param database logical database the entry belongs to
 * @param format storage format
 * @param location URI of the table data
 * @param ownerId principal id of the creator, or null for entries without an owner
 * @param visibility private or public
 * @param schema declared columns, empty when not declared
 * @param createdAt creation time
 * @param updatedAt last update time
 */
public record TableEntry(
        long id,
        String name,
        String database,
        TableFormat format,
        String location,
        @JsonProperty("owner_id") Long ownerId,
        Visibility visibility,
        List<SchemaField> schema,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public TableEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    /** True when the entry can be read by principals other than its owner. */
    @JsonIgnore
    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    /** True when {@code principalId} created this entry. */
    public boolean isOwnedBy(Long principalId) {
        return ownerId != null && ownerId.equals(principalId);
    }

    /** Qualified name used in log lines. */
    public String qualifiedName() {
        return database + "." + name;
    }
}
