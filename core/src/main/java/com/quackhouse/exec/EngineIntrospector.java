package com.quackhouse.exec;

import com.quackhouse.auth.Action;
import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.auth.Principal;
import com.quackhouse.catalog.SchemaField;
import com.quackhouse.catalog.TableEntry;
import com.quackhouse.exception.QueryExecutionException;
import com.quackhouse.exception.TableNotFoundException;
import com.quackhouse.generator.SQLQuoting;
import com.quackhouse.runtime.EngineSession;
import com.quackhouse.runtime.PooledConnection;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only views of the engine namespace: what is bound, and the columns of a
 * bound table.
 */
public class EngineIntrospector {

    private static final String TABLES_SQL =
        "SELECT table_catalog, table_schema, table_name, table_type FROM information_schema.tables "
            + "WHERE table_schema NOT IN ('information_schema', 'pg_catalog') ORDER BY table_name";

    private final EngineSession session;
    private final AuthorizationPolicy policy;

    public EngineIntrospector(EngineSession session, AuthorizationPolicy policy) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Lists the tables and views in the engine namespace, constructing the engine if needed.
     *
     * <p>Non-admin principals only see names for which they can read at least
     * one registry entry, the same rule {@link #describe} applies.
     *
     * @throws com.quackhouse.exception.EngineUnavailableException if the engine cannot be constructed
     */
    public List<EngineTable> listTables(Principal principal) {
        Objects.requireNonNull(principal, "principal must not be null");
        Set<String> readable = principal.isAdmin() ? null : readableNames(principal);

        try (EngineSession.Lease lease = session.lease();
             PooledConnection pooled = lease.engine().borrowConnection();
             PreparedStatement ps = pooled.get().prepareStatement(TABLES_SQL);
             ResultSet rs = ps.executeQuery()) {
            List<EngineTable> tables = new ArrayList<>();
            while (rs.next()) {
                String name = rs.getString(3);
                if (readable == null || readable.contains(name.toLowerCase(Locale.ROOT))) {
                    tables.add(new EngineTable(rs.getString(1), rs.getString(2), name, rs.getString(4)));
                }
            }
            return tables;
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to list engine tables: " + e.getMessage(), e, TABLES_SQL);
        }
    }

    /**
     * Describes the columns of a bound table.
     *
     * <p>Non-admin principals must be able to read at least one registry entry
     * of that name; otherwise the table is reported as not found.
     *
     * @throws TableNotFoundException if the table is unknown or hidden from the principal
     */
    public List<SchemaField> describe(Principal principal, String tableName) {
        Objects.requireNonNull(principal, "principal must not be null");
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name is required");
        }
        if (!principal.isAdmin() && !mayRead(principal, tableName)) {
            throw new TableNotFoundException("Table not found: " + tableName);
        }

        String sql = "DESCRIBE " + SQLQuoting.quoteIdentifier(tableName);
        List<SchemaField> fields = new ArrayList<>();
        try (EngineSession.Lease lease = session.lease();
             PooledConnection pooled = lease.engine().borrowConnection();
             Statement stmt = pooled.get().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                fields.add(new SchemaField(
                    rs.getString("column_name"), rs.getString("column_type"), "YES".equals(rs.getString("null"))));
            }
        } catch (SQLException e) {
            if (e.getMessage() != null && e.getMessage().contains("Catalog Error")) {
                throw new TableNotFoundException("Table not found: " + tableName);
            }
            throw new QueryExecutionException("Failed to describe table: " + e.getMessage(), e, sql);
        }
        return fields;
    }

    private boolean mayRead(Principal principal, String tableName) {
        return readableNames(principal).contains(tableName.toLowerCase(Locale.ROOT));
    }

    /** Lower-cased names of the registry entries the principal may read. */
    private Set<String> readableNames(Principal principal) {
        Set<String> names = new HashSet<>();
        for (TableEntry entry : session.registry().snapshot()) {
            if (policy.authorize(principal, Action.READ_CATALOG, entry).allowed()) {
                names.add(entry.name().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }
}
