package com.quackhouse.exec;

import com.quackhouse.auth.Action;
import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.auth.Decision;
import com.quackhouse.auth.Principal;
import com.quackhouse.exception.EngineUnavailableException;
import com.quackhouse.exception.QueryExecutionException;
import com.quackhouse.logging.QueryLogger;
import com.quackhouse.runtime.EngineSession;
import com.quackhouse.runtime.PooledConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs SQL on behalf of a principal and returns a bounded result.
 *
 * <p>Execution steps:
 * <ol>
 *   <li>Reject blank query text</li>
 *   <li>Authorize; a denied query never reaches the engine</li>
 *   <li>Lease the engine from the {@link EngineSession}, constructing it on first use</li>
 *   <li>Run the query on a pooled connection, reading at most {@code limit + 1} rows</li>
 *   <li>Return at most {@code limit} rows, flagging {@code truncated} when the engine had more</li>
 * </ol>
 *
 * <p>Failures never propagate: every outcome is a {@link QueryResult}. A query
 * running longer than the configured timeout is cancelled through
 * {@link Statement#cancel()} by a watchdog thread and reported as
 * {@link QueryErrorKind#TIMEOUT}.
 *
 * <p>Instances are thread-safe; queries run concurrently on separate pooled
 * connections.
 */
public class QueryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final EngineSession session;
    private final AuthorizationPolicy policy;
    private final int rowLimit;
    private final long timeoutMs;
    private final ScheduledExecutorService watchdog;

    public QueryExecutor(EngineSession session, AuthorizationPolicy policy) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.rowLimit = session.config().rowLimit();
        this.timeoutMs = session.config().queryTimeoutMs();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "quackhouse-query-watchdog");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Executes a query.
     *
     * @param principal the caller
     * @param sql the query text
     * @return the result or the failure description
     */
    public QueryResult execute(Principal principal, String sql) {
        Objects.requireNonNull(principal, "principal must not be null");
        long start = System.nanoTime();

        if (sql == null || sql.isBlank()) {
            return QueryResult.failure(QueryErrorKind.INVALID_REQUEST, "Query is required", elapsedMs(start));
        }

        Decision decision = policy.authorize(principal, Action.EXECUTE_QUERY, sql);
        if (decision.denied()) {
            QueryLogger.logRejected(principal, decision.reason());
            return QueryResult.failure(QueryErrorKind.FORBIDDEN, decision.reason(), elapsedMs(start));
        }

        QueryLogger.startQuery(QueryLogger.newQueryId(), principal, sql);
        StatementDeadline deadline = null;
        try (EngineSession.Lease lease = session.lease();
             PooledConnection pooled = lease.engine().borrowConnection();
             Statement stmt = pooled.get().createStatement()) {

            deadline = new StatementDeadline(stmt);
            ScheduledFuture<?> timer = scheduleTimeout(deadline);
            try {
                QueryResult result = run(stmt, sql, start);
                QueryLogger.logExecution(result.executionTimeMs(), result.rowCount(), result.truncated());
                QueryLogger.completeQuery(elapsedMs(start));
                return result;
            } finally {
                // Must precede the statement close and the connection's return to the pool
                deadline.finish();
                if (timer != null) {
                    timer.cancel(false);
                }
            }
        } catch (EngineUnavailableException e) {
            QueryLogger.logError(e);
            return QueryResult.failure(QueryErrorKind.ENGINE_UNAVAILABLE, e.getMessage(), elapsedMs(start));
        } catch (SQLException e) {
            if (deadline != null && deadline.expired()) {
                String message = "Query exceeded the execution timeout of " + timeoutMs + " ms";
                logger.warn("{}: {}", message, e.getMessage());
                return QueryResult.failure(QueryErrorKind.TIMEOUT, message, elapsedMs(start));
            }
            QueryExecutionException failure =
                new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, sql);
            QueryLogger.logError(failure);
            return QueryResult.failure(QueryErrorKind.EXECUTION_FAILED, failure.getUserMessage(), elapsedMs(start));
        } catch (RuntimeException e) {
            QueryLogger.logError(e);
            return QueryResult.failure(QueryErrorKind.EXECUTION_FAILED,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), elapsedMs(start));
        } finally {
            QueryLogger.clearContext();
        }
    }

    private QueryResult run(Statement stmt, String sql, long start) throws SQLException {
        boolean hasResultSet = stmt.execute(sql);
        if (!hasResultSet) {
            // Statements without a result set (admin DDL) succeed with no rows
            return QueryResult.success(List.of(), List.of(), false, elapsedMs(start));
        }

        try (ResultSet rs = stmt.getResultSet()) {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(meta.getColumnLabel(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            boolean truncated = false;
            while (rs.next()) {
                if (rows.size() == rowLimit) {
                    // limit + 1-th row read; stop here
                    truncated = true;
                    break;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    row.put(columns.get(i - 1), JdbcValues.toPlain(rs.getObject(i)));
                }
                rows.add(row);
            }
            return QueryResult.success(columns, rows, truncated, elapsedMs(start));
        }
    }

    private ScheduledFuture<?> scheduleTimeout(StatementDeadline deadline) {
        if (timeoutMs <= 0) {
            return null;
        }
        return watchdog.schedule(deadline::expire, timeoutMs, TimeUnit.MILLISECONDS);
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }

    public int rowLimit() {
        return rowLimit;
    }

    /**
     * Cancels one statement when its time runs out, unless the execution has
     * already finished. Cancellation interrupts the whole DuckDB connection, so
     * it must never reach a connection that is back in the pool.
     */
    static final class StatementDeadline {

        private final Statement stmt;
        private boolean finished;
        private boolean expired;

        StatementDeadline(Statement stmt) {
            this.stmt = stmt;
        }

        /** Called by the watchdog. Returns whether the statement was cancelled. */
        synchronized boolean expire() {
            if (finished) {
                return false;
            }
            expired = true;
            try {
                stmt.cancel();
            } catch (SQLException e) {
                logger.warn("Failed to cancel timed out query: {}", e.getMessage());
            }
            return true;
        }

        /** Called once the execution returns or throws; later expiry is a no-op. */
        synchronized void finish() {
            finished = true;
        }

        synchronized boolean expired() {
            return expired;
        }
    }

    /** Stops the timeout watchdog. */
    @Override
    public void close() {
        watchdog.shutdownNow();
    }
}
