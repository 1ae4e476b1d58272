package com.quackhouse.runtime;

import com.quackhouse.catalog.TableRegistry;
import com.quackhouse.exception.EngineUnavailableException;
import com.quackhouse.exception.RegistryException;
import com.quackhouse.sync.CatalogSynchronizer;
import com.quackhouse.sync.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the lifetime of the one query engine shared by all executions.
 *
 * <p>The engine is constructed lazily by the first {@link #acquire()} and
 * synchronized with the registry once before it is handed out. Concurrent
 * first acquisitions share a single construction: one caller builds, the
 * others wait on the same future and observe the same outcome. A failed
 * construction is reported to every waiter as
 * {@link EngineUnavailableException} and leaves the session uninitialized, so
 * the next acquisition tries again.
 *
 * <p>Executions go through {@link #lease()}, which registers them with an
 * {@link InFlightTracker}. {@link #shutdown()} stops admitting new leases,
 * waits up to the configured drain timeout for running ones and then closes
 * the engine.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (EngineSession.Lease lease = session.lease()) {
 *     try (PooledConnection conn = lease.engine().borrowConnection()) {
 *         // ... run the query ...
 *     }
 * }
 * }</pre>
 */
public class EngineSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EngineSession.class);

    private final EngineConfig config;
    private final EngineFactory factory;
    private final TableRegistry registry;
    private final CatalogSynchronizer synchronizer;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final AtomicReference<CompletableFuture<EngineHandle>> current = new AtomicReference<>();
    private final AtomicInteger constructions = new AtomicInteger();

    public EngineSession(EngineConfig config, EngineFactory factory, TableRegistry registry,
                         CatalogSynchronizer synchronizer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer must not be null");
    }

    /**
     * Returns the engine, constructing and synchronizing it on first use.
     *
     * @return the shared engine
     * @throws EngineUnavailableException if construction fails
     */
    public EngineHandle acquire() {
        while (true) {
            CompletableFuture<EngineHandle> future = current.get();
            if (future == null) {
                CompletableFuture<EngineHandle> mine = new CompletableFuture<>();
                if (!current.compareAndSet(null, mine)) {
                    continue;
                }
                construct(mine);
                future = mine;
            }

            try {
                return future.join();
            } catch (CancellationException e) {
                // Shut down while we were waiting; start over
                continue;
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof EngineUnavailableException unavailable) {
                    throw unavailable;
                }
                throw new EngineUnavailableException("Query engine construction failed: " + cause.getMessage(), cause);
            }
        }
    }

    private void construct(CompletableFuture<EngineHandle> target) {
        int attempt = constructions.incrementAndGet();
        long start = System.nanoTime();
        logger.info("Constructing query engine (attempt {}) with {}", attempt, config);

        EngineHandle handle;
        try {
            handle = factory.create(config);
        } catch (Throwable e) {
            // Includes native library load errors; waiters must not hang on the future
            failOrRethrow(target, e);
            return;
        }

        try {
            SyncReport report = synchronizer.sync(registry, handle);
            logger.info("Initial catalog synchronization: {}", report.summary());
        } catch (RegistryException e) {
            // The engine is usable without views; the next explicit sync catches up
            logger.warn("Initial catalog synchronization skipped, registry unavailable: {}", e.getMessage());
        } catch (Throwable e) {
            handle.close();
            failOrRethrow(target, e);
            return;
        }

        logger.info("Query engine ready in {} ms", (System.nanoTime() - start) / 1_000_000);
        if (!target.complete(handle)) {
            // Cancelled by a concurrent shutdown
            handle.close();
        }
    }

    private void failOrRethrow(CompletableFuture<EngineHandle> target, Throwable e) {
        logger.error("Query engine construction failed: {}", e.getMessage(), e);
        // Reset before completing so waiters that retry start a fresh construction
        current.compareAndSet(target, null);
        target.completeExceptionally(e instanceof EngineUnavailableException
            ? e
            : new EngineUnavailableException("Query engine unavailable: " + e, e));
        if (e instanceof VirtualMachineError vmError) {
            throw vmError;
        }
    }

    /**
     * Admits an execution and returns the engine it runs on.
     *
     * @return a lease to be closed when the execution ends
     * @throws EngineUnavailableException if the session is shutting down or construction fails
     */
    public Lease lease() {
        if (!inFlight.tryEnter()) {
            throw new EngineUnavailableException("Query engine is shutting down");
        }
        try {
            return new Lease(acquire(), inFlight);
        } catch (RuntimeException e) {
            inFlight.exit();
            throw e;
        }
    }

    /**
     * Runs one synchronization pass against the current engine, constructing it if needed.
     *
     * @return the pass report
     * @throws EngineUnavailableException if the engine cannot be constructed
     * @throws RegistryException if the registry cannot be read
     */
    public SyncReport synchronize() {
        try (Lease lease = lease()) {
            return synchronizer.sync(registry, lease.engine());
        }
    }

    /**
     * Stops admitting executions, waits for running ones and releases the engine.
     * Idempotent and safe before initialization; a later acquisition builds a new engine.
     */
    public synchronized void shutdown() {
        CompletableFuture<EngineHandle> future = current.get();
        if (future == null) {
            return;
        }

        inFlight.close();
        try {
            try {
                if (!inFlight.awaitDrained(config.shutdownDrainTimeoutMs())) {
                    logger.warn("Shutdown drain timed out with {} execution(s) still running", inFlight.inFlight());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while draining executions");
            }

            current.compareAndSet(future, null);
            if (!future.cancel(false) && !future.isCompletedExceptionally()) {
                EngineHandle handle = future.join();
                handle.close();
                logger.info("Query engine shut down");
            }
        } finally {
            inFlight.reopen();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isInitialized() {
        return state() == EngineState.READY;
    }

    public EngineState state() {
        CompletableFuture<EngineHandle> future = current.get();
        if (future == null || future.isCompletedExceptionally()) {
            return EngineState.UNINITIALIZED;
        }
        return future.isDone() ? EngineState.READY : EngineState.INITIALIZING;
    }

    /** Number of engine constructions started by this session. */
    public int constructionCount() {
        return constructions.get();
    }

    public EngineConfig config() {
        return config;
    }

    public TableRegistry registry() {
        return registry;
    }

    /**
     * An admitted execution. Closing it releases the admission; the engine
     * stays open.
     */
    public static final class Lease implements AutoCloseable {
        private final EngineHandle engine;
        private final InFlightTracker tracker;
        private boolean closed = false;

        private Lease(EngineHandle engine, InFlightTracker tracker) {
            this.engine = engine;
            this.tracker = tracker;
        }

        public EngineHandle engine() {
            return engine;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                tracker.exit();
            }
        }
    }
}
