package com.quackhouse.sync;

import java.util.Objects;

/**
 * Outcome of one view during a synchronization pass.
 *
 * @param name the view name
 * @param tableId registry id of the entry, or null for a pruned view
 * @param outcome what happened
 * @param reason failure reason, null unless {@code outcome == FAILED}
 */
public record SyncStatus(String name, Long tableId, Outcome outcome, String reason) {

    public enum Outcome {
        BOUND,
        FAILED,
        PRUNED
    }

    public SyncStatus {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static SyncStatus bound(String name, long tableId) {
        return new SyncStatus(name, tableId, Outcome.BOUND, null);
    }

    public static SyncStatus failed(String name, long tableId, String reason) {
        return new SyncStatus(name, tableId, Outcome.FAILED, reason);
    }

    public static SyncStatus pruned(String name) {
        return new SyncStatus(name, null, Outcome.PRUNED, null);
    }

    /** Renders as {@code BOUND}, {@code PRUNED} or {@code FAILED: reason}. */
    public String describe() {
        return outcome == Outcome.FAILED ? "FAILED: " + reason : outcome.name();
    }
}
