package com.quackhouse.sync;

import java.util.List;
import java.util.Optional;

/**
 * Result of a synchronization pass, one status per registry entry in registry
 * order followed by the pruned views.
 */
public record SyncReport(List<SyncStatus> statuses) {

    public SyncReport {
        statuses = List.copyOf(statuses);
    }

    public long bound() {
        return count(SyncStatus.Outcome.BOUND);
    }

    public long failed() {
        return count(SyncStatus.Outcome.FAILED);
    }

    public long pruned() {
        return count(SyncStatus.Outcome.PRUNED);
    }

    /** Status of the registry entry with the given id. */
    public Optional<SyncStatus> forTable(long tableId) {
        return statuses.stream()
            .filter(s -> s.tableId() != null && s.tableId() == tableId)
            .findFirst();
    }

    public String summary() {
        return String.format("%d bound, %d failed, %d pruned", bound(), failed(), pruned());
    }

    private long count(SyncStatus.Outcome outcome) {
        return statuses.stream().filter(s -> s.outcome() == outcome).count();
    }
}
