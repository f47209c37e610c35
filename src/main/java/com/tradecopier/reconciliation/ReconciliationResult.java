package com.tradecopier.reconciliation;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one ledger rebuild.
 *
 * <p>{@code trigger} is SESSION_SUBSCRIBED, MANUAL, or the reason an out-of-band run was
 * requested. The counts say how many live positions each account reported and how the ledger
 * pairs were found. Unpaired master positions have been submitted as OPEN decisions; unpaired slave
 * positions are left alone.
 */
@Value
@Builder
public class ReconciliationResult {

    String trigger;
    int masterPositionCount;
    int slavePositionCount;
    int pairedByLabel;
    int pairedByHeuristic;

    /** Ledger entries a lane opened while the run was querying, kept as they were. */
    int carriedOver;

    @Builder.Default
    List<Long> unpairedMasterPositionIds = List.of();

    @Builder.Default
    List<Long> unpairedSlavePositionIds = List.of();

    Instant completedAt;
    long durationMs;

    public int getPairedTotal() {
        return pairedByLabel + pairedByHeuristic + carriedOver;
    }
}
