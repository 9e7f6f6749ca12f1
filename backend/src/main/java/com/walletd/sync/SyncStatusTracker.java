package com.walletd.sync;

import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Outcome of sync cycles, for queries that must refuse to answer before the first successful sync.
 */
@Component
public class SyncStatusTracker {

    private volatile SyncStatus status = new SyncStatus(false, null, null, null, 0, 0, 0, 0);

    public SyncStatus getStatus() {
        return status;
    }

    public boolean isFirstSyncDone() {
        return status.firstSyncDone();
    }

    synchronized void recordSuccess(Instant at, int utxoCount) {
        SyncStatus s = status;
        status = new SyncStatus(true, at, s.lastFailureAt(), s.lastError(), 0, s.cyclesCompleted() + 1,
                s.coalescedTriggers(), utxoCount);
    }

    synchronized void recordFailure(Instant at, String error) {
        SyncStatus s = status;
        status = new SyncStatus(s.firstSyncDone(), s.lastSuccessAt(), at, error, s.consecutiveFailures() + 1,
                s.cyclesCompleted(), s.coalescedTriggers(), s.lastUtxoCount());
    }

    synchronized void recordCoalesced() {
        SyncStatus s = status;
        status = new SyncStatus(s.firstSyncDone(), s.lastSuccessAt(), s.lastFailureAt(), s.lastError(),
                s.consecutiveFailures(), s.cyclesCompleted(), s.coalescedTriggers() + 1, s.lastUtxoCount());
    }
}
