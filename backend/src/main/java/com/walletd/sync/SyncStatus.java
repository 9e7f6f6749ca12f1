package com.walletd.sync;

import java.time.Instant;

public record SyncStatus(
        boolean firstSyncDone,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastError,
        int consecutiveFailures,
        long cyclesCompleted,
        long coalescedTriggers,
        int lastUtxoCount) {
}
