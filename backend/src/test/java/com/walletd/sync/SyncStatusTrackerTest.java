package com.walletd.sync;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SyncStatusTrackerTest {

    private final SyncStatusTracker tracker = new SyncStatusTracker();

    @Test
    void initialStatus_notSynced() {
        assertThat(tracker.isFirstSyncDone()).isFalse();
        assertThat(tracker.getStatus().cyclesCompleted()).isZero();
        assertThat(tracker.getStatus().lastSuccessAt()).isNull();
    }

    @Test
    void failuresBeforeFirstSuccess_keepServiceUnsynced() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        tracker.recordFailure(at, "connection refused");
        tracker.recordFailure(at.plusSeconds(10), "connection refused");

        SyncStatus status = tracker.getStatus();
        assertThat(status.firstSyncDone()).isFalse();
        assertThat(status.consecutiveFailures()).isEqualTo(2);
        assertThat(status.lastFailureAt()).isEqualTo(at.plusSeconds(10));
        assertThat(status.lastError()).isEqualTo("connection refused");
    }

    @Test
    void recordSuccess_resetsConsecutiveFailuresAndKeepsLastError() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        tracker.recordFailure(at, "timeout");
        tracker.recordSuccess(at.plusSeconds(10), 42);

        SyncStatus status = tracker.getStatus();
        assertThat(status.firstSyncDone()).isTrue();
        assertThat(status.consecutiveFailures()).isZero();
        assertThat(status.cyclesCompleted()).isEqualTo(1);
        assertThat(status.lastUtxoCount()).isEqualTo(42);
        assertThat(status.lastSuccessAt()).isEqualTo(at.plusSeconds(10));
        assertThat(status.lastError()).isEqualTo("timeout");
    }

    @Test
    void failureAfterSuccess_staysSynced() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        tracker.recordSuccess(at, 3);
        tracker.recordFailure(at.plusSeconds(10), "timeout");

        assertThat(tracker.isFirstSyncDone()).isTrue();
        assertThat(tracker.getStatus().lastUtxoCount()).isEqualTo(3);
        assertThat(tracker.getStatus().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void recordCoalesced_countsTriggers() {
        tracker.recordCoalesced();
        tracker.recordCoalesced();

        assertThat(tracker.getStatus().coalescedTriggers()).isEqualTo(2);
        assertThat(tracker.isFirstSyncDone()).isFalse();
    }
}
