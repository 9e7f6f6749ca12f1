package com.walletd.utxo;

import com.walletd.domain.PendingTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published snapshot. Readers grab the reference and keep using it while the next one is published.
 */
@Component
@RequiredArgsConstructor
public class UtxoStore {

    private final PendingLedger pendingLedger;

    private final AtomicReference<UtxoSnapshot> current = new AtomicReference<>(UtxoSnapshot.empty());
    private final AtomicLong generation = new AtomicLong();

    public void publish(UtxoSnapshot snapshot) {
        current.set(snapshot);
        generation.incrementAndGet();
    }

    public UtxoSnapshot current() {
        return current.get();
    }

    /** Number of snapshots published since startup. */
    public long generation() {
        return generation.get();
    }

    public OverlayView overlay(Collection<PendingTransaction> pendingTransactions) {
        return new OverlayView(current(), pendingTransactions);
    }

    public OverlayView overlay() {
        UtxoSnapshot snapshot = current();
        return new OverlayView(snapshot, pendingLedger.entries());
    }
}
