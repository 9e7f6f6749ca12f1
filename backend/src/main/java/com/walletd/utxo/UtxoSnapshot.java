package com.walletd.utxo;

import com.walletd.domain.Outpoint;
import com.walletd.domain.WalletUtxo;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable UTXO set produced by one sync cycle: outpoint mapping plus an index sorted by (amount, outpoint).
 * Built through {@link Builder}, which sorts and verifies both structures before handing the snapshot out.
 */
@Slf4j
public final class UtxoSnapshot implements UtxoView {

    private static final UtxoSnapshot EMPTY = new UtxoSnapshot(Map.of(), List.of(), Instant.EPOCH);

    private final Map<Outpoint, WalletUtxo> utxos;
    private final List<AmountKey> sorted;
    /** When the cycle that produced this snapshot started fetching. */
    @Getter
    private final Instant fetchedAt;

    private UtxoSnapshot(Map<Outpoint, WalletUtxo> utxos, List<AmountKey> sorted, Instant fetchedAt) {
        this.utxos = utxos;
        this.sorted = sorted;
        this.fetchedAt = fetchedAt;
    }

    public static UtxoSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder(Instant fetchedAt) {
        return new Builder(fetchedAt);
    }

    @Override
    public boolean contains(Outpoint outpoint) {
        return utxos.containsKey(outpoint);
    }

    @Override
    public Optional<WalletUtxo> get(Outpoint outpoint) {
        return Optional.ofNullable(utxos.get(outpoint));
    }

    @Override
    public Iterable<WalletUtxo> sortedByAmount() {
        return () -> new Iterator<>() {
            private final Iterator<AmountKey> keys = sorted.iterator();

            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public WalletUtxo next() {
                return utxos.get(keys.next().outpoint());
            }
        };
    }

    @Override
    public List<WalletUtxo> pendingAdditions() {
        return List.of();
    }

    @Override
    public int size() {
        return utxos.size();
    }

    public List<AmountKey> sortedKeys() {
        return sorted;
    }

    /**
     * Equal sizes, non-decreasing order, and every key present in the mapping with the same amount.
     */
    public void verifyInvariant() {
        if (utxos.size() != sorted.size()) {
            throw new SnapshotInvariantViolation("Mapping has " + utxos.size() + " entries, sorted index " + sorted.size());
        }
        AmountKey previous = null;
        for (AmountKey key : sorted) {
            if (previous != null && previous.compareTo(key) >= 0) {
                throw new SnapshotInvariantViolation("Sorted index out of order at " + key.outpoint());
            }
            WalletUtxo utxo = utxos.get(key.outpoint());
            if (utxo == null || utxo.amount() != key.amount()) {
                throw new SnapshotInvariantViolation("Sorted index entry " + key.outpoint() + " does not match the mapping");
            }
            previous = key;
        }
    }

    public static final class Builder {

        private final Instant fetchedAt;
        private final Map<Outpoint, WalletUtxo> utxos = new HashMap<>();
        private final List<AmountKey> keys = new ArrayList<>();

        private Builder(Instant fetchedAt) {
            this.fetchedAt = fetchedAt;
        }

        /** Adds {@code utxo}; returns false and keeps the first one when the outpoint is already present. */
        public boolean add(WalletUtxo utxo) {
            if (utxos.putIfAbsent(utxo.outpoint(), utxo) != null) {
                log.warn("Duplicate outpoint {} in fetch result, keeping the first entry", utxo.outpoint());
                return false;
            }
            keys.add(new AmountKey(utxo.amount(), utxo.outpoint()));
            return true;
        }

        public UtxoSnapshot build() {
            Collections.sort(keys);
            UtxoSnapshot snapshot = new UtxoSnapshot(
                    Collections.unmodifiableMap(new HashMap<>(utxos)), List.copyOf(keys), fetchedAt);
            snapshot.verifyInvariant();
            return snapshot;
        }
    }
}
