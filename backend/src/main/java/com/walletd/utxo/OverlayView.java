package com.walletd.utxo;

import com.walletd.domain.Outpoint;
import com.walletd.domain.PendingTransaction;
import com.walletd.domain.WalletUtxo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot seen through the wallet's own pending transactions: their inputs are hidden and their wallet-owned
 * outputs become visible. Exclusions win over additions, additions win over the snapshot.
 */
public final class OverlayView implements UtxoView {

    private final UtxoSnapshot base;
    private final Set<Outpoint> excluded;
    private final Map<Outpoint, WalletUtxo> added;
    private final List<WalletUtxo> addedSorted;
    private final int size;

    public OverlayView(UtxoSnapshot base, Collection<PendingTransaction> pending) {
        this.base = base;
        Set<Outpoint> excl = new HashSet<>();
        Map<Outpoint, WalletUtxo> add = new HashMap<>();
        for (PendingTransaction tx : pending) {
            excl.addAll(tx.consumedOutpoints());
            for (WalletUtxo out : tx.walletOutputs()) {
                add.put(out.outpoint(), out);
            }
        }
        // a pending tx spending another pending tx's output hides that output too
        add.keySet().removeAll(excl);
        // outputs already confirmed are served from the snapshot
        add.keySet().removeIf(base::contains);
        this.excluded = excl;
        this.added = add;
        List<WalletUtxo> sortedAdds = new ArrayList<>(add.values());
        sortedAdds.sort(Comparator.comparingLong(WalletUtxo::amount).thenComparing(WalletUtxo::outpoint));
        this.addedSorted = List.copyOf(sortedAdds);
        int excludedInBase = 0;
        for (Outpoint o : excl) {
            if (base.contains(o)) {
                excludedInBase++;
            }
        }
        this.size = base.size() - excludedInBase + add.size();
    }

    public UtxoSnapshot base() {
        return base;
    }

    public boolean isExcluded(Outpoint outpoint) {
        return excluded.contains(outpoint);
    }

    @Override
    public boolean contains(Outpoint outpoint) {
        if (excluded.contains(outpoint)) {
            return false;
        }
        return added.containsKey(outpoint) || base.contains(outpoint);
    }

    @Override
    public Optional<WalletUtxo> get(Outpoint outpoint) {
        if (excluded.contains(outpoint)) {
            return Optional.empty();
        }
        WalletUtxo utxo = added.get(outpoint);
        return utxo != null ? Optional.of(utxo) : base.get(outpoint);
    }

    @Override
    public Iterable<WalletUtxo> sortedByAmount() {
        return () -> new Iterator<>() {
            private final Iterator<WalletUtxo> it = base.sortedByAmount().iterator();
            private WalletUtxo next = advance();

            private WalletUtxo advance() {
                while (it.hasNext()) {
                    WalletUtxo candidate = it.next();
                    if (!excluded.contains(candidate.outpoint())) {
                        return candidate;
                    }
                }
                return null;
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public WalletUtxo next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                WalletUtxo current = next;
                next = advance();
                return current;
            }
        };
    }

    @Override
    public List<WalletUtxo> pendingAdditions() {
        return addedSorted;
    }

    @Override
    public int size() {
        return size;
    }
}
