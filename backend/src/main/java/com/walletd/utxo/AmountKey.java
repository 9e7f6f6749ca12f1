package com.walletd.utxo;

import com.walletd.domain.Outpoint;

import java.util.Comparator;

/**
 * Entry of the sorted index: amount first, outpoint as tie-break.
 */
public record AmountKey(long amount, Outpoint outpoint) implements Comparable<AmountKey> {

    private static final Comparator<AmountKey> ORDER = Comparator.comparingLong(AmountKey::amount)
            .thenComparing(AmountKey::outpoint);

    @Override
    public int compareTo(AmountKey other) {
        return ORDER.compare(this, other);
    }
}
