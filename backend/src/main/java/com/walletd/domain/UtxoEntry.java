package com.walletd.domain;

import java.util.Objects;

/**
 * Amount (sompi, unsigned 64-bit value kept non-negative), locking script, block DAA score and coinbase flag.
 */
public record UtxoEntry(long amount, ScriptPublicKey scriptPublicKey, long blockDaaScore, boolean coinbase) {

    /** DAA score given to outputs of transactions that are not accepted yet. */
    public static final long UNACCEPTED_DAA_SCORE = Long.MAX_VALUE;

    public UtxoEntry {
        Objects.requireNonNull(scriptPublicKey, "scriptPublicKey");
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount);
        }
    }

    /** Coinbase outputs spend only once the virtual DAA score passed their maturity window. */
    public boolean isImmatureCoinbase(long virtualDaaScore, long coinbaseMaturity) {
        return coinbase && blockDaaScore + coinbaseMaturity > virtualDaaScore;
    }
}
