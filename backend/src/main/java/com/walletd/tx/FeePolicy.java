package com.walletd.tx;

import java.util.Objects;

/**
 * How the caller bounds the fee of a transaction.
 */
public record FeePolicy(Kind kind, double value) {

    public enum Kind {
        /** Use exactly {@code value} sompi/gram, no cap on the total fee. */
        EXACT_FEE_RATE,
        /** Use the node estimate, but never more than {@code value} sompi/gram. */
        MAX_FEE_RATE,
        /** Use the node estimate, total fee capped at {@code value} sompi. */
        MAX_FEE,
        /** Node estimate with the configured default fee cap. */
        NODE_ESTIMATE
    }

    public FeePolicy {
        Objects.requireNonNull(kind, "kind");
    }

    public static FeePolicy exactFeeRate(double sompiPerGram) {
        return new FeePolicy(Kind.EXACT_FEE_RATE, sompiPerGram);
    }

    public static FeePolicy maxFeeRate(double sompiPerGram) {
        return new FeePolicy(Kind.MAX_FEE_RATE, sompiPerGram);
    }

    public static FeePolicy maxFee(long sompi) {
        return new FeePolicy(Kind.MAX_FEE, sompi);
    }

    public static FeePolicy nodeEstimate() {
        return new FeePolicy(Kind.NODE_ESTIMATE, 0);
    }
}
