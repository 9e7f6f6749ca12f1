package com.walletd.tx;

/** Resolved fee rate (sompi/gram) and cap (sompi). */
public record FeeLimits(double feeRate, long maxFee) {

    public static FeeLimits uncapped(double feeRate) {
        return new FeeLimits(feeRate, Long.MAX_VALUE);
    }
}
