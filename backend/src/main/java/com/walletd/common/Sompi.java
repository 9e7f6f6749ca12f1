package com.walletd.common;

import java.math.BigDecimal;

/**
 * Amount constants and formatting. All amounts in the wallet are sompi.
 */
public final class Sompi {

    public static final long SOMPI_PER_KAS = 100_000_000L;

    private Sompi() {
    }

    public static long ofKas(long kas) {
        return Math.multiplyExact(kas, SOMPI_PER_KAS);
    }

    public static String toKasString(long sompi) {
        return BigDecimal.valueOf(sompi).movePointLeft(8).stripTrailingZeros().toPlainString();
    }
}
