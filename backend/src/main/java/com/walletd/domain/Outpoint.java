package com.walletd.domain;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Reference to a transaction output. Ordered by transaction id bytes, then index.
 * The id is held as lowercase hex of fixed length, so string order equals byte order.
 */
public record Outpoint(String transactionId, int index) implements Comparable<Outpoint> {

    public static final int TRANSACTION_ID_HEX_LENGTH = 64;

    public Outpoint {
        Objects.requireNonNull(transactionId, "transactionId");
        if (transactionId.length() != TRANSACTION_ID_HEX_LENGTH) {
            throw new IllegalArgumentException("Transaction id must be 32 bytes hex: " + transactionId);
        }
        transactionId = transactionId.toLowerCase(Locale.ROOT);
        if (!isHex(transactionId)) {
            throw new IllegalArgumentException("Transaction id is not hex: " + transactionId);
        }
        if (index < 0) {
            throw new IllegalArgumentException("Output index must be non-negative: " + index);
        }
    }

    public byte[] transactionIdBytes() {
        return HexFormat.of().parseHex(transactionId);
    }

    @Override
    public int compareTo(Outpoint other) {
        int c = transactionId.compareTo(other.transactionId);
        return c != 0 ? c : Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return transactionId + ":" + index;
    }

    private static boolean isHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!HexFormat.isHexDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
