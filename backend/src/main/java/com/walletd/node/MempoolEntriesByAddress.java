package com.walletd.node;

import java.util.List;

/**
 * Mempool transactions touching one address: {@code sending} spend from it, {@code receiving} pay to it.
 */
public record MempoolEntriesByAddress(String address, List<MempoolEntry> sending, List<MempoolEntry> receiving) {

    public MempoolEntriesByAddress {
        sending = sending == null ? List.of() : List.copyOf(sending);
        receiving = receiving == null ? List.of() : List.copyOf(receiving);
    }
}
