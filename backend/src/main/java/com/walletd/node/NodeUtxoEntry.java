package com.walletd.node;

import com.walletd.domain.Outpoint;
import com.walletd.domain.UtxoEntry;

/**
 * UTXO as reported by the node. Any field may be missing in a malformed response.
 */
public record NodeUtxoEntry(String address, Outpoint outpoint, UtxoEntry entry) {

    public boolean isComplete() {
        return address != null && outpoint != null && entry != null;
    }
}
