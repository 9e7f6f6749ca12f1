package com.walletd.domain;

import java.util.Objects;

public record WalletUtxo(Outpoint outpoint, UtxoEntry entry, WalletAddress address) {

    public WalletUtxo {
        Objects.requireNonNull(outpoint, "outpoint");
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(address, "address");
    }

    public long amount() {
        return entry.amount();
    }

    public boolean isImmatureCoinbase(long virtualDaaScore, long coinbaseMaturity) {
        return entry.isImmatureCoinbase(virtualDaaScore, coinbaseMaturity);
    }
}
