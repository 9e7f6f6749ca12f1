package com.walletd.tx;

import com.walletd.domain.WalletUtxo;

import java.util.List;

/**
 * Chosen inputs; {@code totalInput == amountToRecipient + change + fee}.
 */
public record Selection(List<WalletUtxo> utxos, long totalInput, long amountToRecipient, long change, long fee) {

    public Selection {
        utxos = List.copyOf(utxos);
    }
}
