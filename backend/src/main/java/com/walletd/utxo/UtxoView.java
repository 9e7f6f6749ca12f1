package com.walletd.utxo;

import com.walletd.domain.Outpoint;
import com.walletd.domain.WalletUtxo;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a consistent set of wallet UTXOs.
 */
public interface UtxoView {

    boolean contains(Outpoint outpoint);

    Optional<WalletUtxo> get(Outpoint outpoint);

    /** Confirmed or mempool-received UTXOs in ascending (amount, outpoint) order. */
    Iterable<WalletUtxo> sortedByAmount();

    /** Wallet-owned outputs of the wallet's own pending transactions, ascending. Not part of {@link #sortedByAmount()}. */
    List<WalletUtxo> pendingAdditions();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
