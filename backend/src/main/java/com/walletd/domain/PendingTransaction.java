package com.walletd.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transaction broadcast by this wallet and not yet seen confirmed. Outputs that pay back to the wallet are
 * resolved to their owners once, when the entry is created.
 */
public record PendingTransaction(WalletTransaction transaction, List<WalletUtxo> walletOutputs, Instant broadcastAt) {

    public PendingTransaction {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(broadcastAt, "broadcastAt");
        walletOutputs = List.copyOf(walletOutputs);
    }

    public static PendingTransaction of(WalletTransaction transaction, Map<String, WalletAddress> owners, Instant broadcastAt) {
        List<WalletUtxo> walletOutputs = new ArrayList<>();
        for (int i = 0; i < transaction.outputs().size(); i++) {
            WalletAddress owner = owners.get(transaction.outputAddresses().get(i));
            if (owner == null) {
                continue;
            }
            TransactionOutput out = transaction.outputs().get(i);
            UtxoEntry entry = new UtxoEntry(out.value(), out.scriptPublicKey(), 0L, false);
            walletOutputs.add(new WalletUtxo(new Outpoint(transaction.transactionId(), i), entry, owner));
        }
        return new PendingTransaction(transaction, walletOutputs, broadcastAt);
    }

    public String transactionId() {
        return transaction.transactionId();
    }

    public List<Outpoint> consumedOutpoints() {
        return transaction.consumedOutpoints();
    }
}
