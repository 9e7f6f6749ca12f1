package com.walletd.tx;

import com.walletd.domain.Outpoint;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.WalletAddress;

import java.util.List;
import java.util.Objects;

/**
 * Inputs to {@link UtxoSelector#select}. Recipient and change scripts size the outputs in the fee estimate.
 */
public record SelectionRequest(
        long amount,
        boolean sendAll,
        FeeLimits feeLimits,
        List<WalletAddress> restriction,
        List<Outpoint> preselected,
        ScriptPublicKey recipientScript,
        ScriptPublicKey changeScript,
        int payloadLength) {

    public SelectionRequest {
        Objects.requireNonNull(feeLimits, "feeLimits");
        Objects.requireNonNull(recipientScript, "recipientScript");
        Objects.requireNonNull(changeScript, "changeScript");
        restriction = restriction == null ? List.of() : List.copyOf(restriction);
        preselected = preselected == null ? List.of() : List.copyOf(preselected);
    }
}
