package com.walletd.tx;

import com.walletd.address.ChangeAddressPolicy;
import com.walletd.domain.Outpoint;

import java.util.List;
import java.util.Objects;

/**
 * Spend request from a caller. {@code amount} is ignored when {@code sendAll} is set.
 */
public record TransactionRequest(
        String toAddress,
        long amount,
        boolean sendAll,
        FeePolicy feePolicy,
        List<String> fromAddresses,
        List<Outpoint> preselected,
        ChangeAddressPolicy changeAddressPolicy,
        String payloadHex) {

    public TransactionRequest {
        Objects.requireNonNull(toAddress, "toAddress");
        feePolicy = feePolicy == null ? FeePolicy.nodeEstimate() : feePolicy;
        fromAddresses = fromAddresses == null ? List.of() : List.copyOf(fromAddresses);
        preselected = preselected == null ? List.of() : List.copyOf(preselected);
        changeAddressPolicy = changeAddressPolicy == null ? ChangeAddressPolicy.REUSE_EXISTING : changeAddressPolicy;
        payloadHex = payloadHex == null ? "" : payloadHex;
    }

    public static TransactionRequest send(String toAddress, long amount, FeePolicy feePolicy) {
        return new TransactionRequest(toAddress, amount, false, feePolicy, List.of(), List.of(), null, null);
    }

    public static TransactionRequest sendAll(String toAddress, FeePolicy feePolicy) {
        return new TransactionRequest(toAddress, 0, true, feePolicy, List.of(), List.of(), null, null);
    }
}
