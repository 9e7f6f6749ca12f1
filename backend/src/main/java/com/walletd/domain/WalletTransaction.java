package com.walletd.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wallet-built transaction together with what the wallet knows about it: the entry and owner of every input
 * and the destination address of every output. Index {@code i} of {@code inputEntries} and {@code inputOwners}
 * belongs to input {@code i}; index {@code j} of {@code outputAddresses} to output {@code j}.
 */
public record WalletTransaction(
        String transactionId,
        List<TransactionInput> inputs,
        List<TransactionOutput> outputs,
        List<UtxoEntry> inputEntries,
        List<WalletAddress> inputOwners,
        List<String> outputAddresses,
        String payloadHex) {

    public WalletTransaction {
        Objects.requireNonNull(transactionId, "transactionId");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        inputEntries = List.copyOf(inputEntries);
        inputOwners = List.copyOf(inputOwners);
        outputAddresses = List.copyOf(outputAddresses);
        payloadHex = payloadHex == null ? "" : payloadHex;
        if (inputEntries.size() != inputs.size() || inputOwners.size() != inputs.size()) {
            throw new IllegalArgumentException("Every input needs an entry and an owner");
        }
        if (outputAddresses.size() != outputs.size()) {
            throw new IllegalArgumentException("Every output needs a destination address");
        }
    }

    public long totalInputAmount() {
        long total = 0;
        for (UtxoEntry e : inputEntries) {
            total += e.amount();
        }
        return total;
    }

    public long totalOutputAmount() {
        long total = 0;
        for (TransactionOutput o : outputs) {
            total += o.value();
        }
        return total;
    }

    public long fee() {
        return totalInputAmount() - totalOutputAmount();
    }

    public List<Outpoint> consumedOutpoints() {
        return inputs.stream().map(TransactionInput::previousOutpoint).toList();
    }

    public boolean isFullySigned() {
        return !inputs.isEmpty() && inputs.stream().allMatch(TransactionInput::isSigned);
    }

    public int payloadLength() {
        return payloadHex.length() / 2;
    }

    /** Copy with signature scripts filled in, one per input. The id does not cover signature scripts. */
    public WalletTransaction withSignatureScripts(List<String> signatureScripts) {
        if (signatureScripts.size() != inputs.size()) {
            throw new IllegalArgumentException("Expected " + inputs.size() + " signature scripts, got " + signatureScripts.size());
        }
        List<TransactionInput> signed = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            TransactionInput in = inputs.get(i);
            signed.add(new TransactionInput(in.previousOutpoint(), signatureScripts.get(i), in.sequence(), in.sigOpCount()));
        }
        return new WalletTransaction(transactionId, signed, outputs, inputEntries, inputOwners, outputAddresses, payloadHex);
    }

    public WalletTransaction withTransactionId(String id) {
        return new WalletTransaction(id, inputs, outputs, inputEntries, inputOwners, outputAddresses, payloadHex);
    }
}
