package com.walletd.node;

import com.walletd.domain.Outpoint;

import java.util.List;

/**
 * One mempool transaction. {@code malformedInputs} counts inputs whose previous outpoint could not be parsed and
 * are therefore missing from {@code inputs}.
 */
public record MempoolEntry(String transactionId, List<Outpoint> inputs, List<MempoolOutput> outputs, int malformedInputs) {

    public MempoolEntry {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public MempoolEntry(String transactionId, List<Outpoint> inputs, List<MempoolOutput> outputs) {
        this(transactionId, inputs, outputs, 0);
    }
}
