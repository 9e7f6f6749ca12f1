package com.walletd.domain;

import java.util.Objects;

public record TransactionOutput(long value, ScriptPublicKey scriptPublicKey) {

    public TransactionOutput {
        Objects.requireNonNull(scriptPublicKey, "scriptPublicKey");
        if (value < 0) {
            throw new IllegalArgumentException("Output value must be non-negative: " + value);
        }
    }
}
