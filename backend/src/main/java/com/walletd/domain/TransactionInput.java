package com.walletd.domain;

import java.util.Objects;

/** Input spending {@code previousOutpoint}; the signature script stays empty until signed. */
public record TransactionInput(Outpoint previousOutpoint, String signatureScriptHex, long sequence, int sigOpCount) {

    public TransactionInput {
        Objects.requireNonNull(previousOutpoint, "previousOutpoint");
        signatureScriptHex = signatureScriptHex == null ? "" : signatureScriptHex;
    }

    public static TransactionInput unsigned(Outpoint previousOutpoint, int sigOpCount) {
        return new TransactionInput(previousOutpoint, "", 0L, sigOpCount);
    }

    public int signatureScriptLength() {
        return signatureScriptHex.length() / 2;
    }

    public boolean isSigned() {
        return !signatureScriptHex.isEmpty();
    }
}
