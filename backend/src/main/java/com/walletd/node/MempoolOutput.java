package com.walletd.node;

import com.walletd.domain.ScriptPublicKey;

/** Output {@code index} of a mempool transaction; {@code address} is null for non-standard scripts. */
public record MempoolOutput(int index, long value, ScriptPublicKey scriptPublicKey, String address) {
}
