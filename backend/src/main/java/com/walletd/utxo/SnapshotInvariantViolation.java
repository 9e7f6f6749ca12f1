package com.walletd.utxo;

/**
 * The mapping and the sorted index of a snapshot disagree. Never expected from valid input.
 */
public class SnapshotInvariantViolation extends IllegalStateException {

    public SnapshotInvariantViolation(String message) {
        super(message);
    }
}
