package com.walletd.tx;

import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import com.walletd.domain.WalletTransaction;

import java.util.List;

/**
 * Compute mass of transactions: serialized size, plus a weight on locking-script bytes and signature
 * operations. Unsigned inputs are charged the estimated signature mass.
 */
public class MassCalculator {

    public static final long MAXIMUM_STANDARD_TRANSACTION_MASS = 100_000;

    static final long MASS_PER_TX_BYTE = 1;
    static final long MASS_PER_SCRIPT_PUB_KEY_BYTE = 10;
    static final long MASS_PER_SIG_OP = 1_000;

    // version, input count, output count, lock time, subnetwork id, gas, payload hash, payload length
    static final int TX_BASE_SIZE = 2 + 8 + 8 + 8 + 20 + 8 + 32 + 8;
    // outpoint, signature script length, sequence
    static final int INPUT_BASE_SIZE = 32 + 4 + 8 + 8;
    // value, script version, script length
    static final int OUTPUT_BASE_SIZE = 8 + 2 + 8;

    private final SignatureMassEstimator signatureMassEstimator;

    public MassCalculator(SignatureMassEstimator signatureMassEstimator) {
        this.signatureMassEstimator = signatureMassEstimator;
    }

    public long baseMass(int payloadLength) {
        return (TX_BASE_SIZE + (long) payloadLength) * MASS_PER_TX_BYTE;
    }

    public long outputMass(ScriptPublicKey scriptPublicKey) {
        int len = scriptPublicKey.scriptLength();
        return (OUTPUT_BASE_SIZE + (long) len) * MASS_PER_TX_BYTE + (2L + len) * MASS_PER_SCRIPT_PUB_KEY_BYTE;
    }

    /** Mass of one input once signed. */
    public long estimatedInputMass(int sigOpCount) {
        return INPUT_BASE_SIZE * MASS_PER_TX_BYTE + sigOpCount * MASS_PER_SIG_OP + signatureMassEstimator.signatureMassPerInput();
    }

    public long estimateMass(int inputCount, int sigOpCount, List<ScriptPublicKey> outputs, int payloadLength) {
        long mass = baseMass(payloadLength) + inputCount * estimatedInputMass(sigOpCount);
        for (ScriptPublicKey spk : outputs) {
            mass += outputMass(spk);
        }
        return mass;
    }

    public long massWithoutSignatures(WalletTransaction tx) {
        long mass = baseMass(tx.payloadLength());
        for (TransactionInput in : tx.inputs()) {
            mass += (INPUT_BASE_SIZE + (long) in.signatureScriptLength()) * MASS_PER_TX_BYTE + in.sigOpCount() * MASS_PER_SIG_OP;
        }
        for (TransactionOutput out : tx.outputs()) {
            mass += outputMass(out.scriptPublicKey());
        }
        return mass;
    }

    /** Mass after signing: already signed inputs count as they are, unsigned ones get the estimate. */
    public long estimatedMass(WalletTransaction tx) {
        long mass = massWithoutSignatures(tx);
        for (TransactionInput in : tx.inputs()) {
            if (!in.isSigned()) {
                mass += signatureMassEstimator.signatureMassPerInput();
            }
        }
        return mass;
    }

    public long feeFor(long mass, FeeLimits limits) {
        long fee = (long) Math.ceil(mass * limits.feeRate());
        return Math.min(fee, limits.maxFee());
    }

    /**
     * Smallest non-dust value for an output with this script: three times the relay cost of creating and
     * spending it, raised with the fee rate.
     */
    public long dustThreshold(ScriptPublicKey scriptPublicKey, double feeRate) {
        long outputSize = OUTPUT_BASE_SIZE + scriptPublicKey.scriptLength();
        return (long) Math.ceil(3 * (outputSize + 148) * Math.max(1.0, feeRate));
    }

    public boolean isDust(TransactionOutput output, double feeRate) {
        return output.value() < dustThreshold(output.scriptPublicKey(), feeRate);
    }
}
