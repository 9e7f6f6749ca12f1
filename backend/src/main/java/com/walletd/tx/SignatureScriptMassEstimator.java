package com.walletd.tx;

/**
 * 66 bytes per signature (push opcode, 64-byte signature, sighash type) times the signatures an input needs.
 */
public class SignatureScriptMassEstimator implements SignatureMassEstimator {

    static final int SIGNATURE_SIZE = 66;

    private final int minimumSignatures;

    public SignatureScriptMassEstimator(int minimumSignatures) {
        this.minimumSignatures = Math.max(1, minimumSignatures);
    }

    @Override
    public long signatureMassPerInput() {
        return (long) SIGNATURE_SIZE * minimumSignatures * MassCalculator.MASS_PER_TX_BYTE;
    }
}
