package com.walletd.tx;

/**
 * Mass a signature script will add to one input once signed.
 */
public interface SignatureMassEstimator {

    long signatureMassPerInput();
}
