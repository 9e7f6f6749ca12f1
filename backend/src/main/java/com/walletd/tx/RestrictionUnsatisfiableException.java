package com.walletd.tx;

import com.walletd.common.WalletServiceException;

/**
 * The from-address restriction leaves no spendable UTXO although the wallet holds funds elsewhere.
 */
public class RestrictionUnsatisfiableException extends WalletServiceException {

    public RestrictionUnsatisfiableException(int restrictedAddresses) {
        super(ErrorCode.RESTRICTION_UNSATISFIABLE,
                "None of the " + restrictedAddresses + " from-addresses holds spendable funds");
    }
}
