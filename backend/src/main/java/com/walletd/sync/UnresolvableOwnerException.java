package com.walletd.sync;

import lombok.Getter;

/**
 * The node returned a UTXO for an address that is not in the wallet's address map.
 */
@Getter
public class UnresolvableOwnerException extends RuntimeException {

    private final String address;

    public UnresolvableOwnerException(String address) {
        super("UTXO address " + address + " not found in wallet address set");
        this.address = address;
    }
}
