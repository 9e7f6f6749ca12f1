package com.walletd.domain;

/**
 * Derivation branch of a wallet address: receive addresses live on EXTERNAL, change on INTERNAL.
 */
public enum Keychain {
    EXTERNAL(0),
    INTERNAL(1);

    private final int index;

    Keychain(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }
}
