package com.walletd.domain;

import java.util.Objects;

/**
 * Owning-address record: which key of the wallet controls an output.
 */
public record WalletAddress(int index, int cosignerIndex, Keychain keychain) {

    public WalletAddress {
        Objects.requireNonNull(keychain, "keychain");
        if (index < 0 || cosignerIndex < 0) {
            throw new IllegalArgumentException("Derivation indexes must be non-negative: " + index + "/" + cosignerIndex);
        }
    }

    public static WalletAddress external(int index) {
        return new WalletAddress(index, 0, Keychain.EXTERNAL);
    }

    public static WalletAddress internal(int index) {
        return new WalletAddress(index, 0, Keychain.INTERNAL);
    }

    /** m/keychain/index, or m/cosigner/keychain/index for multisig wallets. */
    public String derivationPath(boolean multisig) {
        if (multisig) {
            return "m/" + cosignerIndex + "/" + keychain.index() + "/" + index;
        }
        return "m/" + keychain.index() + "/" + index;
    }
}
