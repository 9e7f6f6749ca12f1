package com.walletd.address;

import com.walletd.domain.WalletAddress;

/**
 * Turns a derivation position into an address string. Key material stays behind this interface.
 */
public interface AddressDeriver {

    String deriveAddress(WalletAddress walletAddress);
}
