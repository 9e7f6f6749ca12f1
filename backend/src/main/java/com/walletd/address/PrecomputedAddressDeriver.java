package com.walletd.address;

import com.walletd.common.WalletServiceException;
import com.walletd.domain.WalletAddress;

import java.util.Map;

/**
 * Looks addresses up in a table derived ahead of time by the key holder.
 */
public class PrecomputedAddressDeriver implements AddressDeriver {

    private final Map<WalletAddress, String> table;
    private final boolean multisig;

    public PrecomputedAddressDeriver(Map<WalletAddress, String> table, boolean multisig) {
        this.table = Map.copyOf(table);
        this.multisig = multisig;
    }

    @Override
    public String deriveAddress(WalletAddress walletAddress) {
        String address = table.get(walletAddress);
        if (address == null) {
            throw new WalletServiceException(WalletServiceException.ErrorCode.INTERNAL,
                    "No address derived for " + walletAddress.derivationPath(multisig));
        }
        return address;
    }
}
