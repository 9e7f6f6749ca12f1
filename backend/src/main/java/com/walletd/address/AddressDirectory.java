package com.walletd.address;

import com.walletd.domain.WalletAddress;

import java.util.List;
import java.util.Map;

/**
 * Addresses the wallet watches and who owns them.
 * <p>
 * Both collection accessors are cached. The cache is rebuilt only when the directory version moved, and the
 * version is bumped in the same critical section as the mutation, so a returned {@link Versioned} never pairs
 * a new version with old contents.
 */
public interface AddressDirectory {

    Versioned<List<String>> monitoredAddresses();

    Versioned<Map<String, WalletAddress>> addressOwnerMap();

    long version();

    String addressOf(WalletAddress owner);

    /**
     * Change destination for a new transaction: the first restricted address when a restriction is given,
     * otherwise an internal address chosen by {@code policy}. The returned address is registered.
     */
    ChangeAddress changeAddress(ChangeAddressPolicy policy, List<WalletAddress> restriction);

    void register(String address, WalletAddress owner);
}
