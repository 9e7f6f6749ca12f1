package com.walletd.service;

import java.util.List;

/**
 * Wallet totals in sompi. {@code perAddress} is empty unless requested.
 */
public record WalletBalance(long available, long pending, List<AddressBalance> perAddress) {

    public static WalletBalance empty() {
        return new WalletBalance(0, 0, List.of());
    }
}
