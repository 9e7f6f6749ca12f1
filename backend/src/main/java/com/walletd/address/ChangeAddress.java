package com.walletd.address;

import com.walletd.domain.WalletAddress;

public record ChangeAddress(String address, WalletAddress owner) {
}
