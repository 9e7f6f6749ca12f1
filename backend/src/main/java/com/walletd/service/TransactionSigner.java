package com.walletd.service;

import com.walletd.domain.WalletTransaction;

import java.util.List;

/**
 * Signs wallet transactions. Implemented by the key holder; the daemon itself never sees private keys.
 */
public interface TransactionSigner {

    List<WalletTransaction> sign(List<WalletTransaction> unsigned);
}
