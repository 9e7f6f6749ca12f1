package com.walletd.service;

import com.walletd.domain.Outpoint;
import com.walletd.domain.UtxoEntry;

public record UtxoInfo(Outpoint outpoint, UtxoEntry entry, boolean pending, boolean dust) {
}
