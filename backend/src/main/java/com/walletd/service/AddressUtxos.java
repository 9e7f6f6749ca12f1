package com.walletd.service;

import java.util.List;

public record AddressUtxos(String address, List<UtxoInfo> utxos) {
}
