package com.walletd.service;

import com.walletd.address.AddressDirectory;
import com.walletd.common.WalletServiceException;
import com.walletd.config.WalletProperties;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletUtxo;
import com.walletd.node.NodeClient;
import com.walletd.sync.UtxoSyncService;
import com.walletd.tx.MassCalculator;
import com.walletd.utxo.OverlayView;
import com.walletd.utxo.UtxoStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Balance and UTXO queries. Each call works on one overlay view, so the numbers it returns belong to a single
 * snapshot and ledger state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletQueryService {

    private final UtxoStore utxoStore;
    private final AddressDirectory addressDirectory;
    private final NodeClient nodeClient;
    private final UtxoSyncService utxoSyncService;
    private final MassCalculator massCalculator;
    private final WalletProperties walletProperties;

    public WalletBalance getBalance(boolean includePerAddress) {
        requireSynced();
        OverlayView view = utxoStore.overlay();
        if (view.isEmpty()) {
            return WalletBalance.empty();
        }
        long virtualDaaScore = nodeClient.getVirtualDaaScore();
        long available = 0;
        long pending = 0;
        Map<WalletAddress, long[]> byOwner = new HashMap<>();
        for (WalletUtxo utxo : view.sortedByAmount()) {
            boolean isPending = isPending(utxo, virtualDaaScore);
            if (isPending) {
                pending += utxo.amount();
            } else {
                available += utxo.amount();
            }
            if (includePerAddress) {
                byOwner.computeIfAbsent(utxo.address(), k -> new long[2])[isPending ? 1 : 0] += utxo.amount();
            }
        }
        for (WalletUtxo utxo : view.pendingAdditions()) {
            pending += utxo.amount();
            if (includePerAddress) {
                byOwner.computeIfAbsent(utxo.address(), k -> new long[2])[1] += utxo.amount();
            }
        }
        List<AddressBalance> perAddress = new ArrayList<>(byOwner.size());
        for (Map.Entry<WalletAddress, long[]> e : byOwner.entrySet()) {
            perAddress.add(new AddressBalance(addressDirectory.addressOf(e.getKey()), e.getValue()[0], e.getValue()[1]));
        }
        perAddress.sort(Comparator.comparing(AddressBalance::address));
        return new WalletBalance(available, pending, List.copyOf(perAddress));
    }

    /**
     * UTXOs grouped by address. An empty {@code addresses} list means every wallet address.
     */
    public List<AddressUtxos> getUtxos(List<String> addresses, boolean includePending, boolean includeDust) {
        requireSynced();
        Map<String, WalletAddress> owners = addressDirectory.addressOwnerMap().value();
        Map<WalletAddress, String> wanted = new HashMap<>();
        if (addresses == null || addresses.isEmpty()) {
            owners.forEach((address, owner) -> wanted.put(owner, address));
        } else {
            for (String address : addresses) {
                WalletAddress owner = owners.get(address);
                if (owner == null) {
                    throw WalletServiceException.userInput("Address " + address + " not found in wallet");
                }
                wanted.put(owner, address);
            }
        }

        OverlayView view = utxoStore.overlay();
        if (view.isEmpty()) {
            return List.of();
        }
        Map<String, List<UtxoInfo>> buckets = new TreeMap<>();
        long virtualDaaScore = nodeClient.getVirtualDaaScore();
        double feeRate = nodeClient.getFeeEstimate();
        for (WalletUtxo utxo : view.sortedByAmount()) {
            collect(buckets, wanted, utxo, isPending(utxo, virtualDaaScore), feeRate, includePending, includeDust);
        }
        for (WalletUtxo utxo : view.pendingAdditions()) {
            collect(buckets, wanted, utxo, true, feeRate, includePending, includeDust);
        }
        return buckets.entrySet().stream()
                .map(e -> new AddressUtxos(e.getKey(), List.copyOf(e.getValue())))
                .toList();
    }

    /** Snapshot UTXOs are pending only while they are immature coinbase; pending additions always are. */
    private boolean isPending(WalletUtxo utxo, long virtualDaaScore) {
        return utxo.isImmatureCoinbase(virtualDaaScore, walletProperties.getCoinbaseMaturity());
    }

    private void collect(Map<String, List<UtxoInfo>> buckets, Map<WalletAddress, String> wanted, WalletUtxo utxo,
                         boolean pending, double feeRate, boolean includePending, boolean includeDust) {
        String address = wanted.get(utxo.address());
        if (address == null || (pending && !includePending)) {
            return;
        }
        boolean dust = utxo.amount() < massCalculator.dustThreshold(utxo.entry().scriptPublicKey(), feeRate);
        if (dust && !includeDust) {
            return;
        }
        buckets.computeIfAbsent(address, k -> new ArrayList<>()).add(new UtxoInfo(utxo.outpoint(), utxo.entry(), pending, dust));
    }

    private void requireSynced() {
        if (!utxoSyncService.isSynced()) {
            throw new WalletServiceException(WalletServiceException.ErrorCode.NOT_SYNCED, "Wallet is not synced yet");
        }
    }
}
