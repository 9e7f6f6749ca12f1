package com.walletd.node;

import com.walletd.domain.WalletTransaction;

import java.util.List;

/**
 * Blocking view of the remote node. Every method throws {@link RpcException} on failure.
 */
public interface NodeClient {

    List<NodeUtxoEntry> getUtxosByAddresses(List<String> addresses);

    List<MempoolEntriesByAddress> getMempoolEntriesByAddresses(List<String> addresses);

    long getVirtualDaaScore();

    /** Fee rate (sompi/gram) of the node's normal priority bucket. */
    double getFeeEstimate();

    /** @return transaction id assigned by the node */
    String submitTransaction(WalletTransaction transaction);
}
