package com.walletd.service;

import com.walletd.address.AddressDirectory;
import com.walletd.common.WalletServiceException;
import com.walletd.domain.PendingTransaction;
import com.walletd.domain.SyncRequestedEvent;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletTransaction;
import com.walletd.node.NodeClient;
import com.walletd.node.RpcException;
import com.walletd.sync.UtxoSyncService;
import com.walletd.tx.TransactionGenerator;
import com.walletd.tx.TransactionRequest;
import com.walletd.utxo.PendingLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Creates, broadcasts and sends wallet transactions. Broadcasts are serialized so a chain of dependent
 * transactions reaches the node in order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionGenerator transactionGenerator;
    private final NodeClient nodeClient;
    private final PendingLedger pendingLedger;
    private final AddressDirectory addressDirectory;
    private final UtxoSyncService utxoSyncService;
    private final ApplicationEventPublisher eventPublisher;

    private final ReentrantLock submitLock = new ReentrantLock();

    public List<WalletTransaction> createUnsignedTransactions(TransactionRequest request) {
        requireSynced();
        return transactionGenerator.createUnsignedTransactions(request);
    }

    /**
     * Submits fully signed transactions in order and records each accepted one as pending.
     *
     * @return ids assigned by the node
     */
    public List<String> broadcast(List<WalletTransaction> signed) {
        requireSynced();
        if (signed == null || signed.isEmpty()) {
            throw WalletServiceException.userInput("No transactions to broadcast");
        }
        for (WalletTransaction tx : signed) {
            if (!tx.isFullySigned()) {
                throw WalletServiceException.userInput("Transaction " + tx.transactionId() + " is not fully signed");
            }
        }
        List<String> ids = new ArrayList<>(signed.size());
        submitLock.lock();
        try {
            for (WalletTransaction tx : signed) {
                String id;
                try {
                    id = nodeClient.submitTransaction(tx);
                } catch (RpcException e) {
                    throw new WalletServiceException(WalletServiceException.ErrorCode.INTERNAL,
                            "Submitting transaction " + tx.transactionId() + " failed after " + ids.size() + " of "
                                    + signed.size() + " were accepted: " + e.getMessage(), e);
                }
                WalletTransaction accepted = tx;
                if (!id.equals(tx.transactionId())) {
                    log.warn("Node assigned id {} to transaction built as {}", id, tx.transactionId());
                    accepted = tx.withTransactionId(id);
                }
                Map<String, WalletAddress> owners = addressDirectory.addressOwnerMap().value();
                pendingLedger.add(PendingTransaction.of(accepted, owners, Instant.now()));
                ids.add(id);
                log.info("Broadcast transaction {} ({} inputs, {} outputs)", id, tx.inputs().size(), tx.outputs().size());
            }
        } finally {
            submitLock.unlock();
            if (!ids.isEmpty()) {
                eventPublisher.publishEvent(new SyncRequestedEvent("broadcast"));
            }
        }
        return ids;
    }

    public List<String> send(TransactionRequest request, TransactionSigner signer) {
        List<WalletTransaction> unsigned = createUnsignedTransactions(request);
        return broadcast(signer.sign(unsigned));
    }

    private void requireSynced() {
        if (!utxoSyncService.isSynced()) {
            throw new WalletServiceException(WalletServiceException.ErrorCode.NOT_SYNCED, "Wallet is not synced yet");
        }
    }
}
