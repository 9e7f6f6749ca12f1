package com.walletd.sync;

import com.walletd.address.AddressDirectory;
import com.walletd.address.Versioned;
import com.walletd.domain.WalletAddress;
import com.walletd.node.MempoolEntriesByAddress;
import com.walletd.node.NodeClient;
import com.walletd.node.NodeUtxoEntry;
import com.walletd.node.RpcException;
import com.walletd.utxo.PendingLedger;
import com.walletd.utxo.SnapshotInvariantViolation;
import com.walletd.utxo.UtxoSnapshot;
import com.walletd.utxo.UtxoStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Refreshes the published UTXO snapshot from the node. Only one cycle runs at a time: a request that arrives
 * while a cycle is running marks a rerun and returns, and the running thread performs at most one more cycle
 * for all requests that arrived meanwhile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UtxoSyncService {

    private final AddressDirectory addressDirectory;
    private final NodeClient nodeClient;
    private final UtxoStore utxoStore;
    private final PendingLedger pendingLedger;
    private final SnapshotAssembler snapshotAssembler;
    private final SyncStatusTracker syncStatusTracker;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean rerunRequested = new AtomicBoolean();

    /**
     * Runs a cycle on the calling thread unless one is already running.
     *
     * @return true if this call ran at least one cycle, false if it was coalesced into the running one
     */
    public boolean requestSync(String reason) {
        rerunRequested.set(true);
        boolean ran = false;
        while (rerunRequested.get() && running.compareAndSet(false, true)) {
            try {
                while (rerunRequested.getAndSet(false)) {
                    runCycle(reason);
                    ran = true;
                }
            } finally {
                running.set(false);
            }
        }
        if (!ran) {
            syncStatusTracker.recordCoalesced();
            log.debug("Sync request ({}) coalesced into running cycle", reason);
        }
        return ran;
    }

    public boolean isSynced() {
        return syncStatusTracker.isFirstSyncDone();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runCycle(String reason) {
        Instant fetchedAt = Instant.now();
        Versioned<List<String>> monitored = addressDirectory.monitoredAddresses();
        Versioned<Map<String, WalletAddress>> owners = addressDirectory.addressOwnerMap();
        try {
            UtxoSnapshot snapshot;
            if (monitored.value().isEmpty()) {
                snapshot = UtxoSnapshot.builder(fetchedAt).build();
            } else {
                // mempool first: an output spent in the mempool and mined between the two calls stays excluded
                List<MempoolEntriesByAddress> mempool = nodeClient.getMempoolEntriesByAddresses(monitored.value());
                List<NodeUtxoEntry> utxos = nodeClient.getUtxosByAddresses(monitored.value());
                SnapshotAssembler.Result result = snapshotAssembler.assemble(utxos, mempool, owners.value(), fetchedAt);
                snapshot = result.snapshot();
                log.debug("Assembled snapshot: {} utxos, {} excluded, {} mempool received, {} malformed",
                        snapshot.size(), result.excluded(), result.mempoolReceived(), result.malformed());
            }
            utxoStore.publish(snapshot);
            int pruned = pendingLedger.prune(snapshot);
            boolean first = !syncStatusTracker.isFirstSyncDone();
            syncStatusTracker.recordSuccess(fetchedAt, snapshot.size());
            if (first) {
                log.info("First UTXO sync done: {} utxos over {} addresses", snapshot.size(), monitored.value().size());
            } else {
                log.debug("UTXO sync ({}) published {} utxos, pruned {} pending transactions (address version {})",
                        reason, snapshot.size(), pruned, monitored.version());
            }
        } catch (SnapshotInvariantViolation e) {
            log.error("Snapshot invariant violated, refusing to continue: {}", e.getMessage(), e);
            throw e;
        } catch (RpcException | UnresolvableOwnerException e) {
            syncStatusTracker.recordFailure(Instant.now(), e.getMessage());
            log.warn("UTXO sync ({}) failed, keeping previous snapshot: {}", reason, e.getMessage());
        } catch (RuntimeException e) {
            syncStatusTracker.recordFailure(Instant.now(), e.getClass().getSimpleName() + ": " + e.getMessage());
            log.warn("UTXO sync ({}) failed unexpectedly, keeping previous snapshot", reason, e);
        }
    }
}
