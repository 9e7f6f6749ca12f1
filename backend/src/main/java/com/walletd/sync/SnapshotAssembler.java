package com.walletd.sync;

import com.walletd.domain.Outpoint;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletUtxo;
import com.walletd.node.MempoolEntriesByAddress;
import com.walletd.node.MempoolEntry;
import com.walletd.node.MempoolOutput;
import com.walletd.node.NodeUtxoEntry;
import com.walletd.utxo.UtxoSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one round of node responses into a snapshot. Pure computation: no I/O, no shared state.
 */
@Slf4j
@Component
public class SnapshotAssembler {

    public record Result(UtxoSnapshot snapshot, int excluded, int mempoolReceived, int malformed) {
    }

    /**
     * @throws UnresolvableOwnerException when a consensus entry pays to an address missing from {@code owners}
     */
    public Result assemble(List<NodeUtxoEntry> consensus, List<MempoolEntriesByAddress> mempool,
                           Map<String, WalletAddress> owners, Instant fetchedAt) {
        Set<Outpoint> exclusions = new HashSet<>();
        int malformed = 0;
        for (MempoolEntriesByAddress byAddress : mempool) {
            for (MempoolEntry sending : byAddress.sending()) {
                exclusions.addAll(sending.inputs());
                if (sending.malformedInputs() > 0) {
                    log.warn("Mempool transaction {} spending from {} has {} unparseable input(s), they cannot be excluded",
                            sending.transactionId(), byAddress.address(), sending.malformedInputs());
                    malformed += sending.malformedInputs();
                }
            }
        }

        UtxoSnapshot.Builder builder = UtxoSnapshot.builder(fetchedAt);
        int excluded = 0;
        for (NodeUtxoEntry e : consensus) {
            if (!e.isComplete()) {
                log.warn("Skipping malformed UTXO entry from node: {}", e);
                malformed++;
                continue;
            }
            if (exclusions.contains(e.outpoint())) {
                excluded++;
                continue;
            }
            WalletAddress owner = owners.get(e.address());
            if (owner == null) {
                throw new UnresolvableOwnerException(e.address());
            }
            builder.add(new WalletUtxo(e.outpoint(), e.entry(), owner));
        }

        int received = 0;
        Set<String> seenTransactions = new HashSet<>();
        for (MempoolEntriesByAddress byAddress : mempool) {
            for (MempoolEntry receiving : byAddress.receiving()) {
                if (receiving.transactionId() == null) {
                    log.warn("Skipping mempool entry without transaction id for {}", byAddress.address());
                    malformed++;
                    continue;
                }
                if (!seenTransactions.add(receiving.transactionId())) {
                    continue;
                }
                received += addReceivedOutputs(builder, receiving, owners, exclusions);
            }
        }

        UtxoSnapshot snapshot = builder.build();
        return new Result(snapshot, excluded, received, malformed);
    }

    private static int addReceivedOutputs(UtxoSnapshot.Builder builder, MempoolEntry receiving,
                                          Map<String, WalletAddress> owners, Set<Outpoint> exclusions) {
        int added = 0;
        for (MempoolOutput output : receiving.outputs()) {
            WalletAddress owner = output.address() == null ? null : owners.get(output.address());
            if (owner == null) {
                continue;
            }
            Outpoint outpoint;
            try {
                outpoint = new Outpoint(receiving.transactionId(), output.index());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping mempool output with invalid outpoint {}:{}", receiving.transactionId(), output.index());
                continue;
            }
            if (exclusions.contains(outpoint)) {
                continue;
            }
            UtxoEntry entry = new UtxoEntry(output.value(), output.scriptPublicKey(), 0L, false);
            if (builder.add(new WalletUtxo(outpoint, entry, owner))) {
                added++;
            }
        }
        return added;
    }
}
