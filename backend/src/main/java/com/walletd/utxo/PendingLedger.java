package com.walletd.utxo;

import com.walletd.domain.Outpoint;
import com.walletd.domain.PendingTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Transactions this wallet broadcast that the node has not confirmed yet. Guarded by its own lock.
 */
@Slf4j
@Component
public class PendingLedger {

    private final Object lock = new Object();
    private final List<PendingTransaction> entries = new ArrayList<>();

    public void add(PendingTransaction transaction) {
        synchronized (lock) {
            entries.add(transaction);
        }
        log.debug("Pending transaction {} recorded ({} inputs)", transaction.transactionId(), transaction.consumedOutpoints().size());
    }

    public List<PendingTransaction> entries() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /**
     * Drops entries the fresh snapshot proves settled: a consumed input is gone (confirmed or double spent) and
     * was not produced by another pending entry. Entries whose inputs are all still unspent are kept.
     *
     * @return number of entries removed
     */
    public int prune(UtxoSnapshot fresh) {
        int removed = 0;
        synchronized (lock) {
            Set<String> pendingIds = new HashSet<>();
            for (PendingTransaction tx : entries) {
                pendingIds.add(tx.transactionId());
            }
            Iterator<PendingTransaction> it = entries.iterator();
            while (it.hasNext()) {
                PendingTransaction tx = it.next();
                if (isSettled(tx, fresh, pendingIds)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    private static boolean isSettled(PendingTransaction tx, UtxoSnapshot fresh, Set<String> pendingIds) {
        for (Outpoint input : tx.consumedOutpoints()) {
            // inputs created by another pending entry are not in any snapshot yet
            if (!fresh.contains(input) && !pendingIds.contains(input.transactionId())) {
                return true;
            }
        }
        return false;
    }
}
