package com.walletd.utxo;

import com.walletd.domain.Payment;
import com.walletd.domain.PendingTransaction;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletTransaction;
import com.walletd.domain.WalletUtxo;
import com.walletd.tx.TransactionFactory;
import com.walletd.tx.TransactionIdCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.walletd.Fixtures.CODEC;
import static com.walletd.Fixtures.P2PK;
import static com.walletd.Fixtures.address;
import static com.walletd.Fixtures.utxo;
import static org.assertj.core.api.Assertions.assertThat;

class PendingLedgerTest {

    private static final WalletAddress OWNER = WalletAddress.external(0);
    private static final WalletAddress CHANGE = WalletAddress.internal(0);

    private final TransactionFactory factory = new TransactionFactory(CODEC, new TransactionIdCalculator(), 1);
    private PendingLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PendingLedger();
    }

    @Test
    @DisplayName("entry is pruned once the next snapshot no longer holds its inputs")
    void prune_inputsGone_removesEntryAndOverlayStopsExcluding() {
        WalletUtxo input = utxo(1, 100, OWNER);
        WalletUtxo other = utxo(2, 300, OWNER);
        Instant t0 = Instant.now();
        ledger.add(pending(List.of(input), t0));

        UtxoSnapshot before = snapshotAt(t0.plusSeconds(1), input, other);
        assertThat(ledger.prune(before)).isZero();
        assertThat(new OverlayView(before, ledger.entries()).contains(input.outpoint())).isFalse();

        UtxoSnapshot after = snapshotAt(t0.plusSeconds(2), other);
        assertThat(ledger.prune(after)).isEqualTo(1);
        assertThat(ledger.size()).isZero();

        OverlayView view = new OverlayView(after, ledger.entries());
        assertThat(view.size()).isEqualTo(after.size());
        assertThat(view.contains(other.outpoint())).isTrue();
        assertThat(view.pendingAdditions()).isEmpty();
    }

    @Test
    void prune_inputProducedByAnotherPendingEntry_keepsBoth() {
        WalletUtxo input = utxo(1, 100, OWNER);
        Instant t0 = Instant.now();
        PendingTransaction parent = pending(List.of(input), t0);
        ledger.add(parent);
        WalletUtxo parentChange = parent.walletOutputs().get(0);
        WalletUtxo unaccepted = new WalletUtxo(parentChange.outpoint(),
                new UtxoEntry(parentChange.amount(), P2PK, UtxoEntry.UNACCEPTED_DAA_SCORE, false), CHANGE);
        ledger.add(pending(List.of(unaccepted), t0));

        assertThat(ledger.prune(snapshotAt(t0.plusSeconds(1), input))).isZero();
        assertThat(ledger.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("entry whose inputs stay unspent is kept, however long ago it was broadcast")
    void prune_inputsStillUnspentLongAfterBroadcast_keepsEntry() {
        WalletUtxo input = utxo(1, 100, OWNER);
        Instant t0 = Instant.now();
        ledger.add(pending(List.of(input), t0));

        assertThat(ledger.prune(snapshotAt(t0.plus(Duration.ofMinutes(11)), input))).isZero();
        assertThat(ledger.prune(snapshotAt(t0.plus(Duration.ofDays(2)), input))).isZero();
        assertThat(ledger.entries()).extracting(PendingTransaction::consumedOutpoints)
                .containsExactly(List.of(input.outpoint()));
    }

    @Test
    void entries_returnsCopy() {
        ledger.add(pending(List.of(utxo(1, 100, OWNER)), Instant.now()));
        List<PendingTransaction> copy = ledger.entries();
        ledger.add(pending(List.of(utxo(2, 100, OWNER)), Instant.now()));
        assertThat(copy).hasSize(1);
        assertThat(ledger.size()).isEqualTo(2);
    }

    private PendingTransaction pending(List<WalletUtxo> inputs, Instant at) {
        String changeAddress = address(2);
        long total = inputs.stream().mapToLong(WalletUtxo::amount).sum();
        WalletTransaction tx = factory.build(inputs, List.of(new Payment(changeAddress, total - 10)), "");
        return PendingTransaction.of(tx, Map.of(changeAddress, CHANGE), at);
    }

    private static UtxoSnapshot snapshotAt(Instant fetchedAt, WalletUtxo... utxos) {
        UtxoSnapshot.Builder builder = UtxoSnapshot.builder(fetchedAt);
        for (WalletUtxo u : utxos) {
            builder.add(u);
        }
        return builder.build();
    }
}
