package com.walletd.utxo;

import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletUtxo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.walletd.Fixtures.snapshot;
import static com.walletd.Fixtures.utxo;
import static org.assertj.core.api.Assertions.assertThat;

class UtxoSnapshotTest {

    private static final WalletAddress OWNER = WalletAddress.external(0);

    @Test
    @DisplayName("sorted index is ascending by amount with outpoint as tie-break")
    void build_sortsByAmountThenOutpoint() {
        UtxoSnapshot snapshot = snapshot(utxo(3, 20, OWNER), utxo(2, 10, OWNER), utxo(1, 20, OWNER));

        List<WalletUtxo> sorted = new ArrayList<>();
        snapshot.sortedByAmount().forEach(sorted::add);

        assertThat(sorted).extracting(WalletUtxo::amount).containsExactly(10L, 20L, 20L);
        assertThat(sorted.get(1).outpoint()).isLessThan(sorted.get(2).outpoint());
        assertThat(snapshot.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("same entries in any insertion order produce the same sorted sequence")
    void build_isDeterministicRegardlessOfInputOrder() {
        List<WalletUtxo> utxos = new ArrayList<>();
        for (int i = 1; i <= 200; i++) {
            utxos.add(utxo(i, i % 7, OWNER));
        }
        UtxoSnapshot first = snapshot(utxos.toArray(new WalletUtxo[0]));
        Collections.shuffle(utxos, new Random(42));
        UtxoSnapshot second = snapshot(utxos.toArray(new WalletUtxo[0]));

        assertThat(second.sortedKeys()).isEqualTo(first.sortedKeys());
    }

    @Test
    void build_duplicateOutpoint_keepsFirstAndInvariantHolds() {
        UtxoSnapshot.Builder builder = UtxoSnapshot.builder(Instant.now());
        assertThat(builder.add(utxo(1, 10, OWNER))).isTrue();
        assertThat(builder.add(utxo(1, 99, OWNER))).isFalse();

        UtxoSnapshot snapshot = builder.build();

        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.sortedKeys()).hasSize(1);
        assertThat(snapshot.get(utxo(1, 10, OWNER).outpoint())).get().extracting(WalletUtxo::amount).isEqualTo(10L);
        snapshot.verifyInvariant();
    }

    @Test
    void empty_hasNothingToIterate() {
        UtxoSnapshot empty = UtxoSnapshot.empty();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.sortedByAmount().iterator().hasNext()).isFalse();
        empty.verifyInvariant();
    }
}
