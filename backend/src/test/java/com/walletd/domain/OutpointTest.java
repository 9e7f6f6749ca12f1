package com.walletd.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.walletd.Fixtures.txId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutpointTest {

    @Test
    void compareTo_ordersByTransactionIdBytesThenIndex() {
        Outpoint a0 = new Outpoint(txId(1), 0);
        Outpoint a1 = new Outpoint(txId(1), 1);
        Outpoint b0 = new Outpoint("ff" + txId(0).substring(2), 0);
        List<Outpoint> list = new ArrayList<>(List.of(b0, a1, a0));
        Collections.sort(list);
        assertThat(list).containsExactly(a0, a1, b0);
    }

    @Test
    void constructor_upperCaseHex_normalizedForEquality() {
        String lower = "ab".repeat(32);
        assertThat(new Outpoint(lower.toUpperCase(), 3)).isEqualTo(new Outpoint(lower, 3));
    }

    @Test
    void constructor_shortOrNonHexId_rejected() {
        assertThatThrownBy(() -> new Outpoint("abcd", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Outpoint("zz".repeat(32), 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Outpoint(txId(1), -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isImmatureCoinbase_dependsOnVirtualDaaScore() {
        UtxoEntry coinbase = new UtxoEntry(10, new ScriptPublicKey(0, ""), 500, true);
        assertThat(coinbase.isImmatureCoinbase(1_499, 1_000)).isTrue();
        assertThat(coinbase.isImmatureCoinbase(1_500, 1_000)).isFalse();
        UtxoEntry regular = new UtxoEntry(10, new ScriptPublicKey(0, ""), 500, false);
        assertThat(regular.isImmatureCoinbase(0, 1_000)).isFalse();
    }
}
