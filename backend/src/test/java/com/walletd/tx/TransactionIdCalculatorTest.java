package com.walletd.tx;

import com.walletd.domain.Outpoint;
import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.walletd.Fixtures.P2PK;
import static com.walletd.Fixtures.txId;
import static org.assertj.core.api.Assertions.assertThat;

class TransactionIdCalculatorTest {

    private final TransactionIdCalculator calculator = new TransactionIdCalculator();

    @Test
    void transactionId_ignoresSignatureScripts() {
        List<TransactionOutput> outputs = List.of(new TransactionOutput(1_000, P2PK));
        String unsigned = calculator.transactionId(
                List.of(TransactionInput.unsigned(new Outpoint(txId(1), 0), 1)), outputs, new byte[0]);
        String signed = calculator.transactionId(
                List.of(new TransactionInput(new Outpoint(txId(1), 0), "41" + "ab".repeat(65), 0, 1)), outputs, new byte[0]);

        assertThat(unsigned).hasSize(64).isEqualTo(signed);
    }

    @Test
    void transactionId_changesWithOutputsAndPayload() {
        List<TransactionInput> inputs = List.of(TransactionInput.unsigned(new Outpoint(txId(1), 0), 1));
        String base = calculator.transactionId(inputs, List.of(new TransactionOutput(1_000, P2PK)), new byte[0]);

        assertThat(calculator.transactionId(inputs, List.of(new TransactionOutput(1_001, P2PK)), new byte[0])).isNotEqualTo(base);
        assertThat(calculator.transactionId(inputs, List.of(new TransactionOutput(1_000, P2PK)), new byte[]{1})).isNotEqualTo(base);
    }
}
