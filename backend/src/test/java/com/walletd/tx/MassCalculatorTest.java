package com.walletd.tx;

import com.walletd.domain.Outpoint;
import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletTransaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.walletd.Fixtures.P2PK;
import static com.walletd.Fixtures.txId;
import static org.assertj.core.api.Assertions.assertThat;

class MassCalculatorTest {

    private final MassCalculator calculator = new MassCalculator(new SignatureScriptMassEstimator(1));

    @Test
    void estimatedInputMass_singleSignature() {
        // 52 bytes + 1 sig op + 66 bytes of signature script
        assertThat(calculator.estimatedInputMass(1)).isEqualTo(1_118);
    }

    @Test
    void estimatedInputMass_multisigChargesEverySignature() {
        MassCalculator multisig = new MassCalculator(new SignatureScriptMassEstimator(2));
        assertThat(multisig.estimatedInputMass(2)).isEqualTo(52 + 2_000 + 132);
    }

    @Test
    void outputMass_payToPubKey() {
        assertThat(calculator.outputMass(P2PK)).isEqualTo(52 + 360);
    }

    @Test
    void estimateMass_sumsBaseInputsOutputsAndPayload() {
        long mass = calculator.estimateMass(2, 1, List.of(P2PK, P2PK), 10);
        assertThat(mass).isEqualTo(94 + 10 + 2 * 1_118 + 2 * 412);
    }

    @Test
    void estimatedMass_signedInputsCountTheirActualScript() {
        WalletTransaction unsigned = transaction("");
        WalletTransaction signed = transaction("41" + "00".repeat(65));

        assertThat(calculator.estimatedMass(unsigned)).isEqualTo(94 + 1_118 + 412);
        assertThat(calculator.estimatedMass(signed)).isEqualTo(calculator.estimatedMass(unsigned));
        assertThat(calculator.massWithoutSignatures(unsigned)).isEqualTo(94 + 1_052 + 412);
    }

    @Test
    void feeFor_roundsUpAndRespectsCap() {
        assertThat(calculator.feeFor(1_001, FeeLimits.uncapped(1.5))).isEqualTo(1_502);
        assertThat(calculator.feeFor(1_001, new FeeLimits(1.5, 1_000))).isEqualTo(1_000);
    }

    @Test
    void dustThreshold_scalesWithFeeRateAboveOne() {
        assertThat(calculator.dustThreshold(P2PK, 1.0)).isEqualTo(3 * (52 + 148));
        assertThat(calculator.dustThreshold(P2PK, 0.5)).isEqualTo(600);
        assertThat(calculator.dustThreshold(P2PK, 2.0)).isEqualTo(1_200);
        assertThat(calculator.isDust(new TransactionOutput(599, P2PK), 1.0)).isTrue();
        assertThat(calculator.isDust(new TransactionOutput(600, P2PK), 1.0)).isFalse();
    }

    private static WalletTransaction transaction(String signatureScript) {
        return new WalletTransaction(txId(1),
                List.of(new TransactionInput(new Outpoint(txId(2), 0), signatureScript, 0, 1)),
                List.of(new TransactionOutput(1_000, P2PK)),
                List.of(new UtxoEntry(2_000, P2PK, 1, false)),
                List.of(WalletAddress.external(0)),
                List.of("kaspatest:x"), "");
    }
}
