package com.walletd.tx;

import com.walletd.domain.Payment;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletTransaction;
import com.walletd.domain.WalletUtxo;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Assembles unsigned transactions from chosen UTXOs and payments.
 */
public class TransactionFactory {

    private final KaspaAddressCodec addressCodec;
    private final TransactionIdCalculator idCalculator;
    private final int sigOpCount;

    public TransactionFactory(KaspaAddressCodec addressCodec, TransactionIdCalculator idCalculator, int minimumSignatures) {
        this.addressCodec = addressCodec;
        this.idCalculator = idCalculator;
        this.sigOpCount = Math.max(1, minimumSignatures);
    }

    public int sigOpCount() {
        return sigOpCount;
    }

    public ScriptPublicKey scriptFor(String address) {
        return addressCodec.scriptFor(address);
    }

    public WalletTransaction build(List<WalletUtxo> utxos, List<Payment> payments, String payloadHex) {
        List<TransactionInput> inputs = new ArrayList<>(utxos.size());
        List<UtxoEntry> entries = new ArrayList<>(utxos.size());
        List<WalletAddress> owners = new ArrayList<>(utxos.size());
        for (WalletUtxo utxo : utxos) {
            inputs.add(TransactionInput.unsigned(utxo.outpoint(), sigOpCount));
            entries.add(utxo.entry());
            owners.add(utxo.address());
        }
        List<TransactionOutput> outputs = new ArrayList<>(payments.size());
        List<String> outputAddresses = new ArrayList<>(payments.size());
        for (Payment p : payments) {
            outputs.add(new TransactionOutput(p.amount(), addressCodec.scriptFor(p.address())));
            outputAddresses.add(p.address());
        }
        String payload = payloadHex == null ? "" : payloadHex;
        String id = idCalculator.transactionId(inputs, outputs, HexFormat.of().parseHex(payload));
        return new WalletTransaction(id, inputs, outputs, entries, owners, outputAddresses, payload);
    }
}
