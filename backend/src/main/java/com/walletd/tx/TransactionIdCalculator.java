package com.walletd.tx;

import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;

/**
 * Transaction id: keyed BLAKE2b-256 over the transaction with signature scripts left out, so the id is known
 * before signing and outputs of one unsigned transaction can be spent by the next.
 */
public class TransactionIdCalculator {

    private static final byte[] KEY = "TransactionID".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NATIVE_SUBNETWORK = new byte[20];

    public String transactionId(List<TransactionInput> inputs, List<TransactionOutput> outputs, byte[] payload) {
        Blake2bDigest digest = new Blake2bDigest(KEY, 32, null, null);
        writeU16(digest, 0);
        writeU64(digest, inputs.size());
        for (TransactionInput in : inputs) {
            byte[] txId = in.previousOutpoint().transactionIdBytes();
            digest.update(txId, 0, txId.length);
            writeU32(digest, in.previousOutpoint().index());
            writeU64(digest, 0);
            writeU64(digest, in.sequence());
        }
        writeU64(digest, outputs.size());
        for (TransactionOutput out : outputs) {
            writeU64(digest, out.value());
            writeU16(digest, out.scriptPublicKey().version());
            writeVarBytes(digest, out.scriptPublicKey().script());
        }
        writeU64(digest, 0);
        digest.update(NATIVE_SUBNETWORK, 0, NATIVE_SUBNETWORK.length);
        writeU64(digest, 0);
        writeVarBytes(digest, payload);
        byte[] hash = new byte[32];
        digest.doFinal(hash, 0);
        return HexFormat.of().formatHex(hash);
    }

    private static void writeVarBytes(Blake2bDigest digest, byte[] bytes) {
        writeU64(digest, bytes.length);
        digest.update(bytes, 0, bytes.length);
    }

    private static void writeU16(Blake2bDigest digest, int v) {
        digest.update(ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN).putShort((short) v).array(), 0, 2);
    }

    private static void writeU32(Blake2bDigest digest, int v) {
        digest.update(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(v).array(), 0, 4);
    }

    private static void writeU64(Blake2bDigest digest, long v) {
        digest.update(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(v).array(), 0, 8);
    }
}
