package com.walletd;

import com.walletd.domain.Outpoint;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletUtxo;
import com.walletd.tx.KaspaAddressCodec;
import com.walletd.utxo.UtxoSnapshot;

import java.time.Instant;
import java.util.Arrays;

/**
 * Shared test data: deterministic transaction ids, testnet addresses and small snapshots.
 */
public final class Fixtures {

    public static final String PREFIX = "kaspatest";
    public static final KaspaAddressCodec CODEC = new KaspaAddressCodec(PREFIX);
    public static final ScriptPublicKey P2PK = new ScriptPublicKey(0, "20" + "11".repeat(32) + "ac");
    public static final long KAS = 100_000_000L;

    private Fixtures() {
    }

    public static String txId(int n) {
        return String.format("%064x", n);
    }

    public static Outpoint outpoint(int tx, int index) {
        return new Outpoint(txId(tx), index);
    }

    /** Schnorr address whose public key bytes are all {@code n}. */
    public static String address(int n) {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) n);
        return CODEC.encode(KaspaAddressCodec.VERSION_PUBKEY, key);
    }

    public static WalletUtxo utxo(int tx, long amount, WalletAddress owner) {
        return new WalletUtxo(outpoint(tx, 0), new UtxoEntry(amount, P2PK, 100, false), owner);
    }

    public static WalletUtxo coinbase(int tx, long amount, long blockDaaScore, WalletAddress owner) {
        return new WalletUtxo(outpoint(tx, 0), new UtxoEntry(amount, P2PK, blockDaaScore, true), owner);
    }

    public static UtxoSnapshot snapshot(WalletUtxo... utxos) {
        UtxoSnapshot.Builder builder = UtxoSnapshot.builder(Instant.now());
        for (WalletUtxo u : utxos) {
            builder.add(u);
        }
        return builder.build();
    }
}
