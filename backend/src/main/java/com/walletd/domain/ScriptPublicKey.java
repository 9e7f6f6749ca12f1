package com.walletd.domain;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/** Locking script of an output: script version plus the script bytes as hex. */
public record ScriptPublicKey(int version, String scriptHex) {

    public ScriptPublicKey {
        Objects.requireNonNull(scriptHex, "scriptHex");
        if (scriptHex.length() % 2 != 0) {
            throw new IllegalArgumentException("Script hex has odd length");
        }
        scriptHex = scriptHex.toLowerCase(Locale.ROOT);
    }

    public static ScriptPublicKey of(int version, byte[] script) {
        return new ScriptPublicKey(version, HexFormat.of().formatHex(script));
    }

    public int scriptLength() {
        return scriptHex.length() / 2;
    }

    public byte[] script() {
        return HexFormat.of().parseHex(scriptHex);
    }
}
