package com.walletd.tx;

import com.walletd.common.WalletServiceException;
import com.walletd.domain.ScriptPublicKey;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

/**
 * Kaspa address format: {@code prefix:payload}, payload base32 encoded with a 40-bit BCH checksum over the
 * prefix and data. The first payload byte is the address version.
 */
public class KaspaAddressCodec {

    public static final int VERSION_PUBKEY = 0;
    public static final int VERSION_PUBKEY_ECDSA = 1;
    public static final int VERSION_SCRIPT_HASH = 8;

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int CHECKSUM_LENGTH = 8;

    private static final byte OP_DATA_32 = 0x20;
    private static final byte OP_DATA_33 = 0x21;
    private static final byte OP_CHECKSIG = (byte) 0xac;
    private static final byte OP_CHECKSIG_ECDSA = (byte) 0xab;
    private static final byte OP_BLAKE2B = (byte) 0xaa;
    private static final byte OP_EQUAL = (byte) 0x87;

    public record DecodedAddress(String prefix, int version, byte[] payload) {
    }

    private final String expectedPrefix;

    public KaspaAddressCodec(String expectedPrefix) {
        this.expectedPrefix = expectedPrefix.toLowerCase(Locale.ROOT);
    }

    public DecodedAddress decode(String address) {
        if (address == null) {
            throw invalid("null", "missing");
        }
        int sep = address.lastIndexOf(':');
        if (sep <= 0 || sep == address.length() - 1) {
            throw invalid(address, "missing prefix separator");
        }
        if (!address.equals(address.toLowerCase(Locale.ROOT))) {
            throw invalid(address, "mixed case");
        }
        String prefix = address.substring(0, sep);
        if (!prefix.equals(expectedPrefix)) {
            throw invalid(address, "expected prefix " + expectedPrefix);
        }
        String data = address.substring(sep + 1);
        if (data.length() <= CHECKSUM_LENGTH) {
            throw invalid(address, "too short");
        }
        byte[] values = new byte[data.length()];
        for (int i = 0; i < data.length(); i++) {
            int v = CHARSET.indexOf(data.charAt(i));
            if (v < 0) {
                throw invalid(address, "invalid character '" + data.charAt(i) + "'");
            }
            values[i] = (byte) v;
        }
        if (polymod(prefix, values) != 0) {
            throw invalid(address, "checksum mismatch");
        }
        byte[] bytes = convertBits(Arrays.copyOf(values, values.length - CHECKSUM_LENGTH), 5, 8, false);
        if (bytes == null || bytes.length < 1) {
            throw invalid(address, "bad payload padding");
        }
        int version = bytes[0] & 0xff;
        byte[] payload = Arrays.copyOfRange(bytes, 1, bytes.length);
        int expectedLength = switch (version) {
            case VERSION_PUBKEY, VERSION_SCRIPT_HASH -> 32;
            case VERSION_PUBKEY_ECDSA -> 33;
            default -> throw invalid(address, "unknown version " + version);
        };
        if (payload.length != expectedLength) {
            throw invalid(address, "payload length " + payload.length + " for version " + version);
        }
        return new DecodedAddress(prefix, version, payload);
    }

    public String encode(int version, byte[] payload) {
        byte[] versioned = new byte[payload.length + 1];
        versioned[0] = (byte) version;
        System.arraycopy(payload, 0, versioned, 1, payload.length);
        byte[] data = convertBits(versioned, 8, 5, true);
        byte[] withChecksum = Arrays.copyOf(data, data.length + CHECKSUM_LENGTH);
        long checksum = polymod(expectedPrefix, withChecksum);
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            withChecksum[data.length + i] = (byte) ((checksum >>> (5 * (CHECKSUM_LENGTH - 1 - i))) & 0x1f);
        }
        StringBuilder sb = new StringBuilder(expectedPrefix).append(':');
        for (byte b : withChecksum) {
            sb.append(CHARSET.charAt(b));
        }
        return sb.toString();
    }

    /** Standard locking script paying to {@code address}. */
    public ScriptPublicKey scriptFor(String address) {
        DecodedAddress decoded = decode(address);
        ByteArrayOutputStream script = new ByteArrayOutputStream();
        switch (decoded.version()) {
            case VERSION_PUBKEY -> {
                script.write(OP_DATA_32);
                script.writeBytes(decoded.payload());
                script.write(OP_CHECKSIG);
            }
            case VERSION_PUBKEY_ECDSA -> {
                script.write(OP_DATA_33);
                script.writeBytes(decoded.payload());
                script.write(OP_CHECKSIG_ECDSA);
            }
            default -> {
                script.write(OP_BLAKE2B);
                script.write(OP_DATA_32);
                script.writeBytes(decoded.payload());
                script.write(OP_EQUAL);
            }
        }
        return ScriptPublicKey.of(0, script.toByteArray());
    }

    public boolean isValid(String address) {
        try {
            decode(address);
            return true;
        } catch (WalletServiceException e) {
            return false;
        }
    }

    private static long polymod(String prefix, byte[] data) {
        long c = 1;
        for (int i = 0; i < prefix.length(); i++) {
            c = polymodStep(c, prefix.charAt(i) & 0x1f);
        }
        c = polymodStep(c, 0);
        for (byte d : data) {
            c = polymodStep(c, d);
        }
        return c ^ 1;
    }

    private static long polymodStep(long c, int d) {
        long c0 = c >>> 35;
        c = ((c & 0x07ffffffffL) << 5) ^ d;
        if ((c0 & 0x01) != 0) {
            c ^= 0x98f2bc8e61L;
        }
        if ((c0 & 0x02) != 0) {
            c ^= 0x79b76d99e2L;
        }
        if ((c0 & 0x04) != 0) {
            c ^= 0xf33e5fb3c4L;
        }
        if ((c0 & 0x08) != 0) {
            c ^= 0xae2eabe2a8L;
        }
        if ((c0 & 0x10) != 0) {
            c ^= 0x1e4f43e470L;
        }
        return c;
    }

    private static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxV = (1 << toBits) - 1;
        int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte b : in) {
            int value = b & 0xff;
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxV);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxV);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxV) != 0) {
            return null;
        }
        return out.toByteArray();
    }

    private static WalletServiceException invalid(String address, String reason) {
        return WalletServiceException.userInput("Invalid address " + address + ": " + reason);
    }
}
