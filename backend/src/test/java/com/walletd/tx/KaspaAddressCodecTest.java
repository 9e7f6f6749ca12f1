package com.walletd.tx;

import com.walletd.common.WalletServiceException;
import com.walletd.domain.ScriptPublicKey;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KaspaAddressCodecTest {

    private final KaspaAddressCodec codec = new KaspaAddressCodec("kaspatest");

    @Test
    void encode_thenDecode_returnsVersionAndPayload() {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) 0x5a);

        String address = codec.encode(KaspaAddressCodec.VERSION_PUBKEY, key);
        KaspaAddressCodec.DecodedAddress decoded = codec.decode(address);

        assertThat(address).startsWith("kaspatest:q");
        assertThat(decoded.version()).isEqualTo(KaspaAddressCodec.VERSION_PUBKEY);
        assertThat(decoded.payload()).isEqualTo(key);
    }

    @Test
    void decode_corruptedCharacter_failsChecksum() {
        String address = codec.encode(KaspaAddressCodec.VERSION_PUBKEY, new byte[32]);
        int last = address.length() - 1;
        char replacement = address.charAt(last) == 'q' ? 'p' : 'q';
        String corrupted = address.substring(0, last) + replacement;

        assertThatThrownBy(() -> codec.decode(corrupted))
                .isInstanceOf(WalletServiceException.class)
                .hasMessageContaining("checksum")
                .extracting("errorCode").isEqualTo(WalletServiceException.ErrorCode.USER_INPUT);
    }

    @Test
    void decode_otherNetworkPrefix_isRejected() {
        String mainnet = new KaspaAddressCodec("kaspa").encode(KaspaAddressCodec.VERSION_PUBKEY, new byte[32]);
        assertThat(codec.isValid(mainnet)).isFalse();
    }

    @Test
    void decode_upperCase_isRejected() {
        String address = codec.encode(KaspaAddressCodec.VERSION_PUBKEY, new byte[32]);
        assertThat(codec.isValid(address.toUpperCase())).isFalse();
        assertThat(codec.isValid(address)).isTrue();
    }

    @Test
    void decode_wrongPayloadLength_isRejected() {
        String shortKey = codec.encode(KaspaAddressCodec.VERSION_PUBKEY, new byte[20]);
        assertThatThrownBy(() -> codec.decode(shortKey)).hasMessageContaining("payload length 20");
    }

    @Test
    void scriptFor_schnorrAddress_isPayToPubKey() {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) 0x11);

        ScriptPublicKey script = codec.scriptFor(codec.encode(KaspaAddressCodec.VERSION_PUBKEY, key));

        assertThat(script.version()).isZero();
        assertThat(script.scriptHex()).isEqualTo("20" + "11".repeat(32) + "ac");
    }

    @Test
    void scriptFor_scriptHashAddress_isPayToScriptHash() {
        ScriptPublicKey script = codec.scriptFor(codec.encode(KaspaAddressCodec.VERSION_SCRIPT_HASH, new byte[32]));
        assertThat(script.scriptHex()).startsWith("aa20").endsWith("87").hasSize(70);
    }

    @Test
    void scriptFor_ecdsaAddress_usesEcdsaCheckSig() {
        ScriptPublicKey script = codec.scriptFor(codec.encode(KaspaAddressCodec.VERSION_PUBKEY_ECDSA, new byte[33]));
        assertThat(script.scriptLength()).isEqualTo(35);
        assertThat(script.scriptHex()).startsWith("21").endsWith("ab");
    }
}
