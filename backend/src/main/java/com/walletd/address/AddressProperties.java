package com.walletd.address;

import com.walletd.domain.Keychain;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Addresses known to the wallet at startup.
 */
@ConfigurationProperties(prefix = "walletd.address")
@NoArgsConstructor
@Getter
@Setter
public class AddressProperties {

    /** Multisig wallets use m/cosigner/keychain/index paths. */
    private boolean multisig = false;

    /** Maximum entries kept in the owner to address cache. */
    private long cacheSize = 10_000;

    /** Precomputed derivations. Entries with {@code monitored=false} are only used as change destinations. */
    private List<Entry> entries = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Entry {
        private String address;
        private Keychain keychain = Keychain.EXTERNAL;
        private int index;
        private int cosignerIndex;
        private boolean monitored = true;
    }
}
