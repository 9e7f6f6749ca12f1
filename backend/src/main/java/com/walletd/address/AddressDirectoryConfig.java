package com.walletd.address;

import com.walletd.domain.WalletAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Configuration
@EnableConfigurationProperties(AddressProperties.class)
public class AddressDirectoryConfig {

    @Bean
    public AddressDeriver addressDeriver(AddressProperties properties) {
        Map<WalletAddress, String> table = new HashMap<>();
        for (AddressProperties.Entry e : properties.getEntries()) {
            table.put(owner(e), e.getAddress());
        }
        return new PrecomputedAddressDeriver(table, properties.isMultisig());
    }

    @Bean
    public AddressDirectory addressDirectory(AddressDeriver addressDeriver, AddressProperties properties) {
        InMemoryAddressDirectory directory = new InMemoryAddressDirectory(addressDeriver, properties.getCacheSize());
        int monitored = 0;
        for (AddressProperties.Entry e : properties.getEntries()) {
            if (e.isMonitored()) {
                directory.register(e.getAddress(), owner(e));
                monitored++;
            }
        }
        log.info("Address directory initialized with {} monitored addresses", monitored);
        return directory;
    }

    private static WalletAddress owner(AddressProperties.Entry e) {
        return new WalletAddress(e.getIndex(), e.getCosignerIndex(), e.getKeychain());
    }
}
