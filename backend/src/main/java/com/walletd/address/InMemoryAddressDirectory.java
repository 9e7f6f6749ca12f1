package com.walletd.address;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.walletd.domain.Keychain;
import com.walletd.domain.WalletAddress;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Address set held in memory. A single lock guards the set, the version counter and both caches.
 */
@Slf4j
public class InMemoryAddressDirectory implements AddressDirectory {

    private final AddressDeriver deriver;
    private final Cache<WalletAddress, String> addressByOwner;

    private final Object lock = new Object();
    private final Map<String, WalletAddress> addresses = new HashMap<>();
    private long version;
    private int lastInternalIndex = -1;
    private Versioned<List<String>> monitoredCache = new Versioned<>(-1, List.of());
    private Versioned<Map<String, WalletAddress>> ownerMapCache = new Versioned<>(-1, Map.of());

    public InMemoryAddressDirectory(AddressDeriver deriver, long addressCacheSize) {
        this.deriver = deriver;
        this.addressByOwner = Caffeine.newBuilder().maximumSize(addressCacheSize).build();
    }

    @Override
    public void register(String address, WalletAddress owner) {
        synchronized (lock) {
            WalletAddress previous = addresses.put(address, owner);
            if (!owner.equals(previous)) {
                version++;
            }
            if (owner.keychain() == Keychain.INTERNAL) {
                lastInternalIndex = Math.max(lastInternalIndex, owner.index());
            }
        }
        addressByOwner.put(owner, address);
    }

    @Override
    public Versioned<List<String>> monitoredAddresses() {
        synchronized (lock) {
            if (monitoredCache.version() != version) {
                List<String> list = new ArrayList<>(addresses.keySet());
                Collections.sort(list);
                monitoredCache = new Versioned<>(version, List.copyOf(list));
                log.debug("Monitored address cache rebuilt at version {} ({} addresses)", version, list.size());
            }
            return monitoredCache;
        }
    }

    @Override
    public Versioned<Map<String, WalletAddress>> addressOwnerMap() {
        synchronized (lock) {
            if (ownerMapCache.version() != version) {
                ownerMapCache = new Versioned<>(version, Map.copyOf(addresses));
            }
            return ownerMapCache;
        }
    }

    @Override
    public long version() {
        synchronized (lock) {
            return version;
        }
    }

    @Override
    public String addressOf(WalletAddress owner) {
        return addressByOwner.get(owner, deriver::deriveAddress);
    }

    @Override
    public ChangeAddress changeAddress(ChangeAddressPolicy policy, List<WalletAddress> restriction) {
        WalletAddress owner;
        if (restriction != null && !restriction.isEmpty()) {
            owner = restriction.get(0);
        } else if (policy == ChangeAddressPolicy.FRESH) {
            synchronized (lock) {
                owner = WalletAddress.internal(++lastInternalIndex);
            }
        } else {
            owner = WalletAddress.internal(0);
        }
        String address = addressOf(owner);
        register(address, owner);
        return new ChangeAddress(address, owner);
    }
}
