package com.walletd.sync;

import com.walletd.address.InMemoryAddressDirectory;
import com.walletd.address.PrecomputedAddressDeriver;
import com.walletd.domain.SyncRequestedEvent;
import com.walletd.domain.WalletAddress;
import com.walletd.node.UtxosChangedNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.walletd.Fixtures.address;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SyncTriggerListenerTest {

    @Mock
    private UtxoSyncService utxoSyncService;

    private SyncProperties properties;
    private SyncTriggerListener listener;

    @BeforeEach
    void setUp() {
        InMemoryAddressDirectory directory = new InMemoryAddressDirectory(new PrecomputedAddressDeriver(Map.of(), false), 10);
        directory.register(address(1), WalletAddress.external(0));
        properties = new SyncProperties();
        listener = new SyncTriggerListener(utxoSyncService, directory, properties);
    }

    @Test
    void onSyncRequested_runsSyncWithEventReason() {
        listener.onSyncRequested(new SyncRequestedEvent("broadcast"));
        verify(utxoSyncService).requestSync("broadcast");
    }

    @Test
    void onUtxosChanged_monitoredAddress_requestsSync() {
        listener.onUtxosChanged(new UtxosChangedNotification(Map.of(), Map.of(address(1), List.of("x:0"))));
        verify(utxoSyncService).requestSync("utxos-changed");
    }

    @Test
    void onUtxosChanged_foreignAddress_isIgnored() {
        listener.onUtxosChanged(new UtxosChangedNotification(Map.of(address(5), List.of("x:0")), Map.of()));
        verify(utxoSyncService, never()).requestSync(anyString());
    }

    @Test
    void onUtxosChanged_disabled_isIgnored() {
        properties.setSyncOnNotification(false);
        listener.onUtxosChanged(new UtxosChangedNotification(Map.of(address(1), List.of("x:0")), Map.of()));
        verify(utxoSyncService, never()).requestSync(anyString());
    }
}
