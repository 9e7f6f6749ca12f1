package com.walletd;

import com.walletd.domain.SyncRequestedEvent;
import com.walletd.domain.UtxoEntry;
import com.walletd.node.NodeClient;
import com.walletd.node.NodeUtxoEntry;
import com.walletd.service.WalletBalance;
import com.walletd.service.WalletQueryService;
import com.walletd.sync.UtxoSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static com.walletd.Fixtures.KAS;
import static com.walletd.Fixtures.P2PK;
import static com.walletd.Fixtures.outpoint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Full context with the node replaced by a mock: sync publishes a snapshot that queries then read.
 */
@SpringBootTest(properties = {
        "walletd.sync.initial-delay-ms=600000",
        "walletd.wallet.address-prefix=kaspatest",
        "walletd.address.entries[0].address=" + WalletSyncIntegrationTest.ADDRESS,
        "walletd.address.entries[0].keychain=EXTERNAL",
        "walletd.address.entries[0].index=0"
})
class WalletSyncIntegrationTest {

    static final String ADDRESS = "kaspatest:receive0";

    @MockBean
    NodeClient nodeClient;

    @Autowired
    UtxoSyncService utxoSyncService;
    @Autowired
    WalletQueryService walletQueryService;
    @Autowired
    ApplicationEventPublisher eventPublisher;

    @Test
    @DisplayName("a sync cycle makes the node's UTXOs visible in the balance")
    void requestSync_thenBalanceReflectsNodeUtxos() {
        when(nodeClient.getMempoolEntriesByAddresses(anyList())).thenReturn(List.of());
        when(nodeClient.getUtxosByAddresses(anyList())).thenReturn(List.of(
                new NodeUtxoEntry(ADDRESS, outpoint(1, 0), new UtxoEntry(5 * KAS, P2PK, 100, false))));
        when(nodeClient.getVirtualDaaScore()).thenReturn(10_000L);

        utxoSyncService.requestSync("test");
        WalletBalance balance = walletQueryService.getBalance(true);

        assertThat(utxoSyncService.isSynced()).isTrue();
        assertThat(balance.available()).isEqualTo(5 * KAS);
        assertThat(balance.perAddress()).singleElement()
                .satisfies(a -> assertThat(a.address()).isEqualTo(ADDRESS));
    }

    @Test
    @DisplayName("a sync request event triggers a cycle on the sync executor")
    void syncRequestedEvent_runsCycleAsynchronously() {
        when(nodeClient.getMempoolEntriesByAddresses(anyList())).thenReturn(List.of());
        when(nodeClient.getUtxosByAddresses(anyList())).thenReturn(List.of());

        eventPublisher.publishEvent(new SyncRequestedEvent("test"));

        verify(nodeClient, timeout(5_000).atLeastOnce()).getUtxosByAddresses(List.of(ADDRESS));
    }
}
