package com.walletd.sync;

import com.walletd.address.AddressDirectory;
import com.walletd.config.AsyncConfig;
import com.walletd.domain.SyncRequestedEvent;
import com.walletd.node.UtxosChangedNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Event-driven sync triggers: explicit requests and node change notifications on monitored addresses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncTriggerListener {

    private final UtxoSyncService utxoSyncService;
    private final AddressDirectory addressDirectory;
    private final SyncProperties syncProperties;

    @Async(AsyncConfig.SYNC_EXECUTOR)
    @EventListener
    public void onSyncRequested(SyncRequestedEvent event) {
        utxoSyncService.requestSync(event.reason());
    }

    @Async(AsyncConfig.SYNC_EXECUTOR)
    @EventListener
    public void onUtxosChanged(UtxosChangedNotification notification) {
        if (!syncProperties.isSyncOnNotification()) {
            return;
        }
        Map<String, ?> owners = addressDirectory.addressOwnerMap().value();
        boolean relevant = Stream.concat(notification.added().keySet().stream(), notification.removed().keySet().stream())
                .anyMatch(owners::containsKey);
        if (relevant) {
            utxoSyncService.requestSync("utxos-changed");
        } else {
            log.debug("Ignoring change notification for addresses outside the wallet");
        }
    }
}
