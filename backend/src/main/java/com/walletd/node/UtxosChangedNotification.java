package com.walletd.node;

import java.util.List;
import java.util.Map;

/**
 * Node push notification: outpoints added and removed, keyed by address. Published as an application event by
 * whatever subscribes to the node.
 */
public record UtxosChangedNotification(Map<String, List<String>> added, Map<String, List<String>> removed) {

    public UtxosChangedNotification {
        added = added == null ? Map.of() : Map.copyOf(added);
        removed = removed == null ? Map.of() : Map.copyOf(removed);
    }
}
