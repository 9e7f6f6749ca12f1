package com.walletd.domain;

/**
 * Published to force a sync cycle outside the regular interval (e.g. after a broadcast).
 */
public record SyncRequestedEvent(String reason) {
}
