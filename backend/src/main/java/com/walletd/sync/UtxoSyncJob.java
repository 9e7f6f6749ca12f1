package com.walletd.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Interval trigger for the UTXO sync.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UtxoSyncJob {

    private final UtxoSyncService utxoSyncService;

    @Scheduled(fixedDelayString = "${walletd.sync.interval-ms:10000}", initialDelayString = "${walletd.sync.initial-delay-ms:0}")
    public void run() {
        utxoSyncService.requestSync("interval");
    }
}
