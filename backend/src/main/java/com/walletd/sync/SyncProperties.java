package com.walletd.sync;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "walletd.sync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Delay between the end of one scheduled cycle and the start of the next. */
    @Positive
    private long intervalMs = 10_000;

    private long initialDelayMs = 0;

    /** Request a sync when the node reports changes on monitored addresses. */
    private boolean syncOnNotification = true;
}
