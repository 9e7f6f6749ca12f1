package com.walletd.node;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Node endpoints, retry and request budget.
 */
@ConfigurationProperties(prefix = "walletd.node")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class NodeProperties {

    /** JSON-RPC endpoints, used round-robin. */
    @NotEmpty
    private List<String> urls = new ArrayList<>(List.of("http://127.0.0.1:18110"));

    /** Per-request timeout. */
    @Positive
    private long requestTimeoutMs = 10_000;

    private long retryBaseDelayMs = 250;

    private long retryMaxDelayMs = 5_000;

    private double retryJitterFactor = 0.2;

    @Positive
    private int retryMaxAttempts = 3;

    /** Time to skip an endpoint after a failed call. */
    private long endpointCooldownMs = 30_000;

    /** Local request budget (requests per second). */
    @Positive
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a local permit before failing. */
    private long localLimiterTimeoutMs = 2_000;
}
