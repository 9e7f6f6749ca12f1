package com.walletd.node;

import com.walletd.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Round-robin over node endpoints. An endpoint that failed is skipped for a cool-down period unless every
 * endpoint is cooling down.
 */
@Slf4j
public class NodeEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger();
    private final RetryPolicy retryPolicy;
    private final long cooldownMs;
    private final LongSupplier clock;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public NodeEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, long cooldownMs) {
        this(endpoints, retryPolicy, cooldownMs, System::currentTimeMillis);
    }

    NodeEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, long cooldownMs, LongSupplier clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one node endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.cooldownMs = cooldownMs;
        this.clock = clock;
    }

    public String nextEndpoint() {
        long now = clock.getAsLong();
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = roundRobin();
            Long until = cooldownUntilMs.get(endpoint);
            if (until == null || until <= now) {
                return endpoint;
            }
        }
        return roundRobin();
    }

    public void markFailed(String endpoint, String reason) {
        if (endpoints.size() == 1) {
            return;
        }
        long now = clock.getAsLong();
        Long previous = cooldownUntilMs.put(endpoint, now + cooldownMs);
        if (previous == null || previous <= now) {
            log.warn("Node endpoint {} cooled down for {} ms: {}", endpoint, cooldownMs, reason);
        }
    }

    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    private String roundRobin() {
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }
}
