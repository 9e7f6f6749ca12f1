package com.walletd.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletd.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the node client: transport, endpoint rotation and local rate limiting.
 */
@Configuration
@EnableConfigurationProperties(NodeProperties.class)
public class NodeClientConfig {

    @Bean
    public NodeEndpointRotator nodeEndpointRotator(NodeProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryMaxDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getRetryMaxAttempts());
        return new NodeEndpointRotator(properties.getUrls(), retryPolicy, properties.getEndpointCooldownMs());
    }

    @Bean
    public NodeRpcTransport nodeRpcTransport(WebClient.Builder webClientBuilder, NodeProperties properties) {
        return new WebClientNodeRpcTransport(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean(name = "nodeRpcRateLimiter")
    public RateLimiter nodeRpcRateLimiter(NodeProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("node-rpc", config);
    }

    @Bean
    public NodeClient nodeClient(NodeRpcTransport nodeRpcTransport, NodeEndpointRotator nodeEndpointRotator,
                                 @Qualifier("nodeRpcRateLimiter") RateLimiter nodeRpcRateLimiter,
                                 ObjectMapper objectMapper) {
        return new JsonRpcNodeClient(nodeRpcTransport, nodeEndpointRotator, nodeRpcRateLimiter, objectMapper);
    }
}
