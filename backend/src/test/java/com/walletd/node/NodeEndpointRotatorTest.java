package com.walletd.node;

import com.walletd.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeEndpointRotatorTest {

    private final AtomicLong now = new AtomicLong(1_000);

    @Test
    void nextEndpoint_roundRobinsAcrossEndpoints() {
        NodeEndpointRotator rotator = rotator(List.of("a", "b", "c"));
        assertThat(List.of(rotator.nextEndpoint(), rotator.nextEndpoint(), rotator.nextEndpoint(), rotator.nextEndpoint()))
                .containsExactly("a", "b", "c", "a");
    }

    @Test
    void markFailed_skipsEndpointUntilCooldownExpires() {
        NodeEndpointRotator rotator = rotator(List.of("a", "b"));
        rotator.markFailed("a", "timeout");

        assertThat(rotator.nextEndpoint()).isEqualTo("b");
        assertThat(rotator.nextEndpoint()).isEqualTo("b");

        now.addAndGet(60_000);
        assertThat(List.of(rotator.nextEndpoint(), rotator.nextEndpoint())).contains("a");
    }

    @Test
    void markFailed_allCoolingDown_stillReturnsAnEndpoint() {
        NodeEndpointRotator rotator = rotator(List.of("a", "b"));
        rotator.markFailed("a", "x");
        rotator.markFailed("b", "y");
        assertThat(rotator.nextEndpoint()).isIn("a", "b");
    }

    @Test
    void markFailed_singleEndpoint_neverCoolsDown() {
        NodeEndpointRotator rotator = rotator(List.of("only"));
        rotator.markFailed("only", "x");
        assertThat(rotator.nextEndpoint()).isEqualTo("only");
    }

    @Test
    void constructor_noEndpoints_throws() {
        assertThatThrownBy(() -> rotator(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private NodeEndpointRotator rotator(List<String> endpoints) {
        return new NodeEndpointRotator(endpoints, RetryPolicy.defaultPolicy(), 30_000, now::get);
    }
}
