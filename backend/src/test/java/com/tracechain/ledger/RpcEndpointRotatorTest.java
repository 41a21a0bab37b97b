package com.tracechain.ledger;

import com.tracechain.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    private static final RetryPolicy FAST = new RetryPolicy(1L, 1L, 0, 3);

    @Test
    void getNextEndpoint_roundRobins() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://a.com", "https://b.com", "https://c.com"),
                RetryPolicy.defaultPolicy());
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://c.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://a.com");
    }

    @Test
    void getNextEndpoint_singleEndpoint_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://only.com"), null);
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.getNextEndpoint()).isEqualTo("https://only.com"));
    }

    @Test
    void getNextEndpoint_skipsEndpointInCooldown() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), FAST, 60_000L);
        rotator.markUnhealthy("https://a.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
        assertThat(rotator.getNextEndpoint()).isEqualTo("https://b.com");
    }

    @Test
    void constructor_emptyEndpoints_throwsConfigurationError() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of(), null))
                .isInstanceOf(LedgerConfigurationException.class)
                .hasMessageContaining("At least one");
        assertThatThrownBy(() -> new RpcEndpointRotator(null, null))
                .isInstanceOf(LedgerConfigurationException.class);
    }

    @Test
    void callWithRetry_retriesConnectivityFailuresOnNextEndpoint() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), FAST);
        List<String> seen = new ArrayList<>();
        String result = rotator.callWithRetry("test", endpoint -> {
            seen.add(endpoint);
            if (endpoint.equals("https://a.com")) {
                throw new LedgerConnectivityException("down");
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(seen).containsExactly("https://a.com", "https://b.com");
    }

    @Test
    void callWithRetry_rejectionIsNotRetried() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com"), FAST);
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> rotator.callWithRetry("test", endpoint -> {
            calls.incrementAndGet();
            throw new LedgerRejectionException("reverted");
        })).isInstanceOf(LedgerRejectionException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void callWithRetry_exhausted_throwsLastConnectivityError() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com"), FAST);
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> rotator.callWithRetry("test", endpoint -> {
            throw new LedgerConnectivityException("down " + calls.incrementAndGet());
        })).isInstanceOf(LedgerConnectivityException.class).hasMessage("down 3");
    }

    @Test
    void callOnce_doesNotRetry() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), FAST);
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> rotator.callOnce("submit", endpoint -> {
            calls.incrementAndGet();
            throw new LedgerConnectivityException("down");
        })).isInstanceOf(LedgerConnectivityException.class);
        assertThat(calls).hasValue(1);
    }
}
