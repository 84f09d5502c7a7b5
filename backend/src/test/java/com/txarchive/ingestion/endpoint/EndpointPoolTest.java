package com.txarchive.ingestion.endpoint;

import com.txarchive.common.MutableClock;
import com.txarchive.common.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointPoolTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private RetryPolicy backoff;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        backoff = new RetryPolicy(1000L, 60_000L, 0, 1);
    }

    private EndpointPool pool(int maxConnections, Endpoint... endpoints) {
        return new EndpointPool(List.of(endpoints), maxConnections, 3, WINDOW, backoff, clock);
    }

    private static Endpoint rpc(String url) {
        return new Endpoint(url, EndpointKind.REQUEST_RESPONSE);
    }

    private static String leaseAndRelease(EndpointPool pool) {
        try (EndpointLease lease = pool.acquire(EndpointKind.REQUEST_RESPONSE)) {
            return lease.url();
        }
    }

    @Test
    void acquire_roundRobinsAcrossEqualWeights() {
        EndpointPool pool = pool(10, rpc("https://a.test"), rpc("https://b.test"), rpc("https://c.test"));

        assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
        assertThat(leaseAndRelease(pool)).isEqualTo("https://b.test");
        assertThat(leaseAndRelease(pool)).isEqualTo("https://c.test");
        assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
    }

    @Test
    void acquire_honoursWeights() {
        EndpointPool pool = pool(10,
                new Endpoint("https://heavy.test", EndpointKind.REQUEST_RESPONSE, 2),
                rpc("https://light.test"));

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picks.add(leaseAndRelease(pool));
        }

        assertThat(picks).filteredOn("https://heavy.test"::equals).hasSize(4);
        assertThat(picks).filteredOn("https://light.test"::equals).hasSize(2);
    }

    @Test
    void acquire_onlyReturnsRequestedKind() {
        EndpointPool pool = pool(10, rpc("https://a.test"), new Endpoint("wss://s.test", EndpointKind.STREAMING));

        for (int i = 0; i < 3; i++) {
            assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
        }
    }

    @Test
    @DisplayName("threshold failures inside the window open the breaker; other endpoints keep serving")
    void failures_tripEndpoint() {
        Endpoint a = rpc("https://a.test");
        Endpoint b = rpc("https://b.test");
        EndpointPool pool = pool(10, a, b);

        pool.report(a, EndpointOutcome.FAILURE);
        pool.report(a, EndpointOutcome.FAILURE);
        assertThat(a.getHealth()).isEqualTo(HealthState.HEALTHY);
        pool.report(a, EndpointOutcome.FAILURE);

        assertThat(a.getHealth()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(a.getNextEligibleAt()).isEqualTo(clock.instant().plusMillis(1000));
        for (int i = 0; i < 4; i++) {
            assertThat(leaseAndRelease(pool)).isEqualTo("https://b.test");
        }
    }

    @Test
    void failures_outsideWindow_doNotTrip() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(10, a);

        pool.report(a, EndpointOutcome.FAILURE);
        clock.advance(Duration.ofSeconds(61));
        pool.report(a, EndpointOutcome.FAILURE);
        clock.advance(Duration.ofSeconds(61));
        pool.report(a, EndpointOutcome.FAILURE);

        assertThat(a.getHealth()).isEqualTo(HealthState.HEALTHY);
        assertThat(a.getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    void success_resetsConsecutiveFailures() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(10, a);

        pool.report(a, EndpointOutcome.FAILURE);
        pool.report(a, EndpointOutcome.SUCCESS);

        assertThat(a.getConsecutiveFailures()).isZero();
    }

    @Test
    void acquire_allUnhealthy_throwsNoHealthyEndpoint() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(10, a);
        pool.reject(a);

        assertThatThrownBy(() -> pool.acquire(EndpointKind.REQUEST_RESPONSE))
                .isInstanceOf(EndpointExhaustedException.class)
                .satisfies(e -> assertThat(((EndpointExhaustedException) e).getReason())
                        .isEqualTo(EndpointExhaustedException.Reason.NO_HEALTHY_ENDPOINT));
    }

    @Test
    @DisplayName("after the backoff one probe is admitted; success closes the breaker")
    void backoffElapsed_singleProbeThenRecover() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(10, a);
        pool.reject(a);
        clock.advance(Duration.ofMillis(1000));

        EndpointLease probe = pool.acquire(EndpointKind.REQUEST_RESPONSE);
        assertThat(a.getHealth()).isEqualTo(HealthState.DEGRADED);
        assertThatThrownBy(() -> pool.acquire(EndpointKind.REQUEST_RESPONSE))
                .isInstanceOf(EndpointExhaustedException.class);

        pool.report(a, EndpointOutcome.SUCCESS);
        probe.close();

        assertThat(a.getHealth()).isEqualTo(HealthState.HEALTHY);
        assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
    }

    @Test
    void failedProbe_doublesBackoff() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(10, a);
        pool.reject(a);
        clock.advance(Duration.ofMillis(1000));

        try (EndpointLease probe = pool.acquire(EndpointKind.REQUEST_RESPONSE)) {
            pool.report(probe.endpoint(), EndpointOutcome.FAILURE);
        }

        assertThat(a.getHealth()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(a.getNextEligibleAt()).isEqualTo(clock.instant().plusMillis(2000));
    }

    @Test
    @DisplayName("connection cap is shared across request/response and streaming endpoints")
    void acquire_capReached_throwsBusy() {
        Endpoint stream = new Endpoint("wss://s.test", EndpointKind.STREAMING);
        EndpointPool pool = pool(2, rpc("https://a.test"), stream);

        EndpointLease streamLease = pool.acquire(stream);
        EndpointLease rpcLease = pool.acquire(EndpointKind.REQUEST_RESPONSE);

        assertThat(pool.leasedConnections()).isEqualTo(2);
        assertThatThrownBy(() -> pool.acquire(EndpointKind.REQUEST_RESPONSE))
                .isInstanceOf(EndpointExhaustedException.class)
                .satisfies(e -> assertThat(((EndpointExhaustedException) e).getReason())
                        .isEqualTo(EndpointExhaustedException.Reason.BUSY));

        rpcLease.close();
        assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
        streamLease.close();
        assertThat(pool.leasedConnections()).isZero();
    }

    @Test
    @DisplayName("a BUSY refusal does not advance the weighted rotation")
    void acquire_busy_leavesRotationUntouched() {
        EndpointPool capped = pool(1,
                new Endpoint("https://heavy.test", EndpointKind.REQUEST_RESPONSE, 2),
                rpc("https://light.test"));
        EndpointPool reference = pool(10,
                new Endpoint("https://heavy.test", EndpointKind.REQUEST_RESPONSE, 2),
                rpc("https://light.test"));

        EndpointLease held = capped.acquire(EndpointKind.REQUEST_RESPONSE);
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> capped.acquire(EndpointKind.REQUEST_RESPONSE))
                    .isInstanceOf(EndpointExhaustedException.class);
        }
        held.close();
        List<String> afterBusy = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            afterBusy.add(leaseAndRelease(capped));
        }

        List<String> expected = new ArrayList<>();
        leaseAndRelease(reference);
        for (int i = 0; i < 3; i++) {
            expected.add(leaseAndRelease(reference));
        }
        assertThat(afterBusy).containsExactlyElementsOf(expected)
                .containsExactly("https://light.test", "https://heavy.test", "https://heavy.test");
    }

    @Test
    void lease_closeIsIdempotent() {
        EndpointPool pool = pool(1, rpc("https://a.test"));
        EndpointLease lease = pool.acquire(EndpointKind.REQUEST_RESPONSE);

        lease.close();
        lease.close();

        assertThat(lease.isReleased()).isTrue();
        assertThat(pool.leasedConnections()).isZero();
        assertThat(leaseAndRelease(pool)).isEqualTo("https://a.test");
    }

    @Test
    void close_releasesOutstandingLeases_andRefusesNewOnes() {
        EndpointPool pool = pool(5, rpc("https://a.test"));
        EndpointLease lease = pool.acquire(EndpointKind.REQUEST_RESPONSE);

        pool.close();

        assertThat(lease.isReleased()).isTrue();
        assertThat(pool.leasedConnections()).isZero();
        assertThatThrownBy(() -> pool.acquire(EndpointKind.REQUEST_RESPONSE)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void acquire_unknownEndpoint_throws() {
        EndpointPool pool = pool(5, rpc("https://a.test"));

        assertThatThrownBy(() -> pool.acquire(rpc("https://other.test")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_emptyEndpoints_throws() {
        assertThatThrownBy(() -> new EndpointPool(List.of(), 1, 3, WINDOW, backoff, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint");
    }

    @Test
    void snapshot_reportsHealthAndInFlight() {
        Endpoint a = rpc("https://a.test");
        EndpointPool pool = pool(5, a);
        EndpointLease lease = pool.acquire(EndpointKind.REQUEST_RESPONSE);

        List<EndpointSnapshot> snapshot = pool.snapshot();

        assertThat(snapshot).hasSize(1);
        assertThat(snapshot.get(0).health()).isEqualTo(HealthState.HEALTHY);
        assertThat(snapshot.get(0).inFlight()).isEqualTo(1);
        lease.close();
    }
}
