package com.phillippitts.hybridinference.event;

import com.phillippitts.hybridinference.domain.RoutingDecision;
import com.phillippitts.hybridinference.domain.RoutingPolicy;
import com.phillippitts.hybridinference.testutil.RecordingSubscriber;
import com.phillippitts.hybridinference.testutil.RecordingTelemetrySink;
import com.phillippitts.hybridinference.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

class DefaultEventRouterTest {

    private RecordingTelemetrySink sink;
    private DefaultEventRouter router;

    @BeforeEach
    void setUp() {
        sink = new RecordingTelemetrySink();
        router = new DefaultEventRouter(sink, new SyncExecutor());
    }

    @Test
    void analyticsOnlyEventsNeverReachSubscribers() {
        RecordingSubscriber subscriber = new RecordingSubscriber();
        router.subscribe(subscriber);

        router.publish(latencyEvent(EventDestination.ANALYTICS_ONLY));

        assertThat(subscriber.events).isEmpty();
        assertThat(sink.payloads).hasSize(1);
    }

    @Test
    void publicOnlyEventsNeverReachTelemetry() {
        RecordingSubscriber subscriber = new RecordingSubscriber();
        router.subscribe(subscriber);

        router.publish(latencyEvent(EventDestination.PUBLIC_ONLY));

        assertThat(subscriber.events).hasSize(1);
        assertThat(sink.payloads).isEmpty();
    }

    @Test
    void allEventsReachBoth() {
        RecordingSubscriber subscriber = new RecordingSubscriber();
        router.subscribe(subscriber);

        RoutingEvent event = RoutingEvent.of(
                RoutingDecision.cloud(RoutingPolicy.alwaysCloud(), "openai", "gpt-4o-mini"), 12.34, 0.002, "s-1");
        router.publish(event);

        assertThat(subscriber.events).containsExactly(event);
        assertThat(sink.payloads).singleElement().satisfies(p -> {
            assertThat(p.id()).isEqualTo(event.id());
            assertThat(p.type()).isEqualTo("routing.decision");
            assertThat(p.properties()).containsEntry("latency_ms", "12.3")
                    .containsEntry("execution_target", "cloud");
        });
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        RecordingSubscriber before = new RecordingSubscriber();
        RecordingSubscriber after = new RecordingSubscriber();
        router.subscribe(before);
        router.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        router.subscribe(after);

        assertThatCode(() -> router.publish(latencyEvent(EventDestination.ALL))).doesNotThrowAnyException();

        assertThat(before.events).hasSize(1);
        assertThat(after.events).hasSize(1);
    }

    @Test
    void failingSinkIsSwallowed() {
        DefaultEventRouter broken = new DefaultEventRouter(p -> {
            throw new IllegalStateException("sink down");
        }, new SyncExecutor());
        RecordingSubscriber subscriber = new RecordingSubscriber();
        broken.subscribe(subscriber);

        assertThatCode(() -> broken.publish(latencyEvent(EventDestination.ALL))).doesNotThrowAnyException();
        assertThat(subscriber.events).hasSize(1);
    }

    @Test
    void rejectedTelemetryIsDropped() {
        DefaultEventRouter rejecting = new DefaultEventRouter(sink, r -> {
            throw new RejectedExecutionException("full");
        });

        assertThatCode(() -> rejecting.publish(latencyEvent(EventDestination.ANALYTICS_ONLY)))
                .doesNotThrowAnyException();
        assertThat(sink.payloads).isEmpty();
    }

    @Test
    void telemetryIsDeliveredAsynchronously() throws InterruptedException {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            DefaultEventRouter async = new DefaultEventRouter(sink, pool);
            async.publish(latencyEvent(EventDestination.ALL));

            await().atMost(2, TimeUnit.SECONDS).until(() -> sink.payloads.size() == 1);
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void unsubscribeStopsDelivery() {
        RecordingSubscriber subscriber = new RecordingSubscriber();
        String id = router.subscribe(subscriber);

        assertThat(router.subscriberCount()).isEqualTo(1);
        assertThat(router.unsubscribe(id)).isTrue();
        assertThat(router.unsubscribe(id)).isFalse();

        router.publish(latencyEvent(EventDestination.ALL));
        assertThat(subscriber.events).isEmpty();
    }

    @Test
    void subscriberMayUnsubscribeWhilePublishing() {
        RecordingSubscriber other = new RecordingSubscriber();
        String[] selfId = new String[1];
        selfId[0] = router.subscribe(e -> router.unsubscribe(selfId[0]));
        router.subscribe(other);

        router.publish(latencyEvent(EventDestination.ALL));
        router.publish(latencyEvent(EventDestination.ALL));

        assertThat(other.events).hasSize(2);
        assertThat(router.subscriberCount()).isEqualTo(1);
    }

    @Test
    void resetDropsAllSubscribers() {
        router.subscribe(new RecordingSubscriber());
        router.subscribe(new RecordingSubscriber());

        router.reset();

        assertThat(router.subscriberCount()).isZero();
    }

    private static LatencyTimeoutEvent latencyEvent(EventDestination destination) {
        return new LatencyTimeoutEvent(null, Instant.now(), null, destination, 50, 51.27);
    }
}
