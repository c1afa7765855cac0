package com.phillippitts.hybridinference.event;

import com.phillippitts.hybridinference.telemetry.TelemetryPayload;
import com.phillippitts.hybridinference.telemetry.TelemetrySink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dual-destination event router.
 *
 * <p><b>Subscribers:</b> delivered on the publishing thread. Each delivery is isolated, so a
 * subscriber that throws is logged and skipped while the rest still receive the event.
 *
 * <p><b>Telemetry:</b> the event is serialized on the publishing thread (cheap) and handed to
 * {@code telemetryExecutor}. Sink failures and executor rejections are logged, never rethrown.
 *
 * <p><b>Thread Safety:</b> subscriptions live in a {@link ConcurrentHashMap}; subscribing or
 * unsubscribing during a publish is safe (the iteration is weakly consistent).
 */
@Component
public class DefaultEventRouter implements EventRouter {
    private static final Logger LOG = LogManager.getLogger(DefaultEventRouter.class);

    private final Map<String, EventSubscriber> subscribers = new ConcurrentHashMap<>();
    private final TelemetrySink telemetrySink;
    private final Executor telemetryExecutor;

    public DefaultEventRouter(TelemetrySink telemetrySink,
                              @Qualifier("telemetryExecutor") Executor telemetryExecutor) {
        this.telemetrySink = Objects.requireNonNull(telemetrySink, "telemetrySink");
        this.telemetryExecutor = Objects.requireNonNull(telemetryExecutor, "telemetryExecutor");
    }

    @Override
    public void publish(SdkEvent event) {
        if (event == null) {
            LOG.debug("Ignoring null event");
            return;
        }
        EventDestination destination = event.destination();
        if (destination.reachesSubscribers()) {
            deliverToSubscribers(event);
        }
        if (destination.reachesTelemetry()) {
            dispatchTelemetry(event);
        }
    }

    @Override
    public String subscribe(EventSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        String id = UUID.randomUUID().toString();
        subscribers.put(id, subscriber);
        LOG.debug("Subscriber registered: id={}, total={}", id, subscribers.size());
        return id;
    }

    @Override
    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return false;
        }
        boolean removed = subscribers.remove(subscriptionId) != null;
        if (removed) {
            LOG.debug("Subscriber removed: id={}, total={}", subscriptionId, subscribers.size());
        }
        return removed;
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public void reset() {
        subscribers.clear();
    }

    private void deliverToSubscribers(SdkEvent event) {
        for (Map.Entry<String, EventSubscriber> entry : subscribers.entrySet()) {
            try {
                entry.getValue().onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Subscriber {} failed on {} event: {}", entry.getKey(), event.type(), e.toString());
            }
        }
    }

    private void dispatchTelemetry(SdkEvent event) {
        final TelemetryPayload payload;
        try {
            payload = TelemetryPayload.from(event);
        } catch (RuntimeException e) {
            LOG.warn("Could not serialize {} event {} for telemetry: {}", event.type(), event.id(), e.toString());
            return;
        }
        try {
            telemetryExecutor.execute(() -> sendQuietly(payload));
        } catch (RejectedExecutionException e) {
            LOG.warn("Telemetry executor rejected {} event {}; dropped", payload.type(), payload.id());
        }
    }

    private void sendQuietly(TelemetryPayload payload) {
        try {
            telemetrySink.send(payload);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry delivery failed for {} event {}: {}", payload.type(), payload.id(), e.toString());
        }
    }
}
