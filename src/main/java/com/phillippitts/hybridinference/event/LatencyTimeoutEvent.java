package com.phillippitts.hybridinference.event;

import java.time.Instant;
import java.util.Map;

/** Published when on-device generation loses the race against {@code maxLocalLatencyMs}. */
public record LatencyTimeoutEvent(String id,
                                  Instant timestamp,
                                  String sessionId,
                                  EventDestination destination,
                                  long maxLatencyMs,
                                  double actualLatencyMs) implements SdkEvent {

    public static final String TYPE = "routing.latency_timeout";

    public LatencyTimeoutEvent {
        id = id == null ? EventIds.next() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        destination = destination == null ? EventDestination.ALL : destination;
    }

    public static LatencyTimeoutEvent of(long maxLatencyMs, double actualLatencyMs, String sessionId) {
        return new LatencyTimeoutEvent(null, null, sessionId, EventDestination.ALL, maxLatencyMs, actualLatencyMs);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public EventCategory category() {
        return EventCategory.PERFORMANCE;
    }

    @Override
    public Map<String, String> properties() {
        return new EventProperties()
                .put("max_latency_ms", maxLatencyMs)
                .putMillis("actual_latency_ms", actualLatencyMs)
                .build();
    }
}
