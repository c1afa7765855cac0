package com.phillippitts.hybridinference.event;

/** Which sinks an event is routed to by the {@link EventRouter}. */
public enum EventDestination {
    /** Live subscribers only; never sent to telemetry. */
    PUBLIC_ONLY,
    /** Telemetry only; never delivered to subscribers. */
    ANALYTICS_ONLY,
    /** Both sinks. */
    ALL;

    public boolean reachesSubscribers() {
        return this != ANALYTICS_ONLY;
    }

    public boolean reachesTelemetry() {
        return this != PUBLIC_ONLY;
    }
}
