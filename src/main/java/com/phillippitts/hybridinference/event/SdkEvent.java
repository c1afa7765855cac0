package com.phillippitts.hybridinference.event;

import java.time.Instant;
import java.util.Map;

/**
 * Contract shared by every event the routing core emits. Events are values: created once, never mutated.
 *
 * <p>The set of kinds is closed; the router dispatches on {@link #destination()} only, so adding
 * a kind never needs a new subscriber list.
 */
public sealed interface SdkEvent
        permits RoutingEvent, CloudCostEvent, ProviderFailoverEvent, LatencyTimeoutEvent {

    /** Unique event id. */
    String id();

    /** Stable type tag, e.g. {@code routing.decision}. */
    String type();

    EventCategory category();

    Instant timestamp();

    /** Session the event belongs to; may be {@code null}. */
    String sessionId();

    EventDestination destination();

    /** Flattened, insertion-ordered properties for serialization (snake_case keys). */
    Map<String, String> properties();
}
