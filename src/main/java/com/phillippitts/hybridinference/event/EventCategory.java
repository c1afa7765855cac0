package com.phillippitts.hybridinference.event;

import java.util.Locale;

/** Coarse grouping of events for telemetry dashboards. */
public enum EventCategory {
    SDK,
    LLM,
    NETWORK,
    PERFORMANCE,
    ERROR;

    /** Lower-case wire name used in telemetry payloads. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
