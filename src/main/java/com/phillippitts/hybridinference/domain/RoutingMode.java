package com.phillippitts.hybridinference.domain;

/** How a generation request may be placed between on-device and cloud execution. */
public enum RoutingMode {
    /** Only the on-device capability is used. */
    ALWAYS_LOCAL,
    /** Only cloud providers are used. */
    ALWAYS_CLOUD,
    /** On-device first, automatic cloud fallback on low confidence, latency overrun or error. */
    HYBRID_AUTO,
    /** On-device only; handoff signals are returned to the caller for explicit escalation. */
    HYBRID_MANUAL
}
