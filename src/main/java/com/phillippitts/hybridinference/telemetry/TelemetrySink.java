package com.phillippitts.hybridinference.telemetry;

/**
 * Destination for analytics events. Implementations deliver best-effort to a remote collector;
 * anything they throw is caught and logged by the router, never surfaced to publishers.
 */
@FunctionalInterface
public interface TelemetrySink {

    void send(TelemetryPayload payload);
}
