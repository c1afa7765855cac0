package com.phillippitts.hybridinference.telemetry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default sink: writes each payload as one JSON line to the {@code telemetry} logger.
 * Route that logger to a file or shipper in {@code log4j2-spring.xml}.
 */
public class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger TELEMETRY = LogManager.getLogger("telemetry");

    @Override
    public void send(TelemetryPayload payload) {
        TELEMETRY.info(payload.toJson());
    }
}
