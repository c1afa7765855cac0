package com.phillippitts.hybridinference.telemetry;

import com.phillippitts.hybridinference.event.SdkEvent;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serialized form of an {@link SdkEvent} handed to a {@link TelemetrySink}.
 * Only flattened string properties cross this boundary, never the live event. Properties keep
 * the event's insertion order.
 */
public record TelemetryPayload(String id,
                               String type,
                               String category,
                               Instant timestamp,
                               String sessionId,
                               String destination,
                               Map<String, String> properties) {

    public TelemetryPayload {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static TelemetryPayload from(SdkEvent event) {
        return new TelemetryPayload(
                event.id(),
                event.type(),
                event.category().wireName(),
                event.timestamp(),
                event.sessionId(),
                event.destination().name(),
                event.properties());
    }

    /**
     * Renders the payload as a single-line JSON object:
     * {@code {"id":..,"type":..,"category":..,"timestamp":<epoch ms>,"session_id":..,"destination":..,"properties":{..}}}.
     *
     * <p>{@link JSONObject} does not preserve key order, so consumers must read the JSON by key.
     * Use {@link #properties()} when order matters.
     */
    public String toJson() {
        JSONObject json = new JSONObject();
        json.put("id", id);
        json.put("type", type);
        json.put("category", category);
        json.put("timestamp", timestamp == null ? 0L : timestamp.toEpochMilli());
        if (sessionId != null) {
            json.put("session_id", sessionId);
        }
        json.put("destination", destination);
        json.put("properties", new JSONObject(properties));
        return json.toString();
    }
}
