package com.phillippitts.hybridinference.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Small builder for the flattened string properties carried by events. Null values are skipped. */
final class EventProperties {

    private final Map<String, String> values = new LinkedHashMap<>();

    EventProperties put(String key, Object value) {
        if (value != null) {
            values.put(key, String.valueOf(value));
        }
        return this;
    }

    EventProperties putMillis(String key, double millis) {
        values.put(key, String.format(Locale.ROOT, "%.1f", millis));
        return this;
    }

    EventProperties putUsd(String key, Double usd) {
        if (usd != null) {
            values.put(key, String.format(Locale.ROOT, "%.6f", usd));
        }
        return this;
    }

    EventProperties putEnum(String key, Enum<?> value) {
        if (value != null) {
            values.put(key, value.name().toLowerCase(Locale.ROOT));
        }
        return this;
    }

    Map<String, String> build() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
