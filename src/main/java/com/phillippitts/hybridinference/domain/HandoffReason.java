package com.phillippitts.hybridinference.domain;

/** Why execution moved (or was asked to move) from on-device to cloud. */
public enum HandoffReason {
    NONE,
    FIRST_TOKEN_LOW_CONFIDENCE,
    ROLLING_WINDOW_DEGRADATION
}
