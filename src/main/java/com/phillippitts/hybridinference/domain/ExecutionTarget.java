package com.phillippitts.hybridinference.domain;

/** Where a request actually executed. */
public enum ExecutionTarget {
    ON_DEVICE,
    CLOUD,
    HYBRID_FALLBACK
}
