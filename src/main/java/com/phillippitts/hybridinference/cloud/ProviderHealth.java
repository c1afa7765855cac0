package com.phillippitts.hybridinference.cloud;

import java.time.Instant;

/**
 * Read-only circuit state of one failover chain entry.
 *
 * @param attemptable whether the chain would try this provider right now (closed, or open with cooldown elapsed)
 */
public record ProviderHealth(String providerId,
                             String displayName,
                             int priority,
                             int consecutiveFailures,
                             Instant lastFailureTime,
                             boolean circuitOpen,
                             boolean attemptable) { }
