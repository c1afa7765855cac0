package com.phillippitts.hybridinference.exception;

/**
 * Informational failure raised when on-device generation loses the race against the
 * configured latency budget. The routing engine converts it into a cloud fallback; it only
 * reaches a caller as the suppressed cause of a fallback that also failed.
 */
public class LatencyTimeoutException extends HybridInferenceException {

    private final long maxMs;
    private final long actualMs;

    public LatencyTimeoutException(long maxMs, long actualMs) {
        super("Local inference exceeded latency budget (maxMs=" + maxMs + ", actualMs=" + actualMs + ")");
        this.maxMs = maxMs;
        this.actualMs = actualMs;
    }

    public long getMaxMs() {
        return maxMs;
    }

    public long getActualMs() {
        return actualMs;
    }
}
