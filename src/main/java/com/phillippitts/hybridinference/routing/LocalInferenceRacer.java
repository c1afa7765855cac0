package com.phillippitts.hybridinference.routing;

import com.phillippitts.hybridinference.domain.GenerationOptions;
import com.phillippitts.hybridinference.domain.LlmGenerationResult;
import com.phillippitts.hybridinference.exception.LatencyTimeoutException;
import com.phillippitts.hybridinference.exception.LocalInferenceException;
import com.phillippitts.hybridinference.local.LocalInferenceService;
import com.phillippitts.hybridinference.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Races on-device generation against a latency budget.
 *
 * <p>The local call runs as a {@link FutureTask} on {@code localInferenceExecutor}; the routing thread
 * blocks on a timed {@code get}. When the timer wins the task is cancelled with interruption, so a
 * capability that honors interrupts stops early. Late results are discarded.
 */
@Component
public class LocalInferenceRacer {
    private static final Logger LOG = LogManager.getLogger(LocalInferenceRacer.class);

    private final Executor executor;

    public LocalInferenceRacer(@Qualifier("localInferenceExecutor") Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs {@code local.generate} with a deadline.
     *
     * @param maxLatencyMs budget in milliseconds (must be positive)
     * @return the outcome: a result, a timeout, or a local failure
     * @throws LocalInferenceException if the calling thread is interrupted while waiting; the local
     *         task is cancelled and the interrupt flag restored
     */
    public RaceOutcome race(LocalInferenceService local, String prompt, GenerationOptions options,
                            long maxLatencyMs) {
        if (maxLatencyMs <= 0) {
            throw new IllegalArgumentException("maxLatencyMs must be positive: " + maxLatencyMs);
        }
        FutureTask<LlmGenerationResult> task = new FutureTask<>(() -> local.generate(prompt, options));
        long start = System.nanoTime();
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            return RaceOutcome.failed(new LocalInferenceException("Local inference executor rejected task", e));
        }

        try {
            LlmGenerationResult result = task.get(maxLatencyMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return RaceOutcome.failed(new LocalInferenceException("Local inference returned no result"));
            }
            return RaceOutcome.completed(result);
        } catch (TimeoutException te) {
            task.cancel(true);
            long elapsed = TimeUtils.elapsedMillis(start);
            LOG.debug("Local inference exceeded {}ms budget (waited {}ms); cancelled", maxLatencyMs, elapsed);
            return RaceOutcome.timedOut(new LatencyTimeoutException(maxLatencyMs, elapsed));
        } catch (InterruptedException ie) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new LocalInferenceException("Interrupted while waiting for local inference", ie);
        } catch (ExecutionException ee) {
            return RaceOutcome.failed(asLocalFailure(ee.getCause()));
        }
    }

    private static LocalInferenceException asLocalFailure(Throwable cause) {
        if (cause instanceof LocalInferenceException lie) {
            return lie;
        }
        return new LocalInferenceException("Local inference failed: " + cause, cause);
    }

    /**
     * Result of a race. Exactly one of {@code result}, {@code timeout} and {@code failure} is non-null.
     */
    public record RaceOutcome(LlmGenerationResult result,
                              LatencyTimeoutException timeout,
                              LocalInferenceException failure) {

        static RaceOutcome completed(LlmGenerationResult result) {
            return new RaceOutcome(Objects.requireNonNull(result, "result"), null, null);
        }

        static RaceOutcome timedOut(LatencyTimeoutException timeout) {
            return new RaceOutcome(null, timeout, null);
        }

        static RaceOutcome failed(LocalInferenceException failure) {
            return new RaceOutcome(null, null, failure);
        }

        public boolean isCompleted() {
            return result != null;
        }

        public boolean isTimedOut() {
            return timeout != null;
        }
    }
}
