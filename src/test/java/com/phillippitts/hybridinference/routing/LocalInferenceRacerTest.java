package com.phillippitts.hybridinference.routing;

import com.phillippitts.hybridinference.config.ThreadPoolConfig;
import com.phillippitts.hybridinference.config.properties.ThreadPoolProperties;
import com.phillippitts.hybridinference.domain.GenerationOptions;
import com.phillippitts.hybridinference.exception.LocalInferenceException;
import com.phillippitts.hybridinference.testutil.FakeLocalInference;
import com.phillippitts.hybridinference.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class LocalInferenceRacerTest {

    private ExecutorService pool;
    private LocalInferenceRacer racer;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        racer = new LocalInferenceRacer(pool);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(2, TimeUnit.SECONDS);
    }

    @Test
    void returnsResultWhenLocalFinishesInTime() {
        LocalInferenceRacer.RaceOutcome outcome = racer.race(new FakeLocalInference("done"), "p",
                GenerationOptions.defaults(), 1_000);

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.result().text()).isEqualTo("done");
    }

    @Test
    void timesOutAndInterruptsSlowLocal() {
        FakeLocalInference slow = new FakeLocalInference("late", null, false, 2_000);

        LocalInferenceRacer.RaceOutcome outcome = racer.race(slow, "p", GenerationOptions.defaults(), 50);

        assertThat(outcome.isTimedOut()).isTrue();
        assertThat(outcome.timeout().getMaxMs()).isEqualTo(50);
        assertThat(outcome.timeout().getActualMs()).isGreaterThanOrEqualTo(50);
        await().atMost(1, TimeUnit.SECONDS).until(() -> slow.interrupted);
    }

    @Test
    void localFailureIsReportedNotThrown() {
        LocalInferenceRacer.RaceOutcome outcome = racer.race(FakeLocalInference.failing(), "p",
                GenerationOptions.defaults(), 1_000);

        assertThat(outcome.failure()).isInstanceOf(LocalInferenceException.class)
                .hasMessageContaining("configured to fail");
    }

    @Test
    void inlineExecutorCompletesBeforeDeadline() {
        LocalInferenceRacer inline = new LocalInferenceRacer(new SyncExecutor());

        assertThat(inline.race(new FakeLocalInference("inline"), "p", GenerationOptions.defaults(), 10)
                .isCompleted()).isTrue();
    }

    @Test
    void rejectionIsReportedAsFailure() {
        LocalInferenceRacer rejecting = new LocalInferenceRacer(r -> {
            throw new RejectedExecutionException("saturated");
        });

        assertThat(rejecting.race(new FakeLocalInference("x"), "p", GenerationOptions.defaults(), 10).failure())
                .hasMessageContaining("rejected");
    }

    @Test
    void saturatedLocalPoolFailsFastInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.setLocal(new ThreadPoolProperties.PoolProperties(1, 1, 0, "race-test-"));
        ThreadPoolTaskExecutor saturated = new ThreadPoolConfig(props).localInferenceExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        saturated.execute(() -> {
            busy.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        busy.await(1, TimeUnit.SECONDS);
        FakeLocalInference slow = new FakeLocalInference("late", null, false, 500);

        try {
            long start = System.nanoTime();
            LocalInferenceRacer.RaceOutcome outcome = new LocalInferenceRacer(saturated)
                    .race(slow, "p", GenerationOptions.defaults(), 50);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(outcome.isCompleted()).isFalse();
            assertThat(outcome.failure()).hasMessageContaining("rejected");
            assertThat(slow.calls.get()).isZero();
            assertThat(elapsedMs).isLessThan(400);
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void requiresPositiveBudget() {
        assertThatThrownBy(() -> racer.race(new FakeLocalInference("x"), "p", GenerationOptions.defaults(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
