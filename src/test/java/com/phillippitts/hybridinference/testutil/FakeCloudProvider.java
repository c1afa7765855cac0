package com.phillippitts.hybridinference.testutil;

import com.phillippitts.hybridinference.cloud.CloudProvider;
import com.phillippitts.hybridinference.domain.CloudGenerationOptions;
import com.phillippitts.hybridinference.domain.CloudGenerationResult;
import com.phillippitts.hybridinference.exception.CloudProviderException;
import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for CloudProvider.
 *
 * <p><b>Mutable fields:</b> {@code failing} and {@code available} are public so tests can
 * flip a provider between healthy and broken mid-scenario.
 */
public class FakeCloudProvider implements CloudProvider {
    private final String id;
    private final Double costUsd;
    private final double estimateUsd;
    public volatile boolean failing;
    public volatile boolean available = true;

    public final AtomicInteger calls = new AtomicInteger();
    public final AtomicInteger streamCalls = new AtomicInteger();
    public volatile CloudGenerationOptions lastOptions;

    public FakeCloudProvider(String id) {
        this(id, null, 0.0);
    }

    /**
     * @param costUsd cost reported with each result (null = unpriced)
     * @param estimateUsd pre-call estimate
     */
    public FakeCloudProvider(String id, Double costUsd, double estimateUsd) {
        this.id = id;
        this.costUsd = costUsd;
        this.estimateUsd = estimateUsd;
    }

    public static FakeCloudProvider failing(String id) {
        FakeCloudProvider fake = new FakeCloudProvider(id);
        fake.failing = true;
        return fake;
    }

    @Override
    public String providerId() {
        return id;
    }

    @Override
    public CloudGenerationResult generate(String prompt, CloudGenerationOptions options) {
        calls.incrementAndGet();
        lastOptions = options;
        if (failing) {
            throw new CloudProviderException(id, "HTTP 503 from " + id);
        }
        return new CloudGenerationResult("cloud answer from " + id, 12, 30, 120.0, id, options.model(), costUsd);
    }

    @Override
    public Flux<String> generateStream(String prompt, CloudGenerationOptions options) {
        streamCalls.incrementAndGet();
        lastOptions = options;
        return Flux.just("cloud", "stream", "from", id);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public double estimateCostUsd(String prompt, CloudGenerationOptions options) {
        return estimateUsd;
    }
}
