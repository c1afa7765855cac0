package com.phillippitts.hybridinference.event;

import com.phillippitts.hybridinference.testutil.EventCapturingPublisher;
import com.phillippitts.hybridinference.testutil.RecordingTelemetrySink;
import com.phillippitts.hybridinference.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationEventBridgeTest {

    @Test
    void forwardsPublicEventsToSpringAndStopsAfterUnregister() {
        DefaultEventRouter router = new DefaultEventRouter(new RecordingTelemetrySink(), new SyncExecutor());
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        ApplicationEventBridge bridge = new ApplicationEventBridge(router, publisher);

        bridge.register();
        CloudCostEvent event = CloudCostEvent.of("openai", 10, 20, 0.001, 0.001, null);
        router.publish(event);

        assertThat(publisher.events).containsExactly(event);

        bridge.unregister();
        router.publish(CloudCostEvent.of("openai", 1, 1, 0.001, 0.002, null));

        assertThat(publisher.events).hasSize(1);
        assertThat(router.subscriberCount()).isZero();
    }
}
