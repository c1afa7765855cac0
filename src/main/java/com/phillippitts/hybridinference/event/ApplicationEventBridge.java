package com.phillippitts.hybridinference.event;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Forwards every public event to Spring's {@link ApplicationEventPublisher} so that
 * {@code @EventListener} beans observe routing events like any other application event.
 */
@Component
public class ApplicationEventBridge implements EventSubscriber {
    private static final Logger LOG = LogManager.getLogger(ApplicationEventBridge.class);

    private final EventRouter router;
    private final ApplicationEventPublisher publisher;
    private volatile String subscriptionId;

    public ApplicationEventBridge(EventRouter router, ApplicationEventPublisher publisher) {
        this.router = Objects.requireNonNull(router, "router");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @PostConstruct
    public void register() {
        subscriptionId = router.subscribe(this);
        LOG.info("Application event bridge subscribed (id={})", subscriptionId);
    }

    @PreDestroy
    public void unregister() {
        router.unsubscribe(subscriptionId);
    }

    @Override
    public void onEvent(SdkEvent event) {
        publisher.publishEvent(event);
    }
}
