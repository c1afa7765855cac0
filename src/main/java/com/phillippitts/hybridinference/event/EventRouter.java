package com.phillippitts.hybridinference.event;

/**
 * Routes events to live subscribers and/or the telemetry sink according to
 * {@link SdkEvent#destination()}.
 */
public interface EventRouter {

    /**
     * Routes the event. Synchronous for subscribers, fire-and-forget for telemetry.
     * Never throws.
     */
    void publish(SdkEvent event);

    /** @return opaque subscription id for {@link #unsubscribe(String)} */
    String subscribe(EventSubscriber subscriber);

    /** @return true if a subscription with this id existed */
    boolean unsubscribe(String subscriptionId);

    int subscriberCount();

    /** Drops all subscribers. Intended for test isolation. */
    void reset();
}
