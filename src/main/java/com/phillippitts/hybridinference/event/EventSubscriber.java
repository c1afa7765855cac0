package com.phillippitts.hybridinference.event;

/** Receives live, typed events routed to public subscribers. */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(SdkEvent event);
}
