package com.phillippitts.hybridinference.event;

import java.util.UUID;

final class EventIds {

    private EventIds() {
    }

    static String next() {
        return UUID.randomUUID().toString();
    }
}
