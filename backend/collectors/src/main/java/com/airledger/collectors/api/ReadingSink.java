package com.airledger.collectors.api;

import com.airledger.core.model.Reading;

/**
 * Receives accepted readings pushed from the polling context, e.g. the streaming window context.
 */
public interface ReadingSink {
    ReadingSink NONE = reading -> {
    };

    void push(Reading reading);

    default void stationOffline(String stationId) {
    }
}
