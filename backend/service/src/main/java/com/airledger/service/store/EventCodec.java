package com.airledger.service.store;

import com.airledger.core.bus.EventBus;
import com.airledger.core.events.AlertRaised;
import com.airledger.core.events.CollectorTickCompleted;
import com.airledger.core.events.CollectorTickStarted;
import com.airledger.core.events.ComplianceEventRaised;
import com.airledger.core.events.Event;
import com.airledger.core.events.LedgerEntryAppended;
import com.airledger.core.events.OfficerActionRecorded;
import com.airledger.core.events.ReadingQuarantined;
import com.airledger.core.events.ReadingRejected;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CollectorTickStarted", CollectorTickStarted.class,
            "CollectorTickCompleted", CollectorTickCompleted.class,
            "AlertRaised", AlertRaised.class,
            "ReadingRejected", ReadingRejected.class,
            "ReadingQuarantined", ReadingQuarantined.class,
            "ComplianceEventRaised", ComplianceEventRaised.class,
            "LedgerEntryAppended", LedgerEntryAppended.class,
            "OfficerActionRecorded", OfficerActionRecorded.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    /**
     * Routes every known event type on the bus to {@code consumer}.
     */
    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            bus.subscribe(type, consumer::accept);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
