package com.airledger.collectors.compliance;

import com.airledger.collectors.api.ComplianceEventStore;
import com.airledger.core.bus.EventBus;
import com.airledger.core.events.LedgerEntryAppended;
import com.airledger.core.events.OfficerActionRecorded;
import com.airledger.core.ledger.LedgerEventTypes;
import com.airledger.core.ledger.LedgerWriter;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.LedgerEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Records officer decisions on compliance events. The status change and the ledger entry are written
 * together; the ledger entry goes first so a failed ledger write leaves the event untouched.
 */
public final class OfficerReviewService {
    private static final Logger LOGGER = Logger.getLogger(OfficerReviewService.class.getName());

    private final ComplianceEventStore eventStore;
    private final LedgerWriter ledgerWriter;
    private final EventBus eventBus;
    private final Clock clock;

    public OfficerReviewService(ComplianceEventStore eventStore, LedgerWriter ledgerWriter, EventBus eventBus, Clock clock) {
        this.eventStore = eventStore;
        this.ledgerWriter = ledgerWriter;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if no compliance event has the given id, or the officer is blank
     */
    public ComplianceRecord act(String complianceEventId, OfficerAction action, String officerId, String reason, String notes) {
        if (officerId == null || officerId.isBlank()) {
            throw new IllegalArgumentException("officer id is required");
        }
        ComplianceRecord current = eventStore.find(complianceEventId)
                .orElseThrow(() -> new IllegalArgumentException("Compliance event '" + complianceEventId + "' not found"));

        Instant now = clock.instant();
        String actionId = UUID.randomUUID().toString();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action_id", actionId);
        data.put("compliance_event_id", complianceEventId);
        data.put("action_type", action.name());
        data.put("officer_id", officerId);
        data.put("previous_status", current.status().name());
        data.put("new_status", action.resultingStatus().name());
        if (reason != null) {
            data.put("reason", reason);
        }
        if (notes != null) {
            data.put("notes", notes);
        }

        LedgerEntry entry = ledgerWriter.append(LedgerEventTypes.OFFICER_ACTION, actionId, data);
        ComplianceRecord updated = eventStore.updateStatus(complianceEventId, action.resultingStatus());
        LOGGER.info("Officer action " + action + " by " + officerId + " on " + complianceEventId
                + ": " + current.status() + " -> " + updated.status());

        eventBus.publish(new OfficerActionRecorded(now, complianceEventId, action.name(), officerId, updated.status().name()));
        eventBus.publish(new LedgerEntryAppended(now, entry.sequenceNumber(), entry.eventType(), entry.eventId(), entry.entryHash()));
        return updated;
    }
}
