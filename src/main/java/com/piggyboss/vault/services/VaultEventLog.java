package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.VaultEvent;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail of vault events. Each event is also written to the structured log.
 */
public class VaultEventLog {

    private final List<VaultEvent> events = new CopyOnWriteArrayList<>();

    public VaultEvent append(VaultEvent.Type type, long timestamp, String user, Long depositId,
                             BigInteger amount, String detail) {
        VaultEvent event = new VaultEvent(events.size() + 1L, type, timestamp, user, depositId, amount, detail);
        events.add(event);
        LoggingService.info("vault_event", LoggingService.data(
                "type", type.name(),
                "sequence", event.getSequence(),
                "user", user,
                "depositId", depositId,
                "amount", amount,
                "detail", detail));
        return event;
    }

    /** Events appended after {@code sequence}, oldest first. */
    public List<VaultEvent> after(long sequence) {
        List<VaultEvent> result = new ArrayList<>();
        for (VaultEvent event : events) {
            if (event.getSequence() > sequence) {
                result.add(event);
            }
        }
        return result;
    }

    public long lastSequence() {
        return events.size();
    }

    /** Replace the trail with stored events, ordered by sequence from 1. */
    void reset(List<VaultEvent> stored) {
        List<VaultEvent> ordered = new ArrayList<>(stored);
        ordered.sort(Comparator.comparingLong(VaultEvent::getSequence));
        events.clear();
        events.addAll(ordered);
    }

    public List<VaultEvent> all() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public List<VaultEvent> forDeposit(long depositId) {
        List<VaultEvent> result = new ArrayList<>();
        for (VaultEvent event : events) {
            if (event.getDepositId() != null && event.getDepositId() == depositId) {
                result.add(event);
            }
        }
        return result;
    }
}
