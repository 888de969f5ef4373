package com.project.hatchmark.store;

import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local store for tests, demos and single-process deployments. Same upsert and
 * convergence rules as the persistent stores.
 */
public class InMemoryOffchainStore implements OffchainStore, CursorStore {

    private final Map<String, RegistrationRecord> registrations = new ConcurrentHashMap<>();
    private final Map<String, DisputeRecord> disputes = new ConcurrentHashMap<>();
    private final Map<String, ResolutionRecord> resolutions = new ConcurrentHashMap<>();
    private final Map<EventType, EventCursor> cursors = new EnumMap<>(EventType.class);

    @Override
    public synchronized void upsertRegistration(RegistrationRecord record) {
        RegistrationRecord existing = registrations.get(record.certId());
        if (!record.sameContentAs(existing)) {
            registrations.put(record.certId(), record);
        }
    }

    @Override
    public synchronized void upsertDispute(DisputeRecord record) {
        ResolutionRecord resolution = resolutions.get(record.disputeId());
        DisputeRecord effective = resolution == null ? record : record.withStatus(resolution.status());
        DisputeRecord existing = disputes.get(record.disputeId());
        if (!effective.sameContentAs(existing)) {
            disputes.put(record.disputeId(), effective);
        }
    }

    @Override
    public synchronized void upsertResolution(ResolutionRecord record) {
        ResolutionRecord existing = resolutions.get(record.disputeId());
        if (!record.sameContentAs(existing)) {
            resolutions.put(record.disputeId(), record);
        }
        disputes.computeIfPresent(record.disputeId(), (id, dispute) ->
                dispute.status() == record.status() ? dispute : dispute.withStatus(record.status()));
    }

    @Override
    public Optional<RegistrationRecord> findRegistration(String certId) {
        return Optional.ofNullable(registrations.get(certId));
    }

    @Override
    public Optional<DisputeRecord> findDispute(String disputeId) {
        return Optional.ofNullable(disputes.get(disputeId));
    }

    @Override
    public Optional<ResolutionRecord> findResolution(String disputeId) {
        return Optional.ofNullable(resolutions.get(disputeId));
    }

    @Override
    public List<RegistrationRecord> listRegistrations() {
        List<RegistrationRecord> all = new ArrayList<>(registrations.values());
        all.sort(Comparator.comparing(RegistrationRecord::createdAt).thenComparing(RegistrationRecord::certId));
        return all;
    }

    @Override
    public List<RegistrationRecord> registrationsByCreator(String creator) {
        return listRegistrations().stream()
                .filter(r -> r.creator() != null && r.creator().equalsIgnoreCase(creator))
                .collect(Collectors.toList());
    }

    @Override
    public List<DisputeRecord> disputesForCertificate(String certId) {
        return disputes.values().stream()
                .filter(d -> d.originalCertId().equals(certId))
                .sorted(Comparator.comparing(DisputeRecord::createdAt).thenComparing(DisputeRecord::disputeId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<EventCursor> loadCursor(EventType type) {
        return Optional.ofNullable(cursors.get(type));
    }

    @Override
    public synchronized boolean advanceCursor(EventType type, EventCursor expected, EventCursor next) {
        if (!Objects.equals(cursors.get(type), expected)) {
            return false;
        }
        cursors.put(type, next);
        return true;
    }
}
