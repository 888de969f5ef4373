package com.project.hatchmark.store;

import java.util.List;
import java.util.Optional;

/**
 * Read-optimised projection of registry state.
 *
 * <p>Only the indexer writes. Every write is an upsert keyed by the on-chain object id, so
 * replaying an event is harmless. Writing identical content again keeps the stored
 * {@code syncedAt}. A dispute's stored status is its resolution's status whenever a resolution
 * is known, whichever of the two events arrived first. Disputes are stored without requiring
 * their registration to be present.
 *
 * <p>Implementations report backend failures as {@link StoreException}.
 */
public interface OffchainStore {

    void upsertRegistration(RegistrationRecord record);

    void upsertDispute(DisputeRecord record);

    void upsertResolution(ResolutionRecord record);

    Optional<RegistrationRecord> findRegistration(String certId);

    Optional<DisputeRecord> findDispute(String disputeId);

    Optional<ResolutionRecord> findResolution(String disputeId);

    /**
     * Every registration, oldest first.
     */
    List<RegistrationRecord> listRegistrations();

    List<RegistrationRecord> registrationsByCreator(String creator);

    List<DisputeRecord> disputesForCertificate(String certId);
}
