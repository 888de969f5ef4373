package com.project.hatchmark.ledger;

import com.project.hatchmark.core.AlreadyResolvedException;
import com.project.hatchmark.core.InsufficientStakeException;
import com.project.hatchmark.core.NotFoundException;
import com.project.hatchmark.core.UnauthorizedException;
import com.project.hatchmark.fingerprint.Fingerprint;

/**
 * State machine exposed by the registry module.
 *
 * <pre>
 * register  : -> Certificate (owner = actor)            emits RegistrationEvent
 * flag      : Certificate -> Dispute(OPEN)               emits DisputeEvent
 * resolve   : Dispute(OPEN) -> Dispute(VALID | INVALID)  emits DisputeResolvedEvent
 * </pre>
 */
public interface RegistryLedger extends RegistryReader {

    Certificate register(Fingerprint hash, String title, String description, String actor);

    /**
     * @param distance Hamming distance byte, 0-255
     * @throws NotFoundException if the certificate does not exist
     * @throws InsufficientStakeException if {@code stake} is below the minimum
     */
    Dispute flag(String certId, Fingerprint flaggedHash, int distance, long stake, String actor);

    /**
     * @throws NotFoundException if the dispute does not exist
     * @throws UnauthorizedException unless {@code actor} created the certificate
     * @throws AlreadyResolvedException if the dispute is no longer open
     */
    Dispute resolve(String disputeId, String certId, Resolution resolution, String actor);

    long minimumStake();
}
