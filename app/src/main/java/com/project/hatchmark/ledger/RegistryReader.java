package com.project.hatchmark.ledger;

import java.util.Optional;

/**
 * Read access to authoritative ledger objects.
 */
public interface RegistryReader {

    Optional<Certificate> getCertificate(String certId);

    Optional<Dispute> getDispute(String disputeId);
}
