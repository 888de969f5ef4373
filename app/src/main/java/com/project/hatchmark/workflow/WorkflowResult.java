package com.project.hatchmark.workflow;

import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.ledger.UnsignedTransaction;

/**
 * Outcome of a submitted workflow.
 *
 * @param objectId     certificate or dispute the transaction created or changed
 * @param fingerprint  fingerprint that was registered or flagged; {@code null} for a resolution
 * @param confirmed    the off-chain store reflects the transaction; false when the caller
 *                     stopped waiting after submission
 * @param syncAttempts store polls made while waiting
 */
public record WorkflowResult(
        String objectId,
        String txDigest,
        Fingerprint fingerprint,
        UnsignedTransaction transaction,
        boolean confirmed,
        int syncAttempts
) {
}
