package com.project.hatchmark.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of an executed transaction.
 *
 * @param success false when the ledger executed and rejected the call; {@code error} holds its reason
 * @param createdObjectIds objects created by the call (a certificate or a dispute)
 * @param mutatedObjectIds objects changed by the call (a resolved dispute)
 */
public record TransactionReceipt(
        String digest,
        boolean success,
        String error,
        List<String> createdObjectIds,
        List<String> mutatedObjectIds
) {

    public TransactionReceipt {
        createdObjectIds = List.copyOf(createdObjectIds);
        mutatedObjectIds = List.copyOf(mutatedObjectIds);
    }

    public static TransactionReceipt failure(String digest, String error) {
        return new TransactionReceipt(digest, false, error, List.of(), List.of());
    }

    /**
     * The object the workflow waits for: the first created object, otherwise the first mutated one.
     */
    public Optional<String> primaryObjectId() {
        if (!createdObjectIds.isEmpty()) {
            return Optional.of(createdObjectIds.get(0));
        }
        return mutatedObjectIds.isEmpty() ? Optional.empty() : Optional.of(mutatedObjectIds.get(0));
    }
}
