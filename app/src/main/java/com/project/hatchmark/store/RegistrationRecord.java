package com.project.hatchmark.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Off-chain copy of a certificate, as written by the indexer.
 *
 * @param txDigest transaction that emitted the registration event
 * @param syncedAt when the indexer first stored this content
 */
public record RegistrationRecord(
        @JsonProperty("cert_id") String certId,
        @JsonProperty("image_hash") String imageHash,
        @JsonProperty("creator") String creator,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("tx_digest") String txDigest,
        @JsonProperty("synced_at") Instant syncedAt
) {

    public RegistrationRecord {
        Objects.requireNonNull(certId, "certId must not be null");
        Objects.requireNonNull(imageHash, "imageHash must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * Equal in everything except {@code syncedAt}.
     */
    public boolean sameContentAs(RegistrationRecord other) {
        return other != null && equals(other.withSyncedAt(syncedAt));
    }

    public RegistrationRecord withSyncedAt(Instant value) {
        return new RegistrationRecord(certId, imageHash, creator, createdAt, title, description, txDigest, value);
    }
}
