package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emitted by {@code register}.
 *
 * @param timestamp milliseconds since the epoch
 */
public record RegistrationEvent(
        @JsonProperty("cert_id") String certId,
        @JsonProperty("image_hash") String imageHash,
        @JsonProperty("creator") String creator,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description
) {

    static RegistrationEvent of(Certificate certificate) {
        return new RegistrationEvent(
                certificate.id(),
                certificate.imageHash().hex(),
                certificate.creator(),
                certificate.createdAt().toEpochMilli(),
                certificate.title(),
                certificate.description());
    }
}
