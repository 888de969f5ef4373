package com.project.hatchmark.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.hatchmark.core.InputValidator;
import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.ledger.DisputeStatus;
import com.project.hatchmark.ledger.MoveValues;
import com.project.hatchmark.ledger.RawEvent;
import com.project.hatchmark.store.DisputeRecord;
import com.project.hatchmark.store.RegistrationRecord;
import com.project.hatchmark.store.ResolutionRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Deterministic event-to-record mapping. The same event always yields the same record apart
 * from {@code syncedAt}.
 */
public class EventMapper {

    private final Clock clock;

    public EventMapper(Clock clock) {
        this.clock = clock;
    }

    public RegistrationRecord toRegistration(RawEvent event) {
        return map(event, () -> {
            JsonNode json = event.parsedJson();
            return new RegistrationRecord(
                    MoveValues.objectId(json.get("cert_id"), "cert_id"),
                    hash(json.get("image_hash"), "image_hash"),
                    address(json.get("creator"), "creator"),
                    timestamp(event),
                    MoveValues.optionalText(json.get("title")),
                    MoveValues.optionalText(json.get("description")),
                    event.id().txDigest(),
                    syncedAt());
        });
    }

    public DisputeRecord toDispute(RawEvent event) {
        return map(event, () -> {
            JsonNode json = event.parsedJson();
            long score = MoveValues.u64(json.get("similarity_score"), "similarity_score");
            InputValidator.validateRange(score, 0, 255, "similarity_score");
            return new DisputeRecord(
                    MoveValues.objectId(json.get("dispute_id"), "dispute_id"),
                    MoveValues.objectId(json.get("original_cert_id"), "original_cert_id"),
                    hash(json.get("flagged_hash"), "flagged_hash"),
                    address(json.get("flagger"), "flagger"),
                    (int) score,
                    DisputeStatus.OPEN,
                    json.hasNonNull("stake") ? MoveValues.u64(json.get("stake"), "stake") : 0L,
                    timestamp(event),
                    event.id().txDigest(),
                    syncedAt());
        });
    }

    public ResolutionRecord toResolution(RawEvent event) {
        return map(event, () -> {
            JsonNode json = event.parsedJson();
            DisputeStatus status = DisputeStatus.fromCode((int) MoveValues.u64(json.get("status"), "status"));
            return new ResolutionRecord(
                    MoveValues.objectId(json.get("dispute_id"), "dispute_id"),
                    json.hasNonNull("original_cert_id")
                            ? MoveValues.objectId(json.get("original_cert_id"), "original_cert_id")
                            : null,
                    status,
                    json.hasNonNull("resolver") ? address(json.get("resolver"), "resolver") : null,
                    json.hasNonNull("stake_recipient") ? address(json.get("stake_recipient"), "stake_recipient") : null,
                    timestamp(event),
                    event.id().txDigest(),
                    syncedAt());
        });
    }

    private static <T> T map(RawEvent event, Supplier<T> mapping) {
        if (event.parsedJson() == null || !event.parsedJson().isObject()) {
            throw new MalformedEventException(event, "payload is not an object", null);
        }
        try {
            return mapping.get();
        } catch (IllegalArgumentException | NullPointerException | ValidationException e) {
            throw new MalformedEventException(event, e.getMessage(), e);
        }
    }

    private static String hash(JsonNode node, String field) {
        return InputValidator.validateHash(MoveValues.bytesHex(node, field), field);
    }

    private static String address(JsonNode node, String field) {
        return MoveValues.text(node, field).toLowerCase(Locale.ROOT);
    }

    /**
     * The event's own {@code timestamp} field, falling back to the ledger's event timestamp.
     */
    private static Instant timestamp(RawEvent event) {
        JsonNode ts = event.parsedJson().get("timestamp");
        long millis = ts != null && !ts.isNull() ? MoveValues.u64(ts, "timestamp") : event.timestampMs();
        return Instant.ofEpochMilli(millis);
    }

    private Instant syncedAt() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
