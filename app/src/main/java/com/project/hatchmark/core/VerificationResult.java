package com.project.hatchmark.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.hatchmark.match.Match;
import com.project.hatchmark.match.MatchReport;
import com.project.hatchmark.store.RegistrationRecord;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Answer to a verify request.
 */
public record VerificationResult(
        @JsonProperty("matches") List<MatchView> matches,
        @JsonProperty("isOriginal") boolean isOriginal,
        @JsonProperty("exactMatch") MatchView exactMatch,
        @JsonProperty("corpusSize") int corpusSize
) {

    public record MatchView(
            @JsonProperty("cert_id") String certId,
            @JsonProperty("creator") String creator,
            @JsonProperty("title") String title,
            @JsonProperty("similarity") int similarity,
            @JsonProperty("hammingDistance") int hammingDistance,
            @JsonProperty("created_at") Instant createdAt
    ) {

        static MatchView of(Match<RegistrationRecord> match) {
            RegistrationRecord record = match.entry().payload();
            return new MatchView(
                    match.id(),
                    record.creator(),
                    record.title(),
                    match.similarity(),
                    match.distance(),
                    record.createdAt());
        }
    }

    public static VerificationResult of(MatchReport<RegistrationRecord> report) {
        return new VerificationResult(
                report.matches().stream().map(MatchView::of).collect(Collectors.toList()),
                report.isOriginal(),
                report.exactMatch().map(MatchView::of).orElse(null),
                report.corpusSize());
    }
}
