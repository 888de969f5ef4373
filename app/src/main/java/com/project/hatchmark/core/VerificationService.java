package com.project.hatchmark.core;

import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.match.CorpusEntry;
import com.project.hatchmark.match.LinearScanIndex;
import com.project.hatchmark.match.Match;
import com.project.hatchmark.match.MatchReport;
import com.project.hatchmark.match.SimilarityIndex;
import com.project.hatchmark.store.OffchainStore;
import com.project.hatchmark.store.RegistrationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Near-duplicate lookups against the off-chain projection.
 *
 * <p>Reads whatever the indexer has stored so far: a registration that is on-chain but not yet
 * indexed is invisible here.
 */
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final OffchainStore store;
    private final int verifyThreshold;
    private final int registerThreshold;

    public VerificationService(OffchainStore store, int verifyThreshold, int registerThreshold) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        InputValidator.validateRange(verifyThreshold, 0, 100, "verifyThreshold");
        InputValidator.validateRange(registerThreshold, 0, 100, "registerThreshold");
        this.verifyThreshold = verifyThreshold;
        this.registerThreshold = registerThreshold;
    }

    public int verifyThreshold() {
        return verifyThreshold;
    }

    public int registerThreshold() {
        return registerThreshold;
    }

    /**
     * @param hash hex fingerprint as supplied by the caller
     */
    public VerificationResult verify(String hash) {
        return VerificationResult.of(verify(Fingerprint.parse(hash)));
    }

    public MatchReport<RegistrationRecord> verify(Fingerprint candidate) {
        return corpus().query(candidate, verifyThreshold);
    }

    /**
     * @return the (non-duplicate) report at the register threshold
     * @throws DuplicateException if any registration is at or above the register threshold
     */
    public MatchReport<RegistrationRecord> checkDuplicate(Fingerprint candidate) {
        MatchReport<RegistrationRecord> report = corpus().query(candidate, registerThreshold);
        if (!report.isOriginal()) {
            Match<RegistrationRecord> best = report.best().orElseThrow();
            throw new DuplicateException(
                String.format("image is %d%% similar to certificate %s (threshold %d%%)",
                    best.similarity(), best.id(), registerThreshold),
                best);
        }
        return report;
    }

    private SimilarityIndex<RegistrationRecord> corpus() {
        List<CorpusEntry<RegistrationRecord>> entries = new ArrayList<>();
        for (RegistrationRecord record : store.listRegistrations()) {
            if (!InputValidator.isValidHash(record.imageHash())) {
                log.warn("Skipping registration {} with unreadable hash '{}'", record.certId(), record.imageHash());
                continue;
            }
            entries.add(new CorpusEntry<>(record.certId(), Fingerprint.parse(record.imageHash()),
                    record.createdAt(), record));
        }
        return new LinearScanIndex<>(entries);
    }
}
