package com.project.hatchmark.core;

import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.ledger.Certificate;
import com.project.hatchmark.ledger.Dispute;
import com.project.hatchmark.ledger.RegistryReader;
import com.project.hatchmark.ledger.Resolution;
import com.project.hatchmark.ledger.TransactionBuilder;
import com.project.hatchmark.ledger.UnsignedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds unsigned transaction descriptors after every check that can be made without the
 * ledger executing anything. A request that fails here never costs a fee.
 *
 * <p>Certificate and dispute lookups go to the ledger itself, not the off-chain projection.
 */
public class TransactionRequestService {

    private static final Logger log = LoggerFactory.getLogger(TransactionRequestService.class);

    public static final String ANNOTATION_SCORE_SOURCE = "score_source";
    public static final String ANNOTATION_SIMILARITY = "similarity_percent";

    private final VerificationService verification;
    private final RegistryReader registry;
    private final TransactionBuilder builder;
    private final long minimumStake;

    public TransactionRequestService(VerificationService verification, RegistryReader registry,
                                     TransactionBuilder builder, long minimumStake) {
        this.verification = Objects.requireNonNull(verification, "verification must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        InputValidator.validateNonNegative(minimumStake, "minimumStake");
        this.minimumStake = minimumStake;
    }

    public long minimumStake() {
        return minimumStake;
    }

    /**
     * @throws ValidationException on malformed hash, title, description or sender
     * @throws DuplicateException if a registration is at or above the register threshold
     */
    public UnsignedTransaction buildRegister(RegisterRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Fingerprint hash = Fingerprint.parse(request.hash());
        String title = InputValidator.validateTitle(request.title());
        String description = InputValidator.validateDescription(request.description());
        String sender = InputValidator.validateObjectId(request.sender(), "sender");

        verification.checkDuplicate(hash);
        log.debug("Register request for {} by {} passed local checks", hash, sender);
        return builder.register(hash, title, description, sender);
    }

    /**
     * @throws NotFoundException if the certificate does not exist on the ledger
     * @throws InsufficientStakeException if the stake is below the minimum
     */
    public UnsignedTransaction buildFlag(FlagRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String certId = InputValidator.validateObjectId(request.certId(), "cert_id");
        Fingerprint flagged = Fingerprint.parse(request.flaggedHash());
        String sender = InputValidator.validateObjectId(request.sender(), "sender");
        ScoreConversion.Score score = ScoreConversion.resolve(request.hammingDistance(), request.similarity());
        if (request.stake() == null) {
            throw new ValidationException("stake is required");
        }
        long stake = request.stake();
        InputValidator.validateNonNegative(stake, "stake");
        if (stake < minimumStake) {
            throw new InsufficientStakeException(
                String.format("stake %d is below the minimum of %d", stake, minimumStake));
        }
        registry.getCertificate(certId)
                .orElseThrow(() -> new NotFoundException("certificate not found: " + certId));

        Map<String, Object> annotations = new LinkedHashMap<>();
        annotations.put(ANNOTATION_SCORE_SOURCE, score.source().name());
        if (score.similarityPercent() != null) {
            annotations.put(ANNOTATION_SIMILARITY, score.similarityPercent());
        }
        return builder.flag(certId, flagged, score.distance(), stake, sender, annotations);
    }

    /**
     * @throws NotFoundException if the dispute or certificate does not exist
     * @throws UnauthorizedException unless the sender created the certificate
     * @throws AlreadyResolvedException if the dispute is no longer open
     */
    public UnsignedTransaction buildResolve(ResolveRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String disputeId = InputValidator.validateObjectId(request.disputeId(), "dispute_id");
        String certId = InputValidator.validateObjectId(request.certId(), "cert_id");
        String sender = InputValidator.validateObjectId(request.sender(), "sender");
        Resolution resolution;
        try {
            resolution = Resolution.parse(request.resolution());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("resolution must be VALID or INVALID: " + request.resolution(), e);
        }

        Dispute dispute = registry.getDispute(disputeId)
                .orElseThrow(() -> new NotFoundException("dispute not found: " + disputeId));
        if (!dispute.originalCertId().equals(certId)) {
            throw new ValidationException(
                String.format("dispute %s does not reference certificate %s", disputeId, certId));
        }
        Certificate certificate = registry.getCertificate(certId)
                .orElseThrow(() -> new NotFoundException("certificate not found: " + certId));
        if (!certificate.isOwnedBy(sender)) {
            throw new UnauthorizedException("only the certificate creator may resolve this dispute");
        }
        if (!dispute.isOpen()) {
            throw new AlreadyResolvedException(
                String.format("dispute %s is already %s", disputeId, dispute.status()));
        }
        return builder.resolve(disputeId, certId, resolution, sender);
    }
}
