package com.project.hatchmark.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.hatchmark.core.AlreadyResolvedException;
import com.project.hatchmark.core.HatchmarkException;
import com.project.hatchmark.core.InputValidator;
import com.project.hatchmark.core.InsufficientStakeException;
import com.project.hatchmark.core.LedgerException;
import com.project.hatchmark.core.NotFoundException;
import com.project.hatchmark.core.UnauthorizedException;
import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.fingerprint.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SignatureException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference implementation of the registry module, running in the current process.
 *
 * <p>Certificates are keyed by id and carry their owner; every mutating call checks it.
 * Disputes are replaced by compare-and-set on the whole record (which includes
 * {@link Dispute#version()}), so at most one resolution can ever win. Events are appended to
 * one log per {@link EventType} in commit order. Mutations are serialized on the ledger
 * instance, which plays the part of the chain's transaction ordering.
 *
 * <p>Gas and fees are not modelled. Stake is escrowed in the dispute and credited to the
 * flagger or the creator when the dispute resolves.
 */
public class InProcessRegistryLedger implements RegistryLedger, EventFeed, TransactionSubmitter {

    private static final Logger log = LoggerFactory.getLogger(InProcessRegistryLedger.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final long DEFAULT_MINIMUM_STAKE = 100_000_000L;
    public static final String LOCAL_PACKAGE_ID = "0x0";

    private final String packageId;
    private final long minimumStake;
    private final Clock clock;

    private final Map<String, Certificate> certificates = new ConcurrentHashMap<>();
    private final Map<String, Dispute> disputes = new ConcurrentHashMap<>();
    private final Map<String, Long> balances = new ConcurrentHashMap<>();
    private final Map<EventType, List<RawEvent>> eventLogs = new EnumMap<>(EventType.class);
    private final Set<String> executedDigests = ConcurrentHashMap.newKeySet();
    private final AtomicLong localSequence = new AtomicLong();

    public InProcessRegistryLedger() {
        this(LOCAL_PACKAGE_ID, DEFAULT_MINIMUM_STAKE, Clock.systemUTC());
    }

    public InProcessRegistryLedger(String packageId, long minimumStake, Clock clock) {
        this.packageId = InputValidator.validateObjectId(packageId, "packageId");
        InputValidator.validateNonNegative(minimumStake, "minimumStake");
        this.minimumStake = minimumStake;
        this.clock = clock;
        for (EventType type : EventType.values()) {
            eventLogs.put(type, new ArrayList<>());
        }
    }

    public String packageId() {
        return packageId;
    }

    @Override
    public long minimumStake() {
        return minimumStake;
    }

    // ----- Registry operations (actor already authenticated) -----

    @Override
    public Certificate register(Fingerprint hash, String title, String description, String actor) {
        return applyRegister(localDigest(TransactionBuilder.FN_REGISTER, actor), hash, title, description, actor);
    }

    @Override
    public Dispute flag(String certId, Fingerprint flaggedHash, int distance, long stake, String actor) {
        return applyFlag(localDigest(TransactionBuilder.FN_FLAG, actor), certId, flaggedHash, distance, stake, actor);
    }

    @Override
    public Dispute resolve(String disputeId, String certId, Resolution resolution, String actor) {
        return applyResolve(localDigest(TransactionBuilder.FN_RESOLVE, actor), disputeId, certId, resolution, actor);
    }

    @Override
    public Optional<Certificate> getCertificate(String certId) {
        return Optional.ofNullable(certificates.get(normalizeId(certId)));
    }

    @Override
    public Optional<Dispute> getDispute(String disputeId) {
        return Optional.ofNullable(disputes.get(normalizeId(disputeId)));
    }

    /**
     * Released stake credited to {@code address}; 0 when nothing was ever credited.
     */
    public long balanceOf(String address) {
        return balances.getOrDefault(address.toLowerCase(Locale.ROOT), 0L);
    }

    /**
     * Stake currently locked in open disputes.
     */
    public long escrowedStake() {
        return disputes.values().stream()
                .filter(Dispute::isOpen)
                .mapToLong(Dispute::stake)
                .sum();
    }

    private synchronized Certificate applyRegister(String txDigest, Fingerprint hash, String title,
                                                   String description, String actor) {
        String creator = normalizeAddress(actor);
        Certificate certificate = new Certificate(
                TransactionCodec.objectId(txDigest, 0),
                hash,
                creator,
                now(),
                InputValidator.validateTitle(title),
                InputValidator.validateDescription(description));
        certificates.put(certificate.id(), certificate);
        append(EventType.REGISTRATION, txDigest, RegistrationEvent.of(certificate));
        log.debug("Registered certificate {} for {}", certificate.id(), creator);
        return certificate;
    }

    private synchronized Dispute applyFlag(String txDigest, String certId, Fingerprint flaggedHash, int distance,
                                           long stake, String actor) {
        String flagger = normalizeAddress(actor);
        InputValidator.validateRange(distance, 0, 255, "similarity_score");
        if (stake < minimumStake) {
            throw new InsufficientStakeException(
                String.format("stake %d is below the minimum of %d", stake, minimumStake));
        }
        Certificate certificate = getCertificate(certId)
                .orElseThrow(() -> new NotFoundException("certificate not found: " + certId));

        Dispute dispute = new Dispute(
                TransactionCodec.objectId(txDigest, 0),
                certificate.id(),
                flaggedHash,
                flagger,
                distance,
                DisputeStatus.OPEN,
                stake,
                now(),
                0L);
        disputes.put(dispute.id(), dispute);
        append(EventType.DISPUTE, txDigest, DisputeEvent.of(dispute));
        log.debug("Opened dispute {} against {} (distance {}, stake {})",
                dispute.id(), certificate.id(), distance, stake);
        return dispute;
    }

    private synchronized Dispute applyResolve(String txDigest, String disputeId, String certId, Resolution resolution,
                                              String actor) {
        String resolver = normalizeAddress(actor);
        Dispute current = getDispute(disputeId)
                .orElseThrow(() -> new NotFoundException("dispute not found: " + disputeId));
        if (!current.originalCertId().equals(normalizeId(certId))) {
            throw new ValidationException(
                String.format("dispute %s does not reference certificate %s", current.id(), certId));
        }
        Certificate certificate = getCertificate(certId)
                .orElseThrow(() -> new NotFoundException("certificate not found: " + certId));
        if (!certificate.isOwnedBy(resolver)) {
            throw new UnauthorizedException(
                String.format("only the creator %s may resolve disputes on %s", certificate.creator(), certificate.id()));
        }
        if (!current.isOpen()) {
            throw new AlreadyResolvedException(
                String.format("dispute %s is already %s", current.id(), current.status()));
        }

        Dispute updated = current.transitionTo(resolution.toStatus());
        if (!disputes.replace(current.id(), current, updated)) {
            throw new AlreadyResolvedException("dispute " + current.id() + " changed concurrently");
        }

        String recipient = resolution == Resolution.VALID ? current.flagger() : certificate.creator();
        balances.merge(recipient, current.stake(), Long::sum);
        append(EventType.DISPUTE_RESOLVED, txDigest, new DisputeResolvedEvent(
                updated.id(),
                updated.originalCertId(),
                updated.status().code(),
                resolver,
                recipient,
                clock.millis()));
        log.debug("Resolved dispute {} as {}; stake {} released to {}",
                updated.id(), updated.status(), current.stake(), recipient);
        return updated;
    }

    // ----- Event feed -----

    @Override
    public synchronized EventPage queryEvents(EventType type, EventCursor after, int limit) {
        InputValidator.validatePositive(limit, "limit");
        List<RawEvent> events = eventLogs.get(type);
        int start = 0;
        if (after != null) {
            start = indexOf(events, after) + 1;
            if (start == 0) {
                throw LedgerException.rejected("unknown cursor " + after + " for " + type.structName());
            }
        }
        int end = Math.min(events.size(), start + limit);
        List<RawEvent> data = new ArrayList<>(events.subList(start, end));
        EventCursor next = data.isEmpty() ? after : data.get(data.size() - 1).id();
        return new EventPage(data, next, end < events.size());
    }

    private static int indexOf(List<RawEvent> events, EventCursor cursor) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).id().equals(cursor)) {
                return i;
            }
        }
        return -1;
    }

    private void append(EventType type, String txDigest, Object payload) {
        List<RawEvent> events = eventLogs.get(type);
        events.add(new RawEvent(new EventCursor(txDigest, 0), type, MAPPER.valueToTree(payload), clock.millis()));
    }

    // ----- Signed transactions -----

    /**
     * Execute a signed descriptor. The actor is the address recovered from the signature, which
     * must equal the declared sender. Every rejection is reported in the receipt.
     */
    @Override
    public TransactionReceipt submit(SignedTransaction signed) {
        String digest = TransactionCodec.digest(signed.txBytes());
        UnsignedTransaction tx;
        String signer;
        try {
            tx = TransactionCodec.decode(signed.txBytes());
            signer = TransactionCodec.recoverSigner(signed.txBytes(), signed.signature());
        } catch (IllegalArgumentException | SignatureException e) {
            log.warn("Rejected transaction {}: {}", digest, e.getMessage());
            return TransactionReceipt.failure(digest, "invalid transaction: " + e.getMessage());
        }
        if (!signer.equalsIgnoreCase(tx.sender())) {
            return TransactionReceipt.failure(digest,
                    String.format("signature by %s does not match sender %s", signer, tx.sender()));
        }
        if (!packageId.equalsIgnoreCase(tx.packageId()) || !EventType.MODULE.equals(tx.module())) {
            return TransactionReceipt.failure(digest, "unknown call target " + tx.target());
        }
        if (!executedDigests.add(digest)) {
            return TransactionReceipt.failure(digest, "transaction " + digest + " was already executed");
        }

        try {
            return dispatch(digest, tx, signer);
        } catch (HatchmarkException | IllegalArgumentException | ArithmeticException e) {
            log.info("Transaction {} ({}) aborted: {}", digest, tx.function(), e.getMessage());
            return TransactionReceipt.failure(digest, e.getMessage());
        }
    }

    private TransactionReceipt dispatch(String digest, UnsignedTransaction tx, String actor) {
        switch (tx.function()) {
            case TransactionBuilder.FN_REGISTER: {
                Certificate certificate = applyRegister(digest,
                        Fingerprint.parse(tx.stringArgument(TransactionBuilder.ARG_IMAGE_HASH)),
                        tx.stringArgument(TransactionBuilder.ARG_TITLE),
                        tx.stringArgument(TransactionBuilder.ARG_DESCRIPTION),
                        actor);
                return new TransactionReceipt(digest, true, null, List.of(certificate.id()), List.of());
            }
            case TransactionBuilder.FN_FLAG: {
                Dispute dispute = applyFlag(digest,
                        tx.stringArgument(TransactionBuilder.ARG_CERT_ID),
                        Fingerprint.parse(tx.stringArgument(TransactionBuilder.ARG_FLAGGED_HASH)),
                        Math.toIntExact(tx.longArgument(TransactionBuilder.ARG_SIMILARITY_SCORE)),
                        tx.longArgument(TransactionBuilder.ARG_STAKE),
                        actor);
                return new TransactionReceipt(digest, true, null, List.of(dispute.id()), List.of());
            }
            case TransactionBuilder.FN_RESOLVE: {
                Dispute dispute = applyResolve(digest,
                        tx.stringArgument(TransactionBuilder.ARG_DISPUTE_ID),
                        tx.stringArgument(TransactionBuilder.ARG_CERT_ID),
                        Resolution.parse(tx.stringArgument(TransactionBuilder.ARG_RESOLUTION)),
                        actor);
                return new TransactionReceipt(digest, true, null, List.of(), List.of(dispute.id()));
            }
            default:
                return TransactionReceipt.failure(digest, "unknown function " + tx.function());
        }
    }

    // ----- Helpers -----

    private String localDigest(String function, String actor) {
        String seed = "local:" + localSequence.incrementAndGet() + ":" + function + ":" + actor;
        return TransactionCodec.digest(TransactionCodec.utf8(seed));
    }

    private Instant now() {
        return clock.instant();
    }

    private static String normalizeId(String id) {
        return InputValidator.validateObjectId(id, "id");
    }

    private static String normalizeAddress(String address) {
        return InputValidator.validateObjectId(address, "actor");
    }
}
