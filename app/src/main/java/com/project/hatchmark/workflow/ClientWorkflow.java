package com.project.hatchmark.workflow;

import com.project.hatchmark.core.FlagRequest;
import com.project.hatchmark.core.LedgerException;
import com.project.hatchmark.core.RegisterRequest;
import com.project.hatchmark.core.ResolveRequest;
import com.project.hatchmark.core.RetryPolicy;
import com.project.hatchmark.core.SyncTimeoutException;
import com.project.hatchmark.core.TransactionRequestService;
import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.core.VerificationService;
import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.fingerprint.PerceptualHasher;
import com.project.hatchmark.ledger.DisputeStatus;
import com.project.hatchmark.ledger.Resolution;
import com.project.hatchmark.ledger.SignedTransaction;
import com.project.hatchmark.ledger.Signer;
import com.project.hatchmark.ledger.TransactionReceipt;
import com.project.hatchmark.ledger.TransactionSubmitter;
import com.project.hatchmark.ledger.UnsignedTransaction;
import com.project.hatchmark.match.Match;
import com.project.hatchmark.match.MatchReport;
import com.project.hatchmark.store.OffchainStore;
import com.project.hatchmark.store.RegistrationRecord;
import com.project.hatchmark.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Client-side sequence shared by register, flag and resolve:
 *
 * <pre>
 * fingerprint -> match -> local checks -> build -> sign -> submit -> await projection
 * </pre>
 *
 * Everything up to signing is side-effect free and can be cancelled. After submission the
 * transaction cannot be recalled; cancelling then only stops the wait.
 *
 * <p>Submission is retried only when the ledger could not be reached. A transaction the ledger
 * executed and rejected fails the workflow with the ledger's reason.
 */
public class ClientWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ClientWorkflow.class);

    /**
     * @param submitRetry     retry for transport-level submission failures
     * @param syncMaxAttempts store polls before giving up with {@link SyncTimeoutException}
     * @param syncBackoff     fixed delay between store polls
     */
    public record Options(RetryPolicy submitRetry, int syncMaxAttempts, Duration syncBackoff) {

        public static Options defaults() {
            return new Options(RetryPolicy.defaults(), 10, Duration.ofSeconds(2));
        }
    }

    private final PerceptualHasher hasher;
    private final VerificationService verification;
    private final TransactionRequestService requests;
    private final TransactionSubmitter submitter;
    private final OffchainStore store;
    private final Options options;

    public ClientWorkflow(PerceptualHasher hasher, VerificationService verification,
                          TransactionRequestService requests, TransactionSubmitter submitter,
                          OffchainStore store, Options options) {
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        this.verification = Objects.requireNonNull(verification, "verification must not be null");
        this.requests = Objects.requireNonNull(requests, "requests must not be null");
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Register an image as an original.
     *
     * @throws com.project.hatchmark.core.DuplicateException before any transaction is built
     *         when a near-duplicate is already registered
     */
    public WorkflowResult register(byte[] image, String title, String description, Signer signer,
                                   CancellationToken cancellation) {
        checkCancelled(cancellation, "fingerprinting");
        Fingerprint fingerprint = hasher.fingerprint(image);

        checkCancelled(cancellation, "duplicate check");
        UnsignedTransaction tx = requests.buildRegister(
                new RegisterRequest(fingerprint.hex(), title, description, signer.address()));

        TransactionReceipt receipt = signAndSubmit(tx, signer, cancellation);
        String certId = primaryObject(receipt);
        return await(fingerprint, tx, receipt, certId, cancellation,
                () -> store.findRegistration(certId).isPresent());
    }

    /**
     * Open a dispute claiming {@code image} copies certificate {@code certId}.
     *
     * @throws ValidationException before any transaction is built when the image does not
     *         match the certificate at the verify threshold
     */
    public WorkflowResult flag(byte[] image, String certId, long stake, Signer signer,
                               CancellationToken cancellation) {
        checkCancelled(cancellation, "fingerprinting");
        Fingerprint fingerprint = hasher.fingerprint(image);

        checkCancelled(cancellation, "matching");
        MatchReport<RegistrationRecord> report = verification.verify(fingerprint);
        Match<RegistrationRecord> match = report.matches().stream()
                .filter(m -> m.id().equalsIgnoreCase(certId))
                .findFirst()
                .orElseThrow(() -> new ValidationException(String.format(
                    "image does not match certificate %s at the %d%% verify threshold",
                    certId, verification.verifyThreshold())));

        UnsignedTransaction tx = requests.buildFlag(new FlagRequest(
                certId, fingerprint.hex(), match.similarity(), match.distance(), stake, signer.address()));

        TransactionReceipt receipt = signAndSubmit(tx, signer, cancellation);
        String disputeId = primaryObject(receipt);
        return await(fingerprint, tx, receipt, disputeId, cancellation,
                () -> store.findDispute(disputeId).isPresent());
    }

    /**
     * Resolve a dispute on one of the signer's certificates.
     */
    public WorkflowResult resolve(String disputeId, String certId, Resolution resolution, Signer signer,
                                  CancellationToken cancellation) {
        checkCancelled(cancellation, "building");
        UnsignedTransaction tx = requests.buildResolve(
                new ResolveRequest(disputeId, certId, resolution.name(), signer.address()));

        TransactionReceipt receipt = signAndSubmit(tx, signer, cancellation);
        String resolvedId = primaryObject(receipt);
        DisputeStatus expected = resolution.toStatus();
        return await(null, tx, receipt, resolvedId, cancellation,
                () -> store.findDispute(resolvedId).map(d -> d.status() == expected).orElse(false));
    }

    private TransactionReceipt signAndSubmit(UnsignedTransaction tx, Signer signer, CancellationToken cancellation) {
        checkCancelled(cancellation, "signing");
        SignedTransaction signed = signer.sign(tx);

        TransactionReceipt receipt = options.submitRetry().execute("submit " + tx.function(),
                () -> submitter.submit(signed),
                e -> e instanceof LedgerException && ((LedgerException) e).isRetryable());
        if (!receipt.success()) {
            throw LedgerException.rejected(receipt.error());
        }
        log.info("{} executed in {}", tx.function(), receipt.digest());
        return receipt;
    }

    private static String primaryObject(TransactionReceipt receipt) {
        return receipt.primaryObjectId().orElseThrow(() -> LedgerException.rejected(
                "transaction " + receipt.digest() + " reported no registry object"));
    }

    private WorkflowResult await(Fingerprint fingerprint, UnsignedTransaction tx, TransactionReceipt receipt,
                                 String objectId, CancellationToken cancellation, BooleanSupplier synced) {
        for (int attempt = 1; attempt <= options.syncMaxAttempts(); attempt++) {
            if (cancellation.isCancelled()) {
                log.info("Stopped waiting for {} after {} polls", objectId, attempt - 1);
                return new WorkflowResult(objectId, receipt.digest(), fingerprint, tx, false, attempt - 1);
            }
            if (isSynced(synced, objectId)) {
                return new WorkflowResult(objectId, receipt.digest(), fingerprint, tx, true, attempt);
            }
            if (attempt < options.syncMaxAttempts()) {
                sleep(options.syncBackoff());
            }
        }
        throw new SyncTimeoutException(String.format(
            "%s %s was accepted in %s but is not in the off-chain store after %d attempts",
            tx.function(), objectId, receipt.digest(), options.syncMaxAttempts()));
    }

    private static boolean isSynced(BooleanSupplier synced, String objectId) {
        try {
            return synced.getAsBoolean();
        } catch (StoreException e) {
            log.warn("Store lookup for {} failed, will retry: {}", objectId, e.getMessage());
            return false;
        }
    }

    private static void checkCancelled(CancellationToken cancellation, String step) {
        if (cancellation.isCancelled()) {
            throw new WorkflowCancelledException(step);
        }
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the off-chain store", e);
        }
    }
}
