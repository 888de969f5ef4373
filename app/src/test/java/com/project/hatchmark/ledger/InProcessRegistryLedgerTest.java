package com.project.hatchmark.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.hatchmark.core.AlreadyResolvedException;
import com.project.hatchmark.core.InsufficientStakeException;
import com.project.hatchmark.core.LedgerException;
import com.project.hatchmark.core.MutableClock;
import com.project.hatchmark.core.NotFoundException;
import com.project.hatchmark.core.UnauthorizedException;
import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.fingerprint.Fingerprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-process registry ledger")
class InProcessRegistryLedgerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final long MIN_STAKE = 100;
    private static final Fingerprint ORIGINAL = Fingerprint.parse("0000000000000000");
    private static final Fingerprint COPY = Fingerprint.parse("000000000000000f");

    private final KeyPairSigner creator = TestKeys.creator();
    private final KeyPairSigner flagger = TestKeys.flagger();
    private final KeyPairSigner stranger = TestKeys.stranger();

    private MutableClock clock;
    private InProcessRegistryLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        ledger = new InProcessRegistryLedger(InProcessRegistryLedger.LOCAL_PACKAGE_ID, MIN_STAKE, clock);
    }

    private List<RawEvent> events(EventType type) {
        return ledger.queryEvents(type, null, 100).data();
    }

    @Nested
    @DisplayName("Register")
    class Register {

        @Test
        @DisplayName("Creates a certificate owned by the actor and emits its event")
        void testRegister() {
            Certificate certificate = ledger.register(ORIGINAL, " Harbour ", null, "0x" + creator.address().substring(2).toUpperCase());

            assertTrue(certificate.id().matches("0x[0-9a-f]{64}"));
            assertEquals(creator.address(), certificate.creator());
            assertEquals("Harbour", certificate.title());
            assertEquals("", certificate.description());
            assertEquals(T0, certificate.createdAt());
            assertEquals(certificate, ledger.getCertificate(certificate.id()).orElseThrow());

            List<RawEvent> events = events(EventType.REGISTRATION);
            assertEquals(1, events.size());
            JsonNode json = events.get(0).parsedJson();
            assertEquals(certificate.id(), json.get("cert_id").asText());
            assertEquals(ORIGINAL.hex(), json.get("image_hash").asText());
            assertEquals(creator.address(), json.get("creator").asText());
            assertEquals(T0.toEpochMilli(), json.get("timestamp").asLong());
        }

        @Test
        @DisplayName("Invalid input aborts without an event")
        void testInvalidInput() {
            assertThrows(ValidationException.class, () -> ledger.register(ORIGINAL, " ", "", creator.address()));
            assertThrows(ValidationException.class, () -> ledger.register(ORIGINAL, "Title", "", "alice"));
            assertTrue(events(EventType.REGISTRATION).isEmpty());
        }
    }

    @Nested
    @DisplayName("Flag")
    class Flag {

        private Certificate certificate;

        @BeforeEach
        void register() {
            certificate = ledger.register(ORIGINAL, "Original", "", creator.address());
        }

        @Test
        @DisplayName("Opens a dispute and escrows the stake")
        void testFlag() {
            Dispute dispute = ledger.flag(certificate.id(), COPY, 4, MIN_STAKE, flagger.address());

            assertEquals(DisputeStatus.OPEN, dispute.status());
            assertEquals(certificate.id(), dispute.originalCertId());
            assertEquals(4, dispute.similarityScore());
            assertEquals(0L, dispute.version());
            assertEquals(MIN_STAKE, ledger.escrowedStake());

            JsonNode json = events(EventType.DISPUTE).get(0).parsedJson();
            assertEquals(dispute.id(), json.get("dispute_id").asText());
            assertEquals(4, json.get("similarity_score").asInt());
            assertEquals(MIN_STAKE, json.get("stake").asLong());
        }

        @Test
        @DisplayName("Stake below the minimum aborts")
        void testInsufficientStake() {
            assertThrows(InsufficientStakeException.class,
                    () -> ledger.flag(certificate.id(), COPY, 4, MIN_STAKE - 1, flagger.address()));
            assertTrue(events(EventType.DISPUTE).isEmpty());
            assertEquals(0, ledger.escrowedStake());
        }

        @Test
        @DisplayName("Unknown certificates and out-of-range scores abort")
        void testInvalid() {
            assertThrows(NotFoundException.class,
                    () -> ledger.flag("0x" + "c".repeat(64), COPY, 4, MIN_STAKE, flagger.address()));
            assertThrows(ValidationException.class,
                    () -> ledger.flag(certificate.id(), COPY, 256, MIN_STAKE, flagger.address()));
        }
    }

    @Nested
    @DisplayName("Resolve")
    class Resolve {

        private Certificate certificate;
        private Dispute dispute;

        @BeforeEach
        void openDispute() {
            certificate = ledger.register(ORIGINAL, "Original", "", creator.address());
            dispute = ledger.flag(certificate.id(), COPY, 4, 250, flagger.address());
        }

        @Test
        @DisplayName("Upholding returns the stake to the flagger")
        void testValid() {
            Dispute resolved = ledger.resolve(dispute.id(), certificate.id(), Resolution.VALID, creator.address());

            assertEquals(DisputeStatus.VALID, resolved.status());
            assertEquals(1L, resolved.version());
            assertEquals(250, ledger.balanceOf(flagger.address()));
            assertEquals(0, ledger.balanceOf(creator.address()));
            assertEquals(0, ledger.escrowedStake());

            JsonNode json = events(EventType.DISPUTE_RESOLVED).get(0).parsedJson();
            assertEquals(DisputeStatus.VALID.code(), json.get("status").asInt());
            assertEquals(flagger.address(), json.get("stake_recipient").asText());
            assertEquals(creator.address(), json.get("resolver").asText());
        }

        @Test
        @DisplayName("Rejecting forfeits the stake to the creator")
        void testInvalid() {
            ledger.resolve(dispute.id(), certificate.id(), Resolution.INVALID, creator.address());
            assertEquals(DisputeStatus.INVALID, ledger.getDispute(dispute.id()).orElseThrow().status());
            assertEquals(250, ledger.balanceOf(creator.address()));
            assertEquals(0, ledger.balanceOf(flagger.address()));
        }

        @Test
        @DisplayName("Only the creator may resolve")
        void testUnauthorized() {
            assertThrows(UnauthorizedException.class,
                    () -> ledger.resolve(dispute.id(), certificate.id(), Resolution.VALID, flagger.address()));
            assertTrue(ledger.getDispute(dispute.id()).orElseThrow().isOpen());
            assertEquals(250, ledger.escrowedStake());
        }

        @Test
        @DisplayName("A terminal status never changes")
        void testAlreadyResolved() {
            ledger.resolve(dispute.id(), certificate.id(), Resolution.INVALID, creator.address());
            assertThrows(AlreadyResolvedException.class,
                    () -> ledger.resolve(dispute.id(), certificate.id(), Resolution.VALID, creator.address()));
            assertEquals(DisputeStatus.INVALID, ledger.getDispute(dispute.id()).orElseThrow().status());
            assertEquals(0, ledger.balanceOf(flagger.address()));
            assertEquals(1, events(EventType.DISPUTE_RESOLVED).size());
        }

        @Test
        @DisplayName("Concurrent resolutions: exactly one wins")
        void testConcurrentResolve() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> outcomes = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Resolution resolution = i % 2 == 0 ? Resolution.VALID : Resolution.INVALID;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        ledger.resolve(dispute.id(), certificate.id(), resolution, creator.address());
                        return true;
                    } catch (AlreadyResolvedException e) {
                        return false;
                    }
                };
                outcomes.add(pool.submit(attempt));
            }
            start.countDown();
            int wins = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(10, TimeUnit.SECONDS)) {
                    wins++;
                }
            }
            pool.shutdown();

            assertEquals(1, wins);
            assertEquals(1, events(EventType.DISPUTE_RESOLVED).size());
            assertEquals(250, ledger.balanceOf(creator.address()) + ledger.balanceOf(flagger.address()));
        }
    }

    @Nested
    @DisplayName("Event feed")
    class EventFeedTests {

        @Test
        @DisplayName("Pages in commit order and resumes after a cursor")
        void testPaging() {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                ids.add(ledger.register(Fingerprint.parse(String.format("%016x", i)), "Image " + i, "",
                        creator.address()).id());
            }

            EventPage first = ledger.queryEvents(EventType.REGISTRATION, null, 2);
            assertEquals(2, first.data().size());
            assertTrue(first.hasNextPage());
            assertEquals(ids.get(0), first.data().get(0).parsedJson().get("cert_id").asText());

            EventPage second = ledger.queryEvents(EventType.REGISTRATION, first.nextCursor(), 2);
            assertEquals(1, second.data().size());
            assertFalse(second.hasNextPage());
            assertEquals(ids.get(2), second.data().get(0).parsedJson().get("cert_id").asText());

            EventPage empty = ledger.queryEvents(EventType.REGISTRATION, second.nextCursor(), 2);
            assertTrue(empty.isEmpty());
            assertEquals(second.nextCursor(), empty.nextCursor());
        }

        @Test
        @DisplayName("Streams are independent and unknown cursors are rejected")
        void testStreams() {
            ledger.register(ORIGINAL, "Original", "", creator.address());
            assertTrue(ledger.queryEvents(EventType.DISPUTE, null, 10).isEmpty());
            assertThrows(LedgerException.class, () -> ledger.queryEvents(EventType.REGISTRATION,
                    new EventCursor("0x" + "f".repeat(64), 0), 10));
            assertThrows(ValidationException.class, () -> ledger.queryEvents(EventType.REGISTRATION, null, 0));
        }
    }

    @Nested
    @DisplayName("Signed transactions")
    class Signed {

        private final TransactionBuilder builder = new TransactionBuilder(InProcessRegistryLedger.LOCAL_PACKAGE_ID);

        @Test
        @DisplayName("The recovered signer becomes the actor")
        void testRegisterAndResolve() {
            TransactionReceipt registered = ledger.submit(
                    creator.sign(builder.register(ORIGINAL, "Original", "", creator.address())));
            assertTrue(registered.success(), registered.error());
            String certId = registered.primaryObjectId().orElseThrow();
            assertEquals(creator.address(), ledger.getCertificate(certId).orElseThrow().creator());

            TransactionReceipt flagged = ledger.submit(flagger.sign(
                    builder.flag(certId, COPY, 4, MIN_STAKE, flagger.address(), null)));
            assertTrue(flagged.success(), flagged.error());
            String disputeId = flagged.createdObjectIds().get(0);

            TransactionReceipt resolved = ledger.submit(creator.sign(
                    builder.resolve(disputeId, certId, Resolution.VALID, creator.address())));
            assertTrue(resolved.success(), resolved.error());
            assertTrue(resolved.createdObjectIds().isEmpty());
            assertEquals(List.of(disputeId), resolved.mutatedObjectIds());
            assertEquals(MIN_STAKE, ledger.balanceOf(flagger.address()));
        }

        @Test
        @DisplayName("Replaying a transaction is rejected")
        void testReplay() {
            SignedTransaction signed = creator.sign(builder.register(ORIGINAL, "Original", "", creator.address()));
            assertTrue(ledger.submit(signed).success());
            TransactionReceipt replay = ledger.submit(signed);
            assertFalse(replay.success());
            assertTrue(replay.error().contains("already executed"));
            assertEquals(1, events(EventType.REGISTRATION).size());
        }

        @Test
        @DisplayName("A signature by someone other than the sender is rejected")
        void testForgedSender() {
            UnsignedTransaction tx = builder.register(ORIGINAL, "Original", "", creator.address());
            byte[] txBytes = TransactionCodec.encode(tx);
            ECKeyPair strangerKeys = ECKeyPair.create(Numeric.toBigInt(TestKeys.STRANGER_KEY));
            String signature = TransactionCodec.signatureToHex(Sign.signMessage(txBytes, strangerKeys));

            TransactionReceipt receipt = ledger.submit(new SignedTransaction(tx, txBytes, signature));
            assertFalse(receipt.success());
            assertTrue(receipt.error().contains("does not match sender"));
            assertTrue(events(EventType.REGISTRATION).isEmpty());
        }

        @Test
        @DisplayName("Signers refuse transactions for another sender")
        void testSignerChecksSender() {
            UnsignedTransaction tx = builder.register(ORIGINAL, "Original", "", creator.address());
            assertThrows(IllegalArgumentException.class, () -> stranger.sign(tx));
        }

        @Test
        @DisplayName("Calls into another package are rejected")
        void testWrongPackage() {
            TransactionBuilder other = new TransactionBuilder("0x1");
            TransactionReceipt receipt = ledger.submit(
                    creator.sign(other.register(ORIGINAL, "Original", "", creator.address())));
            assertFalse(receipt.success());
            assertTrue(receipt.error().contains("unknown call target"));
        }

        @Test
        @DisplayName("Aborts and garbage are reported in the receipt")
        void testAbortsReported() {
            String certId = ledger.register(ORIGINAL, "Original", "", creator.address()).id();
            TransactionReceipt lowStake = ledger.submit(flagger.sign(
                    builder.flag(certId, COPY, 4, MIN_STAKE - 1, flagger.address(), null)));
            assertFalse(lowStake.success());
            assertTrue(lowStake.error().contains("minimum"));
            assertTrue(lowStake.primaryObjectId().isEmpty());

            UnsignedTransaction tx = builder.register(ORIGINAL, "Original", "", creator.address());
            SignedTransaction signed = creator.sign(tx);
            TransactionReceipt garbage = ledger.submit(new SignedTransaction(
                    tx, "not json".getBytes(StandardCharsets.UTF_8), signed.signature()));
            assertFalse(garbage.success());
            assertTrue(garbage.error().startsWith("invalid transaction"));
        }
    }
}
