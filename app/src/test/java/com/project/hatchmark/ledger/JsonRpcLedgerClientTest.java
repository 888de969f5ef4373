package com.project.hatchmark.ledger;

import com.project.hatchmark.core.LedgerException;
import com.project.hatchmark.core.RetryPolicy;
import com.project.hatchmark.fingerprint.Fingerprint;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON-RPC ledger client")
class JsonRpcLedgerClientTest {

    private static final String PACKAGE = "0xabc";

    private MockWebServer server;
    private JsonRpcLedgerClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new JsonRpcLedgerClient(server.url("/").toString(), PACKAGE,
                new OkHttpClient(), new RetryPolicy(3, 0, 0));
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    private void enqueueResult(String resultJson) {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}"));
    }

    @Nested
    @DisplayName("Event queries")
    class Events {

        @Test
        @DisplayName("Filters by the qualified event type and parses the page")
        void testQueryEvents() throws InterruptedException {
            enqueueResult("{\"data\":[{\"id\":{\"txDigest\":\"Dg1\",\"eventSeq\":\"0\"},"
                    + "\"parsedJson\":{\"cert_id\":\"0xc1\",\"image_hash\":[0,0,0,0,0,0,0,15]},"
                    + "\"timestampMs\":\"1700000000000\"}],"
                    + "\"nextCursor\":{\"txDigest\":\"Dg1\",\"eventSeq\":\"0\"},\"hasNextPage\":true}");

            EventPage page = client.queryEvents(EventType.REGISTRATION, new EventCursor("Dg0", 3), 25);

            assertEquals(1, page.data().size());
            RawEvent event = page.data().get(0);
            assertEquals(new EventCursor("Dg1", 0), event.id());
            assertEquals(1700000000000L, event.timestampMs());
            assertEquals("0xc1", event.parsedJson().get("cert_id").asText());
            assertEquals(new EventCursor("Dg1", 0), page.nextCursor());
            assertTrue(page.hasNextPage());

            RecordedRequest request = server.takeRequest();
            String body = request.getBody().readUtf8();
            assertTrue(body.contains("\"suix_queryEvents\""));
            assertTrue(body.contains("0xabc::registry::RegistrationEvent"));
            assertTrue(body.contains("\"txDigest\":\"Dg0\""));
            assertTrue(body.contains("\"eventSeq\":\"3\""));
        }

        @Test
        @DisplayName("An empty page keeps the query cursor")
        void testEmptyPage() {
            enqueueResult("{\"data\":[],\"nextCursor\":null,\"hasNextPage\":false}");
            EventCursor after = new EventCursor("Dg0", 3);
            EventPage page = client.queryEvents(EventType.DISPUTE, after, 25);
            assertTrue(page.isEmpty());
            assertEquals(after, page.nextCursor());
        }

        @Test
        @DisplayName("Transport failures are retried")
        void testRetriesTransportFailures() {
            server.enqueue(new MockResponse().setResponseCode(503));
            enqueueResult("{\"data\":[],\"nextCursor\":null,\"hasNextPage\":false}");

            assertTrue(client.queryEvents(EventType.REGISTRATION, null, 10).isEmpty());
            assertEquals(2, server.getRequestCount());
        }

        @Test
        @DisplayName("RPC errors are not retried")
        void testRpcErrorNotRetried() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"Invalid params\"}}"));

            LedgerException e = assertThrows(LedgerException.class,
                    () -> client.queryEvents(EventType.REGISTRATION, null, 10));
            assertFalse(e.isRetryable());
            assertTrue(e.getMessage().contains("Invalid params"));
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("Retries give up after the last attempt")
        void testRetriesExhausted() {
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(500));
            }
            LedgerException e = assertThrows(LedgerException.class,
                    () -> client.queryEvents(EventType.REGISTRATION, null, 10));
            assertTrue(e.isRetryable());
            assertEquals(3, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Object reads")
    class ObjectReads {

        @Test
        @DisplayName("Reads a certificate from its Move fields")
        void testGetCertificate() {
            enqueueResult("{\"data\":{\"objectId\":\"0xC1\",\"version\":\"7\",\"content\":{"
                    + "\"type\":\"0xabc::registry::RegistrationCertificate\",\"fields\":{"
                    + "\"id\":{\"id\":\"0xC1\"},\"image_hash\":[0,0,0,0,0,0,0,15],"
                    + "\"creator\":\"0xAAAA\",\"created_at\":\"1700000000000\","
                    + "\"title\":\"Harbour\",\"description\":null}}}}");

            Certificate certificate = client.getCertificate("0xc1").orElseThrow();

            assertEquals("0xc1", certificate.id());
            assertEquals(Fingerprint.parse("000000000000000f"), certificate.imageHash());
            assertEquals("0xaaaa", certificate.creator());
            assertEquals(Instant.ofEpochMilli(1700000000000L), certificate.createdAt());
            assertEquals("Harbour", certificate.title());
            assertEquals("", certificate.description());
        }

        @Test
        @DisplayName("Reads a dispute, taking the version from the object")
        void testGetDispute() {
            enqueueResult("{\"data\":{\"objectId\":\"0xd1\",\"version\":\"9\",\"content\":{"
                    + "\"type\":\"0xabc::registry::Dispute\",\"fields\":{"
                    + "\"id\":{\"id\":\"0xd1\"},\"original_cert_id\":\"0xc1\","
                    + "\"flagged_hash\":\"0x000000000000000F\",\"flagger\":\"0xbbbb\","
                    + "\"similarity_score\":4,\"status\":2,\"stake\":\"100000000\","
                    + "\"created_at\":\"1700000000000\"}}}}");

            Dispute dispute = client.getDispute("0xd1").orElseThrow();

            assertEquals("0xc1", dispute.originalCertId());
            assertEquals("000000000000000f", dispute.flaggedHash().hex());
            assertEquals(4, dispute.similarityScore());
            assertEquals(DisputeStatus.INVALID, dispute.status());
            assertEquals(100_000_000L, dispute.stake());
            assertEquals(9L, dispute.version());
        }

        @Test
        @DisplayName("Missing objects are empty; objects of another type are an error")
        void testMissingAndMistyped() {
            enqueueResult("{\"error\":{\"code\":\"notExists\",\"object_id\":\"0xc9\"}}");
            assertEquals(Optional.empty(), client.getCertificate("0xc9"));

            enqueueResult("{\"data\":{\"content\":{\"type\":\"0xabc::registry::Dispute\",\"fields\":{}}}}");
            assertThrows(LedgerException.class, () -> client.getCertificate("0xd1"));
        }
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        private SignedTransaction signed() {
            KeyPairSigner creator = TestKeys.creator();
            return creator.sign(new TransactionBuilder(PACKAGE).register(
                    Fingerprint.parse("000000000000000f"), "Harbour", "", creator.address()));
        }

        @Test
        @DisplayName("Reports registry objects created by the transaction")
        void testSuccess() throws InterruptedException {
            enqueueResult("{\"digest\":\"TxD1\",\"effects\":{\"status\":{\"status\":\"success\"}},"
                    + "\"objectChanges\":["
                    + "{\"type\":\"mutated\",\"objectType\":\"0x2::coin::Coin<0x2::sui::SUI>\",\"objectId\":\"0x5\"},"
                    + "{\"type\":\"created\",\"objectType\":\"0xabc::registry::RegistrationCertificate\",\"objectId\":\"0xC1\"}]}");

            TransactionReceipt receipt = client.submit(signed());

            assertTrue(receipt.success());
            assertEquals("TxD1", receipt.digest());
            assertEquals(List.of("0xc1"), receipt.createdObjectIds());
            assertTrue(receipt.mutatedObjectIds().isEmpty());

            String body = server.takeRequest().getBody().readUtf8();
            assertTrue(body.contains("\"sui_executeTransactionBlock\""));
            assertTrue(body.contains("WaitForLocalExecution"));
        }

        @Test
        @DisplayName("An on-chain abort becomes a failed receipt")
        void testAbort() {
            enqueueResult("{\"digest\":\"TxD2\",\"effects\":{\"status\":{\"status\":\"failure\","
                    + "\"error\":\"MoveAbort(registry::flag_content, 2)\"}}}");

            TransactionReceipt receipt = client.submit(signed());

            assertFalse(receipt.success());
            assertEquals("MoveAbort(registry::flag_content, 2)", receipt.error());
        }

        @Test
        @DisplayName("Submission is sent once even on transport failure")
        void testNoResend() {
            server.enqueue(new MockResponse().setResponseCode(502));
            LedgerException e = assertThrows(LedgerException.class, () -> client.submit(signed()));
            assertTrue(e.isRetryable());
            assertEquals(1, server.getRequestCount());
        }
    }
}
