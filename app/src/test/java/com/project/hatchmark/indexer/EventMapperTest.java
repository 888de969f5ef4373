package com.project.hatchmark.indexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.hatchmark.core.MutableClock;
import com.project.hatchmark.ledger.DisputeStatus;
import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;
import com.project.hatchmark.ledger.RawEvent;
import com.project.hatchmark.store.DisputeRecord;
import com.project.hatchmark.store.RegistrationRecord;
import com.project.hatchmark.store.ResolutionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Event mapping")
class EventMapperTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00.123456Z");

    private final EventMapper mapper = new EventMapper(new MutableClock(NOW));

    private static RawEvent event(EventType type, ObjectNode payload) {
        return new RawEvent(new EventCursor("Dg7", 0), type, payload, 1_600_000_000_000L);
    }

    @Test
    @DisplayName("Registration events accept byte-array hashes and wrapped ids")
    void testRegistration() {
        ObjectNode payload = JSON.createObjectNode();
        payload.putObject("cert_id").put("id", "0xC1");
        payload.putArray("image_hash").add(0).add(0).add(0).add(0).add(0).add(0).add(0).add(255);
        payload.put("creator", "0xAAAA");
        payload.put("timestamp", "1700000000000");
        payload.put("title", "Harbour");

        RegistrationRecord record = mapper.toRegistration(event(EventType.REGISTRATION, payload));

        assertEquals("0xc1", record.certId());
        assertEquals("00000000000000ff", record.imageHash());
        assertEquals("0xaaaa", record.creator());
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), record.createdAt());
        assertEquals("", record.description());
        assertEquals("Dg7", record.txDigest());
        assertEquals(Instant.parse("2025-03-01T12:00:00.123Z"), record.syncedAt());
    }

    @Test
    @DisplayName("Missing payload timestamps fall back to the event timestamp")
    void testTimestampFallback() {
        ObjectNode payload = JSON.createObjectNode()
                .put("cert_id", "0xc1")
                .put("image_hash", "0x00000000000000FF")
                .put("creator", "0xaaaa");
        RegistrationRecord record = mapper.toRegistration(event(EventType.REGISTRATION, payload));
        assertEquals(Instant.ofEpochMilli(1_600_000_000_000L), record.createdAt());
    }

    @Test
    @DisplayName("Disputes start open; scores beyond one byte are malformed")
    void testDispute() {
        ObjectNode payload = JSON.createObjectNode()
                .put("dispute_id", "0xe1")
                .put("original_cert_id", "0xc1")
                .put("flagged_hash", "000000000000000f")
                .put("flagger", "0xbbbb")
                .put("similarity_score", 4)
                .put("stake", "100000000");
        DisputeRecord record = mapper.toDispute(event(EventType.DISPUTE, payload));
        assertEquals(DisputeStatus.OPEN, record.status());
        assertEquals(4, record.similarityScore());
        assertEquals(100_000_000L, record.stake());

        payload.put("similarity_score", 300);
        assertThrows(MalformedEventException.class, () -> mapper.toDispute(event(EventType.DISPUTE, payload)));
    }

    @Test
    @DisplayName("Resolutions must carry a terminal status")
    void testResolution() {
        ObjectNode payload = JSON.createObjectNode()
                .put("dispute_id", "0xe1")
                .put("original_cert_id", "0xc1")
                .put("status", 2)
                .put("resolver", "0xAAAA")
                .put("stake_recipient", "0xaaaa");
        ResolutionRecord record = mapper.toResolution(event(EventType.DISPUTE_RESOLVED, payload));
        assertEquals(DisputeStatus.INVALID, record.status());
        assertEquals("0xaaaa", record.resolver());

        payload.put("status", 0);
        assertThrows(MalformedEventException.class,
                () -> mapper.toResolution(event(EventType.DISPUTE_RESOLVED, payload)));
        payload.put("status", 7);
        assertThrows(MalformedEventException.class,
                () -> mapper.toResolution(event(EventType.DISPUTE_RESOLVED, payload)));
    }

    @Test
    @DisplayName("Missing required fields are malformed, not crashes")
    void testMissingFields() {
        ObjectNode payload = JSON.createObjectNode().put("cert_id", "0xc1");
        MalformedEventException e = assertThrows(MalformedEventException.class,
                () -> mapper.toRegistration(event(EventType.REGISTRATION, payload)));
        assertTrue(e.getMessage().contains("RegistrationEvent"));
        assertNotNull(e.event());
    }
}
