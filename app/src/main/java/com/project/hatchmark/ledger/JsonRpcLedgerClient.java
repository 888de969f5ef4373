package com.project.hatchmark.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.hatchmark.core.InputValidator;
import com.project.hatchmark.core.LedgerException;
import com.project.hatchmark.core.RetryPolicy;
import com.project.hatchmark.fingerprint.Fingerprint;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.exceptions.ClientConnectionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JSON-RPC client for a remote registry deployment.
 *
 * <p>Reads ({@code suix_queryEvents}, {@code sui_getObject}) are idempotent and retried with
 * backoff on transport failures. {@code sui_executeTransactionBlock} is sent once; whether to
 * resend after a transport failure is the caller's decision.
 */
public class JsonRpcLedgerClient implements EventFeed, RegistryReader, TransactionSubmitter, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcLedgerClient.class);

    private static final String CERTIFICATE_STRUCT = "RegistrationCertificate";
    private static final String DISPUTE_STRUCT = "Dispute";

    private final HttpService service;
    private final String packageId;
    private final RetryPolicy readRetry;

    public JsonRpcLedgerClient(String rpcUrl, String packageId) {
        this(rpcUrl, packageId, defaultHttpClient(), RetryPolicy.defaults());
    }

    public JsonRpcLedgerClient(String rpcUrl, String packageId, OkHttpClient httpClient, RetryPolicy readRetry) {
        this.service = new HttpService(rpcUrl, httpClient);
        this.packageId = InputValidator.validateObjectId(packageId, "packageId");
        this.readRetry = readRetry;
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .callTimeout(Duration.ofSeconds(60))
                .build();
    }

    /**
     * Result holder; web3j binds the {@code result} member to the type parameter.
     */
    public static class JsonNodeResponse extends Response<JsonNode> {
    }

    // ----- EventFeed -----

    @Override
    public EventPage queryEvents(EventType type, EventCursor after, int limit) {
        Map<String, Object> filter = Map.of("MoveEventType", type.qualifiedName(packageId));
        Object cursor = after == null ? null : cursorParam(after);
        JsonNode result = readRetry.execute("suix_queryEvents " + type.structName(),
                () -> call("suix_queryEvents", Arrays.<Object>asList(filter, cursor, limit, false)),
                JsonRpcLedgerClient::isRetryable);

        List<RawEvent> events = new ArrayList<>();
        for (JsonNode node : result.path("data")) {
            events.add(new RawEvent(
                    parseCursor(node.get("id")),
                    type,
                    node.path("parsedJson"),
                    node.hasNonNull("timestampMs") ? MoveValues.u64(node.get("timestampMs"), "timestampMs") : 0L));
        }
        JsonNode next = result.get("nextCursor");
        EventCursor nextCursor = next == null || next.isNull() ? after : parseCursor(next);
        return new EventPage(events, nextCursor, result.path("hasNextPage").asBoolean(false));
    }

    // ----- RegistryReader -----

    @Override
    public Optional<Certificate> getCertificate(String certId) {
        return getObjectFields(certId, CERTIFICATE_STRUCT).map(fields -> new Certificate(
                MoveValues.objectId(fields.get("id"), "id"),
                Fingerprint.parse(MoveValues.bytesHex(fields.get("image_hash"), "image_hash")),
                MoveValues.text(fields.get("creator"), "creator").toLowerCase(Locale.ROOT),
                Instant.ofEpochMilli(MoveValues.u64(fields.get("created_at"), "created_at")),
                MoveValues.optionalText(fields.get("title")),
                MoveValues.optionalText(fields.get("description"))));
    }

    @Override
    public Optional<Dispute> getDispute(String disputeId) {
        return getObjectFields(disputeId, DISPUTE_STRUCT).map(fields -> new Dispute(
                MoveValues.objectId(fields.get("id"), "id"),
                MoveValues.objectId(fields.get("original_cert_id"), "original_cert_id"),
                Fingerprint.parse(MoveValues.bytesHex(fields.get("flagged_hash"), "flagged_hash")),
                MoveValues.text(fields.get("flagger"), "flagger").toLowerCase(Locale.ROOT),
                (int) MoveValues.u64(fields.get("similarity_score"), "similarity_score"),
                DisputeStatus.fromCode((int) MoveValues.u64(fields.get("status"), "status")),
                MoveValues.u64(fields.get("stake"), "stake"),
                Instant.ofEpochMilli(MoveValues.u64(fields.get("created_at"), "created_at")),
                fields.hasNonNull("version") ? MoveValues.u64(fields.get("version"), "version") : 0L));
    }

    private Optional<JsonNode> getObjectFields(String objectId, String struct) {
        String id = InputValidator.validateObjectId(objectId, "objectId");
        JsonNode result = readRetry.execute("sui_getObject " + id,
                () -> call("sui_getObject", List.<Object>of(id, Map.of("showContent", true))),
                JsonRpcLedgerClient::isRetryable);
        JsonNode data = result.get("data");
        if (data == null || data.isNull()) {
            log.debug("Object {} not found: {}", id, result.path("error"));
            return Optional.empty();
        }
        JsonNode content = data.path("content");
        String type = content.path("type").asText("");
        if (!type.endsWith("::" + EventType.MODULE + "::" + struct)) {
            throw LedgerException.rejected("object " + id + " is a " + type + ", expected " + struct);
        }
        JsonNode fields = content.path("fields").deepCopy();
        if (fields.isObject() && data.hasNonNull("version")) {
            ((ObjectNode) fields).set("version", data.get("version"));
        }
        return Optional.of(fields);
    }

    // ----- TransactionSubmitter -----

    @Override
    public TransactionReceipt submit(SignedTransaction transaction) {
        String txBytes = Base64.getEncoder().encodeToString(transaction.txBytes());
        String signature = Base64.getEncoder().encodeToString(
                Numeric.hexStringToByteArray(transaction.signature()));
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("showEffects", true);
        options.put("showEvents", true);
        options.put("showObjectChanges", true);

        JsonNode result = call("sui_executeTransactionBlock",
                List.<Object>of(txBytes, List.of(signature), options, "WaitForLocalExecution"));

        String digest = result.path("digest").asText();
        JsonNode status = result.path("effects").path("status");
        if (!"success".equals(status.path("status").asText())) {
            String error = status.path("error").asText("transaction failed");
            log.info("Transaction {} ({}) aborted on-chain: {}", digest, transaction.transaction().function(), error);
            return TransactionReceipt.failure(digest, error);
        }

        List<String> created = new ArrayList<>();
        List<String> mutated = new ArrayList<>();
        String registryPrefix = "::" + EventType.MODULE + "::";
        for (JsonNode change : result.path("objectChanges")) {
            if (!change.path("objectType").asText("").contains(registryPrefix)) {
                continue;
            }
            String objectId = change.path("objectId").asText().toLowerCase(Locale.ROOT);
            switch (change.path("type").asText()) {
                case "created":
                    created.add(objectId);
                    break;
                case "mutated":
                    mutated.add(objectId);
                    break;
                default:
                    break;
            }
        }
        return new TransactionReceipt(digest, true, null, created, mutated);
    }

    // ----- Transport -----

    private JsonNode call(String method, List<Object> params) {
        JsonNodeResponse response;
        try {
            response = new Request<>(method, params, service, JsonNodeResponse.class).send();
        } catch (ClientConnectionException e) {
            // non-2xx HTTP status from the node
            throw LedgerException.transport(method + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw LedgerException.transport(method + " failed: " + e.getMessage(), e);
        }
        if (response.hasError()) {
            Response.Error error = response.getError();
            throw LedgerException.rejected(
                    String.format("%s rejected (%d): %s", method, error.getCode(), error.getMessage()));
        }
        if (response.getResult() == null) {
            throw LedgerException.rejected(method + " returned no result");
        }
        return response.getResult();
    }

    private static boolean isRetryable(RuntimeException e) {
        return e instanceof LedgerException && ((LedgerException) e).isRetryable();
    }

    private static Map<String, Object> cursorParam(EventCursor cursor) {
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("txDigest", cursor.txDigest());
        param.put("eventSeq", Long.toString(cursor.eventSeq()));
        return param;
    }

    private static EventCursor parseCursor(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw LedgerException.rejected("event id is missing or malformed: " + node);
        }
        return new EventCursor(
                MoveValues.text(node.get("txDigest"), "txDigest"),
                MoveValues.u64(node.get("eventSeq"), "eventSeq"));
    }

    @Override
    public void close() throws IOException {
        service.close();
    }
}
