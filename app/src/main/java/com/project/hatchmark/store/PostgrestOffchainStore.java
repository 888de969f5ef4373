package com.project.hatchmark.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.hatchmark.core.CircuitBreaker;
import com.project.hatchmark.core.RetryPolicy;
import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Store backed by a PostgREST endpoint (Supabase-style {@code /rest/v1/<table>}).
 *
 * <p>Upserts are {@code POST ?on_conflict=<pk>} with {@code Prefer: resolution=merge-duplicates}.
 * Transport failures, 5xx and 429 responses are retried with backoff; every call goes through
 * one circuit breaker. Other 4xx responses fail immediately.
 */
public class PostgrestOffchainStore implements OffchainStore, CursorStore {

    private static final Logger log = LoggerFactory.getLogger(PostgrestOffchainStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final HttpUrl baseUrl;
    private final String apiKey;
    private final OkHttpClient httpClient;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public PostgrestOffchainStore(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, defaultHttpClient(), RetryPolicy.defaults(),
                new CircuitBreaker("store-rest"), Clock.systemUTC());
    }

    public PostgrestOffchainStore(String baseUrl, String apiKey, OkHttpClient httpClient,
                                  RetryPolicy retryPolicy, CircuitBreaker circuitBreaker, Clock clock) {
        HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid store URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .callTimeout(Duration.ofSeconds(30))
                .build();
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    // ----- Upserts -----

    @Override
    public void upsertRegistration(RegistrationRecord record) {
        Optional<RegistrationRecord> existing = findRegistration(record.certId());
        if (record.sameContentAs(existing.orElse(null))) {
            return;
        }
        upsert(StoreSchema.REGISTRATIONS, "cert_id", record);
    }

    @Override
    public void upsertDispute(DisputeRecord record) {
        DisputeRecord effective = findResolution(record.disputeId())
                .map(resolution -> record.withStatus(resolution.status()))
                .orElse(record);
        if (effective.sameContentAs(findDispute(record.disputeId()).orElse(null))) {
            return;
        }
        upsert(StoreSchema.DISPUTES, "dispute_id", effective);
    }

    @Override
    public void upsertResolution(ResolutionRecord record) {
        if (!record.sameContentAs(findResolution(record.disputeId()).orElse(null))) {
            upsert(StoreSchema.RESOLUTIONS, "dispute_id", record);
        }
        HttpUrl url = table(StoreSchema.DISPUTES).newBuilder()
                .addQueryParameter("dispute_id", "eq." + record.disputeId())
                .addQueryParameter("status", "neq." + record.status().code())
                .build();
        Map<String, Object> patch = Map.of("status", record.status().code());
        execute("PATCH disputes status " + record.disputeId(), authorized(url)
                .header("Prefer", "return=minimal")
                .patch(RequestBody.create(write(patch), JSON))
                .build());
    }

    private void upsert(String table, String conflictColumn, Object row) {
        HttpUrl url = table(table).newBuilder()
                .addQueryParameter("on_conflict", conflictColumn)
                .build();
        execute("upsert " + table, authorized(url)
                .header("Prefer", "resolution=merge-duplicates,return=minimal")
                .post(RequestBody.create(write(List.of(row)), JSON))
                .build());
    }

    // ----- Queries -----

    @Override
    public Optional<RegistrationRecord> findRegistration(String certId) {
        return first(select(StoreSchema.REGISTRATIONS, Map.of("cert_id", "eq." + certId), null,
                new TypeReference<List<RegistrationRecord>>() { }));
    }

    @Override
    public Optional<DisputeRecord> findDispute(String disputeId) {
        return first(select(StoreSchema.DISPUTES, Map.of("dispute_id", "eq." + disputeId), null,
                new TypeReference<List<DisputeRecord>>() { }));
    }

    @Override
    public Optional<ResolutionRecord> findResolution(String disputeId) {
        return first(select(StoreSchema.RESOLUTIONS, Map.of("dispute_id", "eq." + disputeId), null,
                new TypeReference<List<ResolutionRecord>>() { }));
    }

    @Override
    public List<RegistrationRecord> listRegistrations() {
        return select(StoreSchema.REGISTRATIONS, Map.of(), "created_at.asc,cert_id.asc",
                new TypeReference<List<RegistrationRecord>>() { });
    }

    @Override
    public List<RegistrationRecord> registrationsByCreator(String creator) {
        return select(StoreSchema.REGISTRATIONS, Map.of("creator", "eq." + creator.toLowerCase(Locale.ROOT)),
                "created_at.asc,cert_id.asc", new TypeReference<List<RegistrationRecord>>() { });
    }

    @Override
    public List<DisputeRecord> disputesForCertificate(String certId) {
        return select(StoreSchema.DISPUTES, Map.of("original_cert_id", "eq." + certId),
                "created_at.asc,dispute_id.asc", new TypeReference<List<DisputeRecord>>() { });
    }

    // ----- Cursors -----

    @Override
    public Optional<EventCursor> loadCursor(EventType type) {
        List<JsonNode> rows = select(StoreSchema.CURSORS, Map.of("event_type", "eq." + type.name()), null,
                new TypeReference<List<JsonNode>>() { });
        return first(rows).map(row -> new EventCursor(row.path("tx_digest").asText(), row.path("event_seq").asLong()));
    }

    @Override
    public boolean advanceCursor(EventType type, EventCursor expected, EventCursor next) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_type", type.name());
        row.put("tx_digest", next.txDigest());
        row.put("event_seq", next.eventSeq());
        row.put("updated_at", clock.millis());
        if (expected == null) {
            try {
                execute("insert cursor " + type, authorized(table(StoreSchema.CURSORS))
                        .header("Prefer", "return=minimal")
                        .post(RequestBody.create(write(List.of(row)), JSON))
                        .build());
                return true;
            } catch (ConflictException e) {
                return false;
            }
        }
        HttpUrl url = table(StoreSchema.CURSORS).newBuilder()
                .addQueryParameter("event_type", "eq." + type.name())
                .addQueryParameter("tx_digest", "eq." + expected.txDigest())
                .addQueryParameter("event_seq", "eq." + expected.eventSeq())
                .build();
        String body = execute("advance cursor " + type, authorized(url)
                .header("Prefer", "return=representation")
                .patch(RequestBody.create(write(row), JSON))
                .build());
        try {
            return !MAPPER.readValue(body, new TypeReference<List<JsonNode>>() { }).isEmpty();
        } catch (IOException e) {
            throw new StoreException("Malformed response from " + StoreSchema.CURSORS + ": " + e.getMessage(), e);
        }
    }

    // ----- HTTP -----

    private <T> List<T> select(String table, Map<String, String> filters, String order,
                               TypeReference<List<T>> type) {
        HttpUrl.Builder url = table(table).newBuilder().addQueryParameter("select", "*");
        filters.forEach(url::addQueryParameter);
        if (order != null) {
            url.addQueryParameter("order", order);
        }
        String body = execute("select " + table, authorized(url.build()).get().build());
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new StoreException("Malformed response from " + table + ": " + e.getMessage(), e);
        }
    }

    private String execute(String description, Request request) {
        if (!circuitBreaker.canExecute()) {
            throw new StoreException("Store circuit breaker '" + circuitBreaker.getName()
                    + "' is OPEN - " + description + " not attempted");
        }
        try {
            String body = retryPolicy.execute(description, () -> call(request),
                    e -> e instanceof TransientStoreException);
            circuitBreaker.recordSuccess();
            return body;
        } catch (TransientStoreException e) {
            circuitBreaker.recordFailure();
            throw new StoreException(description + " failed: " + e.getMessage(), e);
        }
    }

    private String call(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody == null ? "" : responseBody.string();
            if (response.isSuccessful()) {
                return body;
            }
            String message = "store API error " + response.code() + ": " + body;
            if (response.code() >= 500 || response.code() == 429) {
                throw new TransientStoreException(message, null);
            }
            if (response.code() == 409) {
                throw new ConflictException(message);
            }
            log.warn("{} {} rejected: {}", request.method(), request.url().encodedPath(), message);
            throw new StoreException(message);
        } catch (IOException e) {
            throw new TransientStoreException(e.getMessage(), e);
        }
    }

    private Request.Builder authorized(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey);
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private HttpUrl table(String table) {
        return baseUrl.newBuilder().addPathSegments("rest/v1").addPathSegment(table).build();
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new StoreException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static final class TransientStoreException extends StoreException {
        TransientStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class ConflictException extends StoreException {
        ConflictException(String message) {
            super(message);
        }
    }
}
