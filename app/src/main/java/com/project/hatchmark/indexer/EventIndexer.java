package com.project.hatchmark.indexer;

import com.project.hatchmark.core.CircuitBreaker;
import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventFeed;
import com.project.hatchmark.ledger.EventPage;
import com.project.hatchmark.ledger.EventType;
import com.project.hatchmark.ledger.RawEvent;
import com.project.hatchmark.store.CursorStore;
import com.project.hatchmark.store.OffchainStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Replicates registry events into the off-chain store.
 *
 * <p>Each {@link EventType} has its own loop, cursor and circuit breaker, so a failing stream
 * never holds back the others. A poll reads the durable cursor, fetches one page after it,
 * upserts every record, and only then saves the new cursor. Any store failure leaves the
 * cursor where it was and the same page is fetched again next time; upserts make the replay
 * harmless. Events that cannot be mapped are logged and skipped.
 *
 * <p>Several indexers may run against the same stores at once: they converge because every
 * write is an idempotent upsert on the object id.
 */
public class EventIndexer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventIndexer.class);

    /**
     * @param pollInterval delay between polls of one event type
     * @param pageSize     maximum events fetched per poll
     * @param stallAlert   how long a cursor may be held back before an alert is logged
     */
    public record Options(Duration pollInterval, int pageSize, Duration stallAlert) {

        public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);
        public static final int DEFAULT_PAGE_SIZE = 50;
        public static final Duration DEFAULT_STALL_ALERT = Duration.ofMinutes(5);

        public Options {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
        }

        public static Options defaults() {
            return new Options(DEFAULT_POLL_INTERVAL, DEFAULT_PAGE_SIZE, DEFAULT_STALL_ALERT);
        }
    }

    private final EventFeed feed;
    private final OffchainStore store;
    private final CursorStore cursors;
    private final EventMapper mapper;
    private final Options options;
    private final Clock clock;
    private final Map<EventType, TypeState> states = new EnumMap<>(EventType.class);

    private ScheduledExecutorService scheduler;

    public EventIndexer(EventFeed feed, OffchainStore store, CursorStore cursors, Options options, Clock clock) {
        this.feed = Objects.requireNonNull(feed, "feed must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cursors = Objects.requireNonNull(cursors, "cursors must not be null");
        this.mapper = new EventMapper(clock);
        this.options = options;
        this.clock = clock;
        for (EventType type : EventType.values()) {
            states.put(type, new TypeState(new CircuitBreaker("indexer-" + type.structName(),
                    3, 1, options.pollInterval().multipliedBy(3), clock), clock.instant()));
        }
    }

    /**
     * Start one polling loop per event type. The first poll runs immediately.
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("indexer already started");
        }
        scheduler = Executors.newScheduledThreadPool(EventType.values().length, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("event-indexer-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
        for (EventType type : EventType.values()) {
            scheduler.scheduleWithFixedDelay(() -> pollSafely(type),
                    0, options.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Indexer started: {} streams, every {} ms, {} events per page",
                EventType.values().length, options.pollInterval().toMillis(), options.pageSize());
    }

    private void pollSafely(EventType type) {
        try {
            pollOnce(type);
        } catch (RuntimeException e) {
            // An escaping exception would cancel the scheduled loop for this type.
            log.error("Unexpected failure polling {}: {}", type.structName(), e.getMessage(), e);
        }
    }

    /**
     * Fetch and persist one page of {@code type}.
     */
    public PollResult pollOnce(EventType type) {
        TypeState state = states.get(type);
        synchronized (state) {
            if (!state.breaker.canExecute()) {
                checkStall(type, state);
                return new PollResult(type, PollResult.Outcome.PAUSED, 0, 0, false);
            }

            EventCursor loaded;
            try {
                loaded = cursors.loadCursor(type).orElse(null);
            } catch (RuntimeException e) {
                return storeFailed(type, state, "loading cursor", e, 0, 0);
            }
            final EventCursor cursor = loaded;
            state.cursor = cursor;

            EventPage page;
            try {
                page = state.breaker.execute(() -> feed.queryEvents(type, cursor, options.pageSize()));
            } catch (RuntimeException e) {
                state.lastError = e.getMessage();
                log.warn("Polling {} after {} failed: {}", type.structName(), cursor, e.getMessage());
                checkStall(type, state);
                return new PollResult(type, PollResult.Outcome.RPC_FAILED, 0, 0, false);
            }

            int persisted = 0;
            int skipped = 0;
            for (RawEvent event : page.data()) {
                try {
                    persist(event);
                    persisted++;
                    log.debug("Indexed {} {}", type.structName(), event.id());
                } catch (MalformedEventException e) {
                    skipped++;
                    log.warn("Skipping {}", e.getMessage());
                } catch (RuntimeException e) {
                    return storeFailed(type, state, "persisting " + event.id(), e, persisted, skipped);
                }
            }

            EventCursor next = page.isEmpty() ? cursor : page.data().get(page.data().size() - 1).id();
            if (next != null && !next.equals(cursor)) {
                boolean advanced;
                try {
                    advanced = cursors.advanceCursor(type, cursor, next);
                } catch (RuntimeException e) {
                    return storeFailed(type, state, "saving cursor " + next, e, persisted, skipped);
                }
                if (advanced) {
                    state.cursor = next;
                    log.info("Indexed {} {} events ({} skipped); cursor now {}",
                            persisted, type.structName(), skipped, next);
                } else {
                    // the page is persisted either way; the cursor already stored stands
                    log.info("{} cursor was moved by another indexer after {}; not overwriting it",
                            type.structName(), cursor);
                }
            }

            state.indexed += persisted;
            state.skipped += skipped;
            state.lastHealthyPoll = clock.instant();
            state.lastError = null;
            if (state.alerted) {
                log.info("{} cursor is advancing again", type.structName());
                state.alerted = false;
            }
            return new PollResult(type, PollResult.Outcome.OK, persisted, skipped, page.hasNextPage());
        }
    }

    /**
     * Poll every type until its feed is exhausted or a poll fails. For one-shot backfills.
     *
     * @return records persisted per type
     */
    public Map<EventType, Integer> drain() {
        Map<EventType, Integer> totals = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            int total = 0;
            PollResult result;
            do {
                result = pollOnce(type);
                total += result.persisted();
            } while (result.isOk() && result.hasMore());
            totals.put(type, total);
            if (!result.isOk()) {
                log.warn("Draining {} stopped: {}", type.structName(), result.outcome());
            }
        }
        return totals;
    }

    public Map<EventType, IndexerStatus> status() {
        Map<EventType, IndexerStatus> snapshot = new EnumMap<>(EventType.class);
        states.forEach((type, state) -> {
            synchronized (state) {
                snapshot.put(type, new IndexerStatus(type, state.cursor, state.indexed, state.skipped,
                        state.lastHealthyPoll, state.lastError, state.breaker.getState(), state.alerted));
            }
        });
        return snapshot;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Indexer threads did not stop within 5 s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    private void persist(RawEvent event) {
        switch (event.type()) {
            case REGISTRATION:
                store.upsertRegistration(mapper.toRegistration(event));
                break;
            case DISPUTE:
                store.upsertDispute(mapper.toDispute(event));
                break;
            case DISPUTE_RESOLVED:
                store.upsertResolution(mapper.toResolution(event));
                break;
            default:
                throw new IllegalStateException("unhandled event type " + event.type());
        }
    }

    private PollResult storeFailed(EventType type, TypeState state, String action, RuntimeException e,
                                   int persisted, int skipped) {
        state.indexed += persisted;
        state.skipped += skipped;
        state.lastError = e.getMessage();
        log.warn("Holding {} cursor at {}: failed {}: {}", type.structName(), state.cursor, action, e.getMessage());
        checkStall(type, state);
        return new PollResult(type, PollResult.Outcome.STORE_FAILED, persisted, skipped, false);
    }

    private void checkStall(EventType type, TypeState state) {
        Duration held = Duration.between(state.lastHealthyPoll, clock.instant());
        if (!state.alerted && held.compareTo(options.stallAlert()) >= 0) {
            state.alerted = true;
            log.error("ALERT: {} cursor stuck at {} for {} s; last error: {}",
                    type.structName(), state.cursor, held.toSeconds(), state.lastError);
        }
    }

    private static final class TypeState {
        final CircuitBreaker breaker;
        EventCursor cursor;
        long indexed;
        long skipped;
        Instant lastHealthyPoll;
        String lastError;
        boolean alerted;

        TypeState(CircuitBreaker breaker, Instant startedAt) {
            this.breaker = breaker;
            this.lastHealthyPoll = startedAt;
        }
    }
}
