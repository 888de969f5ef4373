package com.project.hatchmark.config;

import com.project.hatchmark.core.TransactionRequestService;
import com.project.hatchmark.core.VerificationService;
import com.project.hatchmark.fingerprint.PerceptualHasher;
import com.project.hatchmark.indexer.EventIndexer;
import com.project.hatchmark.ledger.EventFeed;
import com.project.hatchmark.ledger.InProcessRegistryLedger;
import com.project.hatchmark.ledger.JsonRpcLedgerClient;
import com.project.hatchmark.ledger.RegistryReader;
import com.project.hatchmark.ledger.TransactionBuilder;
import com.project.hatchmark.ledger.TransactionSubmitter;
import com.project.hatchmark.store.CursorStore;
import com.project.hatchmark.store.InMemoryOffchainStore;
import com.project.hatchmark.store.JdbcOffchainStore;
import com.project.hatchmark.store.OffchainStore;
import com.project.hatchmark.store.PostgrestOffchainStore;
import com.project.hatchmark.workflow.ClientWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Wires ledger, store and services for one process according to a {@link HatchmarkConfig}.
 */
public class HatchmarkRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HatchmarkRuntime.class);

    private final HatchmarkConfig config;
    private final Clock clock;
    private final String packageId;
    private final OffchainStore store;
    private final CursorStore cursors;
    private final EventFeed feed;
    private final RegistryReader registry;
    private final TransactionSubmitter submitter;
    private final InProcessRegistryLedger localLedger;
    private final VerificationService verification;
    private final TransactionRequestService requests;

    public HatchmarkRuntime(HatchmarkConfig config) {
        this(config, Clock.systemUTC());
    }

    public HatchmarkRuntime(HatchmarkConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.packageId = config.resolvePackageId();

        switch (config.storeKind()) {
            case JDBC: {
                JdbcOffchainStore jdbc = JdbcOffchainStore.open(config.storeJdbcUrl());
                this.store = jdbc;
                this.cursors = jdbc;
                break;
            }
            case REST: {
                PostgrestOffchainStore rest = new PostgrestOffchainStore(
                        config.storeRestUrl().orElseThrow(), config.storeRestKey().orElse(null));
                this.store = rest;
                this.cursors = rest;
                break;
            }
            default: {
                InMemoryOffchainStore memory = new InMemoryOffchainStore();
                this.store = memory;
                this.cursors = memory;
                break;
            }
        }

        if (config.usesInProcessLedger()) {
            this.localLedger = new InProcessRegistryLedger(packageId, config.minimumStake(), clock);
            this.feed = localLedger;
            this.registry = localLedger;
            this.submitter = localLedger;
        } else {
            JsonRpcLedgerClient client = new JsonRpcLedgerClient(config.ledgerRpcUrl().get(), packageId);
            this.localLedger = null;
            this.feed = client;
            this.registry = client;
            this.submitter = client;
        }

        this.verification = new VerificationService(store, config.verifyThreshold(), config.registerThreshold());
        this.requests = new TransactionRequestService(verification, registry,
                new TransactionBuilder(packageId), config.minimumStake());
        log.info("Runtime ready: network={}, ledger={}, package={}, store={}",
                config.network(), config.ledgerRpcUrl().orElse("in-process"), packageId, config.storeKind());
    }

    public HatchmarkConfig config() {
        return config;
    }

    public String packageId() {
        return packageId;
    }

    public OffchainStore store() {
        return store;
    }

    public CursorStore cursors() {
        return cursors;
    }

    public EventFeed feed() {
        return feed;
    }

    public RegistryReader registry() {
        return registry;
    }

    public TransactionSubmitter submitter() {
        return submitter;
    }

    /**
     * The in-process ledger, when no RPC endpoint is configured.
     */
    public Optional<InProcessRegistryLedger> localLedger() {
        return Optional.ofNullable(localLedger);
    }

    public VerificationService verification() {
        return verification;
    }

    public TransactionRequestService requests() {
        return requests;
    }

    public EventIndexer newIndexer() {
        return new EventIndexer(feed, store, cursors, config.indexerOptions(), clock);
    }

    public ClientWorkflow newWorkflow() {
        return new ClientWorkflow(new PerceptualHasher(), verification, requests, submitter, store,
                config.workflowOptions());
    }

    @Override
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                log.warn("Failed to close store: {}", e.getMessage());
            }
        }
        if (feed instanceof Closeable) {
            try {
                ((Closeable) feed).close();
            } catch (IOException e) {
                log.warn("Failed to close ledger client: {}", e.getMessage());
            }
        }
    }
}
