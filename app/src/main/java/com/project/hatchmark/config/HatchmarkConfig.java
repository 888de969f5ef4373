package com.project.hatchmark.config;

import com.project.hatchmark.core.RetryPolicy;
import com.project.hatchmark.indexer.EventIndexer;
import com.project.hatchmark.ledger.InProcessRegistryLedger;
import com.project.hatchmark.match.SimilarityMatcher;
import com.project.hatchmark.workflow.ClientWorkflow;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Process configuration, read from environment variables.
 *
 * <table>
 *   <caption>Variables</caption>
 *   <tr><td>HATCHMARK_NETWORK</td><td>testnet</td></tr>
 *   <tr><td>LEDGER_RPC_URL</td><td>unset: in-process ledger</td></tr>
 *   <tr><td>PACKAGE_ID</td><td>from deployments/&lt;network&gt;.json, else 0x0</td></tr>
 *   <tr><td>STORE_KIND</td><td>memory | jdbc | rest (memory)</td></tr>
 *   <tr><td>STORE_JDBC_URL</td><td>jdbc:h2:file:./data/hatchmark;AUTO_SERVER=TRUE</td></tr>
 *   <tr><td>STORE_REST_URL, STORE_REST_KEY</td><td>required for rest</td></tr>
 *   <tr><td>INDEXER_POLL_INTERVAL_MS</td><td>10000</td></tr>
 *   <tr><td>INDEXER_PAGE_SIZE</td><td>50</td></tr>
 *   <tr><td>INDEXER_STALL_ALERT_MS</td><td>300000</td></tr>
 *   <tr><td>REGISTER_THRESHOLD, VERIFY_THRESHOLD</td><td>90, 70</td></tr>
 *   <tr><td>MIN_STAKE</td><td>100000000</td></tr>
 *   <tr><td>SYNC_MAX_ATTEMPTS, SYNC_BACKOFF_MS</td><td>10, 2000</td></tr>
 *   <tr><td>API_PORT</td><td>8080</td></tr>
 * </table>
 *
 * Malformed or out-of-range numbers fall back to their defaults.
 */
public record HatchmarkConfig(
        String network,
        Optional<String> ledgerRpcUrl,
        Optional<String> packageId,
        StoreKind storeKind,
        String storeJdbcUrl,
        Optional<String> storeRestUrl,
        Optional<String> storeRestKey,
        Duration indexerPollInterval,
        int indexerPageSize,
        Duration indexerStallAlert,
        int registerThreshold,
        int verifyThreshold,
        long minimumStake,
        int syncMaxAttempts,
        Duration syncBackoff,
        int apiPort,
        Path deploymentsDirectory
) {

    public static final String DEFAULT_NETWORK = "testnet";
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:file:./data/hatchmark;AUTO_SERVER=TRUE";
    public static final int DEFAULT_API_PORT = 8080;

    private static final String EXPLORER_BASE = "https://suiscan.xyz/";

    public enum StoreKind {
        MEMORY, JDBC, REST;

        static StoreKind parse(String value) {
            if (value == null || value.isBlank()) {
                return MEMORY;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("STORE_KIND must be memory, jdbc or rest, got: " + value, e);
            }
        }
    }

    public static HatchmarkConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static HatchmarkConfig fromEnv(Map<String, String> env) {
        StoreKind storeKind = StoreKind.parse(env.get("STORE_KIND"));
        Optional<String> restUrl = optional(env.get("STORE_REST_URL"));
        if (storeKind == StoreKind.REST && restUrl.isEmpty()) {
            throw new IllegalArgumentException("STORE_KIND=rest requires STORE_REST_URL");
        }
        return new HatchmarkConfig(
                optional(env.get("HATCHMARK_NETWORK")).orElse(DEFAULT_NETWORK),
                optional(env.get("LEDGER_RPC_URL")),
                optional(env.get("PACKAGE_ID")),
                storeKind,
                optional(env.get("STORE_JDBC_URL")).orElse(DEFAULT_JDBC_URL),
                restUrl,
                optional(env.get("STORE_REST_KEY")),
                Duration.ofMillis(parseLong(env.get("INDEXER_POLL_INTERVAL_MS"),
                        EventIndexer.Options.DEFAULT_POLL_INTERVAL.toMillis(), 1)),
                (int) parseLong(env.get("INDEXER_PAGE_SIZE"), EventIndexer.Options.DEFAULT_PAGE_SIZE, 1),
                Duration.ofMillis(parseLong(env.get("INDEXER_STALL_ALERT_MS"),
                        EventIndexer.Options.DEFAULT_STALL_ALERT.toMillis(), 1)),
                parsePercent(env.get("REGISTER_THRESHOLD"), SimilarityMatcher.DEFAULT_REGISTER_THRESHOLD),
                parsePercent(env.get("VERIFY_THRESHOLD"), SimilarityMatcher.DEFAULT_VERIFY_THRESHOLD),
                parseLong(env.get("MIN_STAKE"), InProcessRegistryLedger.DEFAULT_MINIMUM_STAKE, 0),
                (int) parseLong(env.get("SYNC_MAX_ATTEMPTS"), 10, 1),
                Duration.ofMillis(parseLong(env.get("SYNC_BACKOFF_MS"), 2000, 0)),
                (int) parseLong(env.get("API_PORT"), DEFAULT_API_PORT, 0),
                Path.of(optional(env.get("DEPLOYMENTS_DIR")).orElse("deployments")));
    }

    /**
     * {@code PACKAGE_ID} if set, else the package recorded for this network, else the local
     * package id of the in-process ledger.
     */
    public String resolvePackageId() {
        if (packageId.isPresent()) {
            return packageId.get();
        }
        return new DeploymentRegistry(deploymentsDirectory).load(network)
                .map(DeploymentMetadata::packageId)
                .orElse(InProcessRegistryLedger.LOCAL_PACKAGE_ID);
    }

    public boolean usesInProcessLedger() {
        return ledgerRpcUrl.isEmpty();
    }

    public EventIndexer.Options indexerOptions() {
        return new EventIndexer.Options(indexerPollInterval, indexerPageSize, indexerStallAlert);
    }

    public ClientWorkflow.Options workflowOptions() {
        return new ClientWorkflow.Options(RetryPolicy.defaults(), syncMaxAttempts, syncBackoff);
    }

    /**
     * Explorer page of a certificate or dispute. Empty for the in-process ledger.
     */
    public Optional<String> explorerObjectUrl(String objectId) {
        return explorer("object", objectId);
    }

    public Optional<String> explorerTransactionUrl(String txDigest) {
        return explorer("tx", txDigest);
    }

    public Optional<String> explorerAccountUrl(String address) {
        return explorer("account", address);
    }

    private Optional<String> explorer(String kind, String id) {
        if (usesInProcessLedger() || id == null) {
            return Optional.empty();
        }
        return Optional.of(EXPLORER_BASE + network + "/" + kind + "/" + id);
    }

    private static Optional<String> optional(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static long parseLong(String value, long defaultValue, long minimum) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed < minimum ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int parsePercent(String value, int defaultValue) {
        long parsed = parseLong(value, defaultValue, 0);
        return parsed > 100 ? defaultValue : (int) parsed;
    }
}
