package com.project.hatchmark.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Configuration")
class HatchmarkConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("An empty environment runs fully in-process")
        void testEmptyEnvironment() {
            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of());

            assertEquals("testnet", config.network());
            assertTrue(config.usesInProcessLedger());
            assertEquals(HatchmarkConfig.StoreKind.MEMORY, config.storeKind());
            assertEquals(Duration.ofSeconds(10), config.indexerPollInterval());
            assertEquals(50, config.indexerPageSize());
            assertEquals(Duration.ofMinutes(5), config.indexerStallAlert());
            assertEquals(90, config.registerThreshold());
            assertEquals(70, config.verifyThreshold());
            assertEquals(100_000_000L, config.minimumStake());
            assertEquals(10, config.syncMaxAttempts());
            assertEquals(Duration.ofSeconds(2), config.syncBackoff());
            assertEquals(8080, config.apiPort());
        }

        @Test
        @DisplayName("Malformed and out-of-range numbers fall back")
        void testFallbacks() {
            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "INDEXER_POLL_INTERVAL_MS", "soon",
                    "INDEXER_PAGE_SIZE", "0",
                    "REGISTER_THRESHOLD", "101",
                    "VERIFY_THRESHOLD", "-5",
                    "MIN_STAKE", "1e9",
                    "SYNC_MAX_ATTEMPTS", " 4 "));

            assertEquals(Duration.ofSeconds(10), config.indexerPollInterval());
            assertEquals(50, config.indexerPageSize());
            assertEquals(90, config.registerThreshold());
            assertEquals(70, config.verifyThreshold());
            assertEquals(100_000_000L, config.minimumStake());
            assertEquals(4, config.syncMaxAttempts());
        }

        @Test
        @DisplayName("Derived option objects carry the configured values")
        void testDerivedOptions() {
            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "INDEXER_POLL_INTERVAL_MS", "250",
                    "INDEXER_PAGE_SIZE", "7",
                    "SYNC_MAX_ATTEMPTS", "3",
                    "SYNC_BACKOFF_MS", "0"));

            assertEquals(Duration.ofMillis(250), config.indexerOptions().pollInterval());
            assertEquals(7, config.indexerOptions().pageSize());
            assertEquals(3, config.workflowOptions().syncMaxAttempts());
            assertEquals(Duration.ZERO, config.workflowOptions().syncBackoff());
        }
    }

    @Nested
    @DisplayName("Store kind")
    class StoreKind {

        @Test
        @DisplayName("Parsed case-insensitively")
        void testParse() {
            assertEquals(HatchmarkConfig.StoreKind.JDBC,
                    HatchmarkConfig.fromEnv(Map.of("STORE_KIND", " Jdbc ")).storeKind());
        }

        @Test
        @DisplayName("Unknown kinds are rejected")
        void testUnknown() {
            assertThrows(IllegalArgumentException.class,
                    () -> HatchmarkConfig.fromEnv(Map.of("STORE_KIND", "redis")));
        }

        @Test
        @DisplayName("The REST store needs a URL")
        void testRestRequiresUrl() {
            assertThrows(IllegalArgumentException.class,
                    () -> HatchmarkConfig.fromEnv(Map.of("STORE_KIND", "rest")));

            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "STORE_KIND", "rest", "STORE_REST_URL", "https://db.example.org", "STORE_REST_KEY", "k"));
            assertEquals(Optional.of("https://db.example.org"), config.storeRestUrl());
            assertEquals(Optional.of("k"), config.storeRestKey());
        }
    }

    @Nested
    @DisplayName("Package id")
    class PackageId {

        @TempDir
        Path dir;

        @Test
        @DisplayName("PACKAGE_ID wins over deployment metadata")
        void testExplicit() throws IOException {
            Files.writeString(dir.resolve("testnet.json"), "{\"packageId\":\"0xfeed\"}");

            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "PACKAGE_ID", "0xbeef", "DEPLOYMENTS_DIR", dir.toString()));
            assertEquals("0xbeef", config.resolvePackageId());
        }

        @Test
        @DisplayName("Falls back to the deployment for the configured network")
        void testFromDeployment() throws IOException {
            Files.writeString(dir.resolve("devnet.json"), "{\"packageId\":\"0xfeed\"}");

            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "HATCHMARK_NETWORK", "devnet", "DEPLOYMENTS_DIR", dir.toString()));
            assertEquals("0xfeed", config.resolvePackageId());
        }

        @Test
        @DisplayName("Without either, the local package id is used")
        void testLocal() {
            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of("DEPLOYMENTS_DIR", dir.toString()));
            assertEquals("0x0", config.resolvePackageId());
        }
    }

    @Nested
    @DisplayName("Explorer links")
    class Explorer {

        @Test
        @DisplayName("Point at the configured network")
        void testLinks() {
            HatchmarkConfig config = HatchmarkConfig.fromEnv(Map.of(
                    "HATCHMARK_NETWORK", "mainnet", "LEDGER_RPC_URL", "https://fullnode.mainnet.sui.io"));

            assertEquals(Optional.of("https://suiscan.xyz/mainnet/object/0x12"), config.explorerObjectUrl("0x12"));
            assertEquals(Optional.of("https://suiscan.xyz/mainnet/tx/Abc"), config.explorerTransactionUrl("Abc"));
            assertEquals(Optional.of("https://suiscan.xyz/mainnet/account/0x34"), config.explorerAccountUrl("0x34"));
        }

        @Test
        @DisplayName("Are absent for the in-process ledger")
        void testInProcess() {
            assertEquals(Optional.empty(), HatchmarkConfig.fromEnv(Map.of()).explorerObjectUrl("0x12"));
        }
    }
}
