package com.project.hatchmark;

import com.project.hatchmark.config.HatchmarkConfig;
import com.project.hatchmark.config.HatchmarkRuntime;
import com.project.hatchmark.indexer.EventIndexer;

import java.util.concurrent.CountDownLatch;

/**
 * Long-running indexer: polls every event type and keeps the off-chain store current until the
 * process is stopped.
 */
public class IndexerApp {
    public static void main(String[] args) {
        try {
            HatchmarkConfig config = HatchmarkConfig.fromEnv();

            System.out.println("╔════════════════════════════════════════════════════════════════╗");
            System.out.println("║              HATCHMARK INDEXER - ledger to off-chain            ║");
            System.out.println("╚════════════════════════════════════════════════════════════════╝");
            System.out.println();
            System.out.println("Network:       " + config.network());
            System.out.println("Ledger:        " + config.ledgerRpcUrl().orElse("in-process"));
            System.out.println("Store:         " + config.storeKind());
            System.out.println("Poll interval: " + config.indexerPollInterval().toMillis() + " ms");
            System.out.println("Page size:     " + config.indexerPageSize());
            System.out.println();

            HatchmarkRuntime runtime = new HatchmarkRuntime(config);
            EventIndexer indexer = runtime.newIndexer();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println("Stopping indexer...");
                indexer.status().values().forEach(status -> System.out.printf(
                        "  %-22s cursor=%s indexed=%d skipped=%d%n",
                        status.type().structName(), status.cursor(), status.indexed(), status.skipped()));
                indexer.close();
                runtime.close();
                stopped.countDown();
            }, "indexer-shutdown"));

            indexer.start();
            System.out.println("Indexer running. Press Ctrl+C to stop.");
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
