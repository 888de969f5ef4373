package com.project.hatchmark;

import com.project.hatchmark.config.HatchmarkConfig;
import com.project.hatchmark.config.HatchmarkRuntime;
import com.project.hatchmark.http.ApiServer;
import com.project.hatchmark.indexer.EventIndexer;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;

/**
 * Serves the verify and transaction-request endpoints. With the in-process ledger an indexer runs
 * in the same process, since nothing else could fill the store.
 */
public class ApiServerApp {
    public static void main(String[] args) {
        try {
            HatchmarkConfig config = HatchmarkConfig.fromEnv();
            HatchmarkRuntime runtime = new HatchmarkRuntime(config);
            EventIndexer indexer = config.usesInProcessLedger() ? runtime.newIndexer() : null;
            ApiServer server = new ApiServer(runtime.verification(), runtime.requests(),
                    new InetSocketAddress(config.apiPort()));

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                if (indexer != null) {
                    indexer.close();
                }
                runtime.close();
                stopped.countDown();
            }, "api-shutdown"));

            if (indexer != null) {
                indexer.start();
            }
            server.start();
            System.out.println("Hatchmark API on http://localhost:" + server.port() + "/api"
                    + " (package " + runtime.packageId() + ", store " + config.storeKind() + ")");
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
