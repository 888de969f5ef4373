package com.project.hatchmark;

import com.project.hatchmark.config.HatchmarkConfig;
import com.project.hatchmark.config.HatchmarkRuntime;
import com.project.hatchmark.indexer.EventIndexer;
import com.project.hatchmark.indexer.IndexerStatus;
import com.project.hatchmark.ledger.EventType;

import java.util.Map;

/**
 * One-shot backfill: drains every event type into the off-chain store and exits.
 * Exits with status 2 when any stream stopped on an error before reaching the end of its feed.
 */
public class SyncOnceApp {
    public static void main(String[] args) {
        try {
            HatchmarkConfig config = HatchmarkConfig.fromEnv();
            System.out.println("Synchronising " + config.ledgerRpcUrl().orElse("in-process ledger")
                    + " into " + config.storeKind() + " store...");

            boolean failed = false;
            try (HatchmarkRuntime runtime = new HatchmarkRuntime(config);
                 EventIndexer indexer = runtime.newIndexer()) {
                Map<EventType, Integer> totals = indexer.drain();
                Map<EventType, IndexerStatus> status = indexer.status();
                for (EventType type : EventType.values()) {
                    IndexerStatus current = status.get(type);
                    boolean ok = current.lastError() == null;
                    failed |= !ok;
                    System.out.printf("  %s %-22s +%d (cursor %s)%s%n",
                            ok ? "✓" : "✗",
                            type.structName(),
                            totals.getOrDefault(type, 0),
                            current.cursor(),
                            ok ? "" : " - " + current.lastError());
                }
            }
            if (failed) {
                System.err.println("Some streams did not finish; rerun to resume from the saved cursors.");
                System.exit(2);
            }
            System.out.println("Done.");
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
