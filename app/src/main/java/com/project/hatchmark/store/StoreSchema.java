package com.project.hatchmark.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Table layout of the relational store, plus the portable {@code MERGE} statements used to
 * upsert into it. Times are stored as epoch milliseconds.
 *
 * <p>{@code disputes.original_cert_id} is a plain column, not a foreign key: a dispute is kept
 * even when its registration is not indexed yet or was skipped as malformed.
 */
final class StoreSchema {

    static final String REGISTRATIONS = "registrations";
    static final String DISPUTES = "disputes";
    static final String RESOLUTIONS = "dispute_resolutions";
    static final String CURSORS = "indexer_cursors";

    private static final String ID = "VARCHAR(130)";
    private static final String HASH = "VARCHAR(128)";

    static final Map<String, String> REGISTRATION_COLUMNS = columns(
            "cert_id", ID,
            "image_hash", HASH,
            "creator", ID,
            "created_at", "BIGINT",
            "title", "VARCHAR(200)",
            "description", "VARCHAR(2000)",
            "tx_digest", ID,
            "synced_at", "BIGINT");

    static final Map<String, String> DISPUTE_COLUMNS = columns(
            "dispute_id", ID,
            "original_cert_id", ID,
            "flagged_hash", HASH,
            "flagger", ID,
            "similarity_score", "INT",
            "status", "INT",
            "stake", "BIGINT",
            "created_at", "BIGINT",
            "tx_digest", ID,
            "synced_at", "BIGINT");

    static final Map<String, String> RESOLUTION_COLUMNS = columns(
            "dispute_id", ID,
            "original_cert_id", ID,
            "status", "INT",
            "resolver", ID,
            "stake_recipient", ID,
            "resolved_at", "BIGINT",
            "tx_digest", ID,
            "synced_at", "BIGINT");

    static final Map<String, String> CURSOR_COLUMNS = columns(
            "event_type", "VARCHAR(40)",
            "tx_digest", ID,
            "event_seq", "BIGINT",
            "updated_at", "BIGINT");

    static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS " + REGISTRATIONS + " ("
                    + "cert_id " + ID + " PRIMARY KEY, "
                    + "image_hash " + HASH + " NOT NULL, "
                    + "creator " + ID + ", "
                    + "created_at BIGINT NOT NULL, "
                    + "title VARCHAR(200), "
                    + "description VARCHAR(2000), "
                    + "tx_digest " + ID + ", "
                    + "synced_at BIGINT)",
            "CREATE INDEX IF NOT EXISTS registrations_creator_idx ON " + REGISTRATIONS + " (creator)",
            "CREATE TABLE IF NOT EXISTS " + DISPUTES + " ("
                    + "dispute_id " + ID + " PRIMARY KEY, "
                    + "original_cert_id " + ID + " NOT NULL, "
                    + "flagged_hash " + HASH + " NOT NULL, "
                    + "flagger " + ID + ", "
                    + "similarity_score INT NOT NULL, "
                    + "status INT NOT NULL, "
                    + "stake BIGINT NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "tx_digest " + ID + ", "
                    + "synced_at BIGINT)",
            "CREATE INDEX IF NOT EXISTS disputes_cert_idx ON " + DISPUTES + " (original_cert_id)",
            "CREATE TABLE IF NOT EXISTS " + RESOLUTIONS + " ("
                    + "dispute_id " + ID + " PRIMARY KEY, "
                    + "original_cert_id " + ID + ", "
                    + "status INT NOT NULL, "
                    + "resolver " + ID + ", "
                    + "stake_recipient " + ID + ", "
                    + "resolved_at BIGINT, "
                    + "tx_digest " + ID + ", "
                    + "synced_at BIGINT)",
            "CREATE TABLE IF NOT EXISTS " + CURSORS + " ("
                    + "event_type VARCHAR(40) PRIMARY KEY, "
                    + "tx_digest " + ID + " NOT NULL, "
                    + "event_seq BIGINT NOT NULL, "
                    + "updated_at BIGINT)");

    private StoreSchema() {
    }

    /**
     * {@code MERGE INTO table USING (SELECT CAST(? AS type) AS col, ...) s ON (key) ...}; one
     * parameter per column, in declaration order.
     */
    static String mergeSql(String table, Map<String, String> columns) {
        String key = columns.keySet().iterator().next();
        String source = columns.entrySet().stream()
                .map(e -> "CAST(? AS " + e.getValue() + ") AS " + e.getKey())
                .collect(Collectors.joining(", "));
        String updates = columns.keySet().stream()
                .skip(1)
                .map(c -> c + " = s." + c)
                .collect(Collectors.joining(", "));
        String names = String.join(", ", columns.keySet());
        String values = columns.keySet().stream().map(c -> "s." + c).collect(Collectors.joining(", "));
        return "MERGE INTO " + table + " t USING (SELECT " + source + ") s"
                + " ON (t." + key + " = s." + key + ")"
                + " WHEN MATCHED THEN UPDATE SET " + updates
                + " WHEN NOT MATCHED THEN INSERT (" + names + ") VALUES (" + values + ")";
    }

    static String selectSql(String table, Map<String, String> columns, String where) {
        return "SELECT " + String.join(", ", columns.keySet()) + " FROM " + table + " WHERE " + where;
    }

    private static Map<String, String> columns(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
