package com.project.hatchmark.store;

import com.project.hatchmark.ledger.DisputeStatus;
import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.project.hatchmark.store.StoreSchema.CURSORS;
import static com.project.hatchmark.store.StoreSchema.CURSOR_COLUMNS;
import static com.project.hatchmark.store.StoreSchema.DISPUTES;
import static com.project.hatchmark.store.StoreSchema.DISPUTE_COLUMNS;
import static com.project.hatchmark.store.StoreSchema.REGISTRATIONS;
import static com.project.hatchmark.store.StoreSchema.REGISTRATION_COLUMNS;
import static com.project.hatchmark.store.StoreSchema.RESOLUTIONS;
import static com.project.hatchmark.store.StoreSchema.RESOLUTION_COLUMNS;

/**
 * Relational store over a single JDBC connection (H2 by default). Each upsert runs in its own
 * transaction: read the current row, skip the write if the content is unchanged, otherwise
 * {@code MERGE}.
 */
public class JdbcOffchainStore implements OffchainStore, CursorStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcOffchainStore.class);

    private final Object lock = new Object();
    private final Connection con;
    private final Clock clock;

    /**
     * Open {@code jdbcUrl} and create any missing tables.
     */
    public static JdbcOffchainStore open(String jdbcUrl) {
        try {
            Connection con = DriverManager.getConnection(jdbcUrl);
            JdbcOffchainStore store = new JdbcOffchainStore(con, Clock.systemUTC());
            store.createSchema();
            log.info("Opened off-chain store at {}", jdbcUrl);
            return store;
        } catch (SQLException e) {
            throw new StoreException("on open(" + jdbcUrl + "): " + e.getMessage(), e);
        }
    }

    public JdbcOffchainStore(Connection con, Clock clock) {
        this.con = Objects.requireNonNull(con, "null connection");
        this.clock = clock;
    }

    public void createSchema() {
        synchronized (lock) {
            inTransaction("createSchema", () -> {
                try (Statement stmt = con.createStatement()) {
                    for (String ddl : StoreSchema.DDL) {
                        stmt.execute(ddl);
                    }
                }
                return null;
            });
        }
    }

    // ----- Upserts -----

    @Override
    public void upsertRegistration(RegistrationRecord record) {
        synchronized (lock) {
            inTransaction("upsertRegistration(" + record.certId() + ")", () -> {
                if (!record.sameContentAs(selectRegistration(record.certId()).orElse(null))) {
                    mergeRegistration(record);
                }
                return null;
            });
        }
    }

    @Override
    public void upsertDispute(DisputeRecord record) {
        synchronized (lock) {
            inTransaction("upsertDispute(" + record.disputeId() + ")", () -> {
                DisputeRecord effective = selectResolution(record.disputeId())
                        .map(resolution -> record.withStatus(resolution.status()))
                        .orElse(record);
                if (!effective.sameContentAs(selectDispute(record.disputeId()).orElse(null))) {
                    mergeDispute(effective);
                }
                return null;
            });
        }
    }

    @Override
    public void upsertResolution(ResolutionRecord record) {
        synchronized (lock) {
            inTransaction("upsertResolution(" + record.disputeId() + ")", () -> {
                if (!record.sameContentAs(selectResolution(record.disputeId()).orElse(null))) {
                    mergeResolution(record);
                }
                try (PreparedStatement stmt = con.prepareStatement(
                        "UPDATE " + DISPUTES + " SET status = ? WHERE dispute_id = ? AND status <> ?")) {
                    stmt.setInt(1, record.status().code());
                    stmt.setString(2, record.disputeId());
                    stmt.setInt(3, record.status().code());
                    stmt.executeUpdate();
                }
                return null;
            });
        }
    }

    // ----- Queries -----

    @Override
    public Optional<RegistrationRecord> findRegistration(String certId) {
        synchronized (lock) {
            return inTransaction("findRegistration", () -> selectRegistration(certId));
        }
    }

    @Override
    public Optional<DisputeRecord> findDispute(String disputeId) {
        synchronized (lock) {
            return inTransaction("findDispute", () -> selectDispute(disputeId));
        }
    }

    @Override
    public Optional<ResolutionRecord> findResolution(String disputeId) {
        synchronized (lock) {
            return inTransaction("findResolution", () -> selectResolution(disputeId));
        }
    }

    @Override
    public List<RegistrationRecord> listRegistrations() {
        synchronized (lock) {
            return inTransaction("listRegistrations", () -> queryRegistrations(
                    StoreSchema.selectSql(REGISTRATIONS, REGISTRATION_COLUMNS, "1 = 1")
                            + " ORDER BY created_at, cert_id",
                    null));
        }
    }

    @Override
    public List<RegistrationRecord> registrationsByCreator(String creator) {
        synchronized (lock) {
            return inTransaction("registrationsByCreator", () -> queryRegistrations(
                    StoreSchema.selectSql(REGISTRATIONS, REGISTRATION_COLUMNS, "LOWER(creator) = LOWER(?)")
                            + " ORDER BY created_at, cert_id",
                    creator));
        }
    }

    @Override
    public List<DisputeRecord> disputesForCertificate(String certId) {
        synchronized (lock) {
            return inTransaction("disputesForCertificate", () -> {
                String sql = StoreSchema.selectSql(DISPUTES, DISPUTE_COLUMNS, "original_cert_id = ?")
                        + " ORDER BY created_at, dispute_id";
                List<DisputeRecord> out = new ArrayList<>();
                try (PreparedStatement stmt = con.prepareStatement(sql)) {
                    stmt.setString(1, certId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            out.add(readDispute(rs));
                        }
                    }
                }
                return out;
            });
        }
    }

    // ----- Cursors -----

    @Override
    public Optional<EventCursor> loadCursor(EventType type) {
        synchronized (lock) {
            return inTransaction("loadCursor(" + type + ")", () -> {
                try (PreparedStatement stmt = con.prepareStatement(
                        StoreSchema.selectSql(CURSORS, CURSOR_COLUMNS, "event_type = ?"))) {
                    stmt.setString(1, type.name());
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.<EventCursor>empty();
                        }
                        return Optional.of(new EventCursor(rs.getString("tx_digest"), rs.getLong("event_seq")));
                    }
                }
            });
        }
    }

    @Override
    public boolean advanceCursor(EventType type, EventCursor expected, EventCursor next) {
        synchronized (lock) {
            return inTransaction("advanceCursor(" + type + ")", () -> {
                if (expected == null) {
                    return insertCursor(type, next);
                }
                try (PreparedStatement stmt = con.prepareStatement("UPDATE " + CURSORS
                        + " SET tx_digest = ?, event_seq = ?, updated_at = ?"
                        + " WHERE event_type = ? AND tx_digest = ? AND event_seq = ?")) {
                    stmt.setString(1, next.txDigest());
                    stmt.setLong(2, next.eventSeq());
                    stmt.setLong(3, clock.millis());
                    stmt.setString(4, type.name());
                    stmt.setString(5, expected.txDigest());
                    stmt.setLong(6, expected.eventSeq());
                    return stmt.executeUpdate() == 1;
                }
            });
        }
    }

    @Override
    public void close() {
        try {
            con.close();
        } catch (SQLException e) {
            throw new StoreException("on close(): " + e.getMessage(), e);
        }
    }

    // ----- Internals (caller holds lock, inside a transaction) -----

    private boolean insertCursor(EventType type, EventCursor cursor) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement("INSERT INTO " + CURSORS
                + " (" + String.join(", ", CURSOR_COLUMNS.keySet()) + ") VALUES (?, ?, ?, ?)")) {
            stmt.setString(1, type.name());
            stmt.setString(2, cursor.txDigest());
            stmt.setLong(3, cursor.eventSeq());
            stmt.setLong(4, clock.millis());
            stmt.executeUpdate();
            return true;
        } catch (SQLIntegrityConstraintViolationException e) {
            // another writer stored the first cursor
            log.debug("Cursor for {} already present: {}", type, e.getMessage());
            return false;
        }
    }

    private void mergeRegistration(RegistrationRecord r) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement(StoreSchema.mergeSql(REGISTRATIONS, REGISTRATION_COLUMNS))) {
            stmt.setString(1, r.certId());
            stmt.setString(2, r.imageHash());
            stmt.setString(3, r.creator());
            stmt.setLong(4, r.createdAt().toEpochMilli());
            stmt.setString(5, r.title());
            stmt.setString(6, r.description());
            stmt.setString(7, r.txDigest());
            setInstant(stmt, 8, r.syncedAt());
            stmt.executeUpdate();
        }
    }

    private void mergeDispute(DisputeRecord d) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement(StoreSchema.mergeSql(DISPUTES, DISPUTE_COLUMNS))) {
            stmt.setString(1, d.disputeId());
            stmt.setString(2, d.originalCertId());
            stmt.setString(3, d.flaggedHash());
            stmt.setString(4, d.flagger());
            stmt.setInt(5, d.similarityScore());
            stmt.setInt(6, d.status().code());
            stmt.setLong(7, d.stake());
            stmt.setLong(8, d.createdAt().toEpochMilli());
            stmt.setString(9, d.txDigest());
            setInstant(stmt, 10, d.syncedAt());
            stmt.executeUpdate();
        }
    }

    private void mergeResolution(ResolutionRecord r) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement(StoreSchema.mergeSql(RESOLUTIONS, RESOLUTION_COLUMNS))) {
            stmt.setString(1, r.disputeId());
            stmt.setString(2, r.originalCertId());
            stmt.setInt(3, r.status().code());
            stmt.setString(4, r.resolver());
            stmt.setString(5, r.stakeRecipient());
            setInstant(stmt, 6, r.resolvedAt());
            stmt.setString(7, r.txDigest());
            setInstant(stmt, 8, r.syncedAt());
            stmt.executeUpdate();
        }
    }

    private Optional<RegistrationRecord> selectRegistration(String certId) throws SQLException {
        List<RegistrationRecord> rows = queryRegistrations(
                StoreSchema.selectSql(REGISTRATIONS, REGISTRATION_COLUMNS, "cert_id = ?"), certId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<RegistrationRecord> queryRegistrations(String sql, String param) throws SQLException {
        List<RegistrationRecord> out = new ArrayList<>();
        try (PreparedStatement stmt = con.prepareStatement(sql)) {
            if (param != null) {
                stmt.setString(1, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    out.add(new RegistrationRecord(
                            rs.getString("cert_id"),
                            rs.getString("image_hash"),
                            rs.getString("creator"),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            rs.getString("title"),
                            rs.getString("description"),
                            rs.getString("tx_digest"),
                            getInstant(rs, "synced_at")));
                }
            }
        }
        return out;
    }

    private Optional<DisputeRecord> selectDispute(String disputeId) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement(
                StoreSchema.selectSql(DISPUTES, DISPUTE_COLUMNS, "dispute_id = ?"))) {
            stmt.setString(1, disputeId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readDispute(rs)) : Optional.empty();
            }
        }
    }

    private static DisputeRecord readDispute(ResultSet rs) throws SQLException {
        return new DisputeRecord(
                rs.getString("dispute_id"),
                rs.getString("original_cert_id"),
                rs.getString("flagged_hash"),
                rs.getString("flagger"),
                rs.getInt("similarity_score"),
                DisputeStatus.fromCode(rs.getInt("status")),
                rs.getLong("stake"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                rs.getString("tx_digest"),
                getInstant(rs, "synced_at"));
    }

    private Optional<ResolutionRecord> selectResolution(String disputeId) throws SQLException {
        try (PreparedStatement stmt = con.prepareStatement(
                StoreSchema.selectSql(RESOLUTIONS, RESOLUTION_COLUMNS, "dispute_id = ?"))) {
            stmt.setString(1, disputeId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ResolutionRecord(
                        rs.getString("dispute_id"),
                        rs.getString("original_cert_id"),
                        DisputeStatus.fromCode(rs.getInt("status")),
                        rs.getString("resolver"),
                        rs.getString("stake_recipient"),
                        getInstant(rs, "resolved_at"),
                        rs.getString("tx_digest"),
                        getInstant(rs, "synced_at")));
            }
        }
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> T inTransaction(String description, SqlWork<T> work) {
        try {
            if (con.getAutoCommit()) {
                con.setAutoCommit(false);
            }
            T result = work.run();
            con.commit();
            return result;
        } catch (SQLException sqx) {
            try {
                con.rollback();
            } catch (SQLException rollbackFailure) {
                sqx.addSuppressed(rollbackFailure);
            }
            throw new StoreException("on " + description + ": " + sqx.getMessage(), sqx);
        }
    }
}
