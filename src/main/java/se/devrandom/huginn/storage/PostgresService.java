/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import se.devrandom.huginn.sei.ProcessFetchResult;
import se.devrandom.huginn.sei.objects.DocumentRecord;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.ProgressionRecord;

import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

@Service
public class PostgresService implements ProcessStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresService.class);

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int poolSize;

    private HikariDataSource dataSource;

    @Autowired
    public PostgresService(
            @Value("${postgres.url}") String jdbcUrl,
            @Value("${postgres.username}") String username,
            @Value("${postgres.password}") String password,
            @Value("${postgres.pool-size:10}") int poolSize) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.poolSize = poolSize;
        log.info("PostgresService initialized with database: {}", jdbcUrl);
    }

    /**
     * Opens the connection pool and creates the sync tables if they don't exist.
     */
    @PostConstruct
    public void initializeDatabase() throws SQLException {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(10000);
        config.setPoolName("huginn-db");
        dataSource = new HikariDataSource(config);
        log.info("Connection pool initialized (max={})", poolSize);

        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {

            String createTablesSql = """
                -- Input list: processes to sync and the unit they were registered under
                CREATE TABLE IF NOT EXISTS process_queue (
                    protocol TEXT PRIMARY KEY,
                    scope_name TEXT NOT NULL,
                    registered_at TIMESTAMP NOT NULL DEFAULT NOW()
                );
                CREATE INDEX IF NOT EXISTS process_queue_registered_at_index ON process_queue (registered_at DESC);

                CREATE TABLE IF NOT EXISTS processes (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    protocol TEXT NOT NULL UNIQUE,
                    procedure_id BIGINT,
                    scope_id TEXT,
                    scope_name TEXT,
                    procedure_type TEXT,
                    specification TEXT,
                    access_level TEXT,
                    legal_hypothesis TEXT,
                    observation TEXT,
                    opened_at TIMESTAMP,
                    concluded_at TIMESTAMP,
                    interested_parties JSONB,
                    subjects JSONB,
                    generating_unit TEXT,
                    raw_payload JSONB,
                    created_at TIMESTAMP NOT NULL DEFAULT NOW(),
                    updated_at TIMESTAMP NOT NULL DEFAULT NOW()
                );

                CREATE TABLE IF NOT EXISTS documents (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    process_id BIGINT NOT NULL REFERENCES processes (id) ON DELETE CASCADE,
                    document_id BIGINT NOT NULL UNIQUE,
                    number TEXT,
                    document_type TEXT,
                    document_date TIMESTAMP,
                    generating_user TEXT,
                    generating_unit TEXT,
                    signed BOOLEAN NOT NULL DEFAULT FALSE,
                    signatories JSONB,
                    access_level TEXT,
                    raw_payload JSONB,
                    status TEXT NOT NULL DEFAULT 'pending',
                    download_attempts INTEGER NOT NULL DEFAULT 0,
                    file_format TEXT,
                    sha256 TEXT,
                    size_bytes BIGINT,
                    storage_bucket TEXT,
                    storage_path TEXT,
                    last_error TEXT,
                    downloaded_at TIMESTAMP,
                    created_at TIMESTAMP NOT NULL DEFAULT NOW(),
                    updated_at TIMESTAMP NOT NULL DEFAULT NOW()
                );
                CREATE INDEX IF NOT EXISTS documents_process_id_index ON documents (process_id);
                CREATE INDEX IF NOT EXISTS documents_status_index ON documents (status);

                CREATE TABLE IF NOT EXISTS progressions (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    process_id BIGINT NOT NULL REFERENCES processes (id) ON DELETE CASCADE,
                    progression_id BIGINT NOT NULL,
                    task TEXT,
                    description TEXT,
                    user_name TEXT,
                    origin_unit TEXT,
                    occurred_at TIMESTAMP,
                    attributes JSONB,
                    raw_payload JSONB,
                    created_at TIMESTAMP NOT NULL DEFAULT NOW(),
                    CONSTRAINT progressions_process_progression_uk UNIQUE (process_id, progression_id)
                );

                -- Per-protocol sync state machine, one status per stage
                CREATE TABLE IF NOT EXISTS sync_status (
                    protocol TEXT PRIMARY KEY,
                    metadata_status TEXT NOT NULL DEFAULT 'pending',
                    metadata_fetched_at TIMESTAMP,
                    metadata_error TEXT,
                    documents_status TEXT NOT NULL DEFAULT 'pending',
                    documents_total INTEGER NOT NULL DEFAULT 0,
                    documents_downloaded INTEGER NOT NULL DEFAULT 0,
                    documents_error TEXT,
                    progressions_status TEXT NOT NULL DEFAULT 'pending',
                    progressions_total INTEGER NOT NULL DEFAULT 0,
                    progressions_error TEXT,
                    retry_count INTEGER NOT NULL DEFAULT 0,
                    last_retry_at TIMESTAMP,
                    created_at TIMESTAMP NOT NULL DEFAULT NOW(),
                    updated_at TIMESTAMP NOT NULL DEFAULT NOW()
                );
                CREATE INDEX IF NOT EXISTS sync_status_metadata_status_index ON sync_status (metadata_status);
                """;

            stmt.execute(createTablesSql);
            log.info("Database tables initialized successfully (process_queue, processes, documents, progressions, sync_status)");
        }
    }

    @PreDestroy
    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    private Connection getConnection() throws SQLException {
        long start = System.currentTimeMillis();
        Connection conn = dataSource.getConnection();
        log.debug("getConnection took {}ms", System.currentTimeMillis() - start);
        return conn;
    }

    // ===== Metadata sync =====

    @Override
    public BulkWriteStats bulkUpsert(List<ProcessFetchResult> results) throws SQLException {
        if (results.isEmpty()) {
            return BulkWriteStats.EMPTY;
        }

        List<ProcessFetchResult> successes = new ArrayList<>();
        for (ProcessFetchResult result : results) {
            if (result.isSuccess()) {
                successes.add(result);
            }
        }

        long start = System.currentTimeMillis();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                Map<String, Long> processIds = upsertProcesses(conn, successes);
                int documents = upsertDocuments(conn, successes, processIds);
                int progressions = upsertProgressions(conn, successes, processIds);
                upsertSyncStatus(conn, results);
                conn.commit();

                BulkWriteStats stats = new BulkWriteStats(processIds.size(), documents, progressions, results.size());
                log.debug("Bulk upsert of {} results took {}ms: {}", results.size(),
                        System.currentTimeMillis() - start, stats);
                return stats;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private Map<String, Long> upsertProcesses(Connection conn, List<ProcessFetchResult> successes) throws SQLException {
        Map<String, Long> processIds = new HashMap<>();
        if (successes.isEmpty()) {
            return processIds;
        }

        String sql = """
            INSERT INTO processes (protocol, procedure_id, scope_id, scope_name, procedure_type, specification,
                                   access_level, legal_hypothesis, observation, opened_at, concluded_at,
                                   interested_parties, subjects, generating_unit, raw_payload)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb)
            ON CONFLICT (protocol) DO UPDATE SET
                procedure_id = EXCLUDED.procedure_id,
                scope_id = EXCLUDED.scope_id,
                scope_name = EXCLUDED.scope_name,
                procedure_type = EXCLUDED.procedure_type,
                specification = EXCLUDED.specification,
                access_level = EXCLUDED.access_level,
                legal_hypothesis = EXCLUDED.legal_hypothesis,
                observation = EXCLUDED.observation,
                opened_at = EXCLUDED.opened_at,
                concluded_at = EXCLUDED.concluded_at,
                interested_parties = EXCLUDED.interested_parties,
                subjects = EXCLUDED.subjects,
                generating_unit = EXCLUDED.generating_unit,
                raw_payload = EXCLUDED.raw_payload,
                updated_at = NOW()
            """;

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (ProcessFetchResult result : successes) {
                ProcessRecord process = result.process();
                stmt.setString(1, result.protocol());
                stmt.setLong(2, process.procedureId());
                stmt.setString(3, result.scopeId());
                stmt.setString(4, result.scopeName());
                stmt.setString(5, process.procedureType());
                stmt.setString(6, process.specification());
                stmt.setString(7, process.accessLevel());
                stmt.setString(8, process.legalHypothesis());
                stmt.setString(9, process.observation());
                stmt.setTimestamp(10, toTimestamp(process.openedAt()));
                stmt.setTimestamp(11, toTimestamp(process.concludedAt()));
                stmt.setString(12, jsonb(process.interestedParties()));
                stmt.setString(13, jsonb(process.subjects()));
                stmt.setString(14, process.generatingUnit());
                stmt.setString(15, jsonb(process.raw()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }

        // Children need the surrogate ids, whether the row was inserted or updated
        Set<String> protocols = new LinkedHashSet<>();
        successes.forEach(r -> protocols.add(r.protocol()));
        try (PreparedStatement stmt = conn.prepareStatement("SELECT id, protocol FROM processes WHERE protocol = ANY(?)")) {
            stmt.setArray(1, conn.createArrayOf("text", protocols.toArray()));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    processIds.put(rs.getString("protocol"), rs.getLong("id"));
                }
            }
        }
        return processIds;
    }

    /**
     * Download state (status, attempts, hash, storage path) is never overwritten here.
     */
    private int upsertDocuments(Connection conn, List<ProcessFetchResult> successes,
                                Map<String, Long> processIds) throws SQLException {
        String sql = """
            INSERT INTO documents (process_id, document_id, number, document_type, document_date, generating_user,
                                   generating_unit, signed, signatories, access_level, raw_payload)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?::jsonb)
            ON CONFLICT (document_id) DO UPDATE SET
                process_id = EXCLUDED.process_id,
                number = EXCLUDED.number,
                document_type = EXCLUDED.document_type,
                document_date = EXCLUDED.document_date,
                generating_user = EXCLUDED.generating_user,
                generating_unit = EXCLUDED.generating_unit,
                signed = EXCLUDED.signed,
                signatories = EXCLUDED.signatories,
                access_level = EXCLUDED.access_level,
                raw_payload = EXCLUDED.raw_payload,
                updated_at = NOW()
            """;

        int count = 0;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (ProcessFetchResult result : successes) {
                Long processId = processIds.get(result.protocol());
                for (DocumentRecord document : result.documents()) {
                    if (document.documentId() <= 0) {
                        log.warn("Skipping document without IdDocumento in {}", result.protocol());
                        continue;
                    }
                    stmt.setLong(1, processId);
                    stmt.setLong(2, document.documentId());
                    stmt.setString(3, document.number());
                    stmt.setString(4, document.documentType());
                    stmt.setTimestamp(5, toTimestamp(document.documentDate()));
                    stmt.setString(6, document.generatingUser());
                    stmt.setString(7, document.generatingUnit());
                    stmt.setBoolean(8, document.signed());
                    stmt.setString(9, jsonb(document.signatories()));
                    stmt.setString(10, document.accessLevel());
                    stmt.setString(11, jsonb(document.raw()));
                    stmt.addBatch();
                    count++;
                }
            }
            if (count > 0) {
                stmt.executeBatch();
            }
        }
        return count;
    }

    private int upsertProgressions(Connection conn, List<ProcessFetchResult> successes,
                                   Map<String, Long> processIds) throws SQLException {
        String sql = """
            INSERT INTO progressions (process_id, progression_id, task, description, user_name, origin_unit,
                                      occurred_at, attributes, raw_payload)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            ON CONFLICT (process_id, progression_id) DO UPDATE SET
                task = EXCLUDED.task,
                description = EXCLUDED.description,
                user_name = EXCLUDED.user_name,
                origin_unit = EXCLUDED.origin_unit,
                occurred_at = EXCLUDED.occurred_at,
                attributes = EXCLUDED.attributes,
                raw_payload = EXCLUDED.raw_payload
            """;

        int count = 0;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (ProcessFetchResult result : successes) {
                Long processId = processIds.get(result.protocol());
                for (ProgressionRecord progression : result.progressions()) {
                    if (progression.progressionId() <= 0) {
                        log.warn("Skipping progression without IdAndamento in {}", result.protocol());
                        continue;
                    }
                    stmt.setLong(1, processId);
                    stmt.setLong(2, progression.progressionId());
                    stmt.setString(3, progression.task());
                    stmt.setString(4, progression.description());
                    stmt.setString(5, progression.user());
                    stmt.setString(6, progression.originUnit());
                    stmt.setTimestamp(7, toTimestamp(progression.occurredAt()));
                    stmt.setString(8, jsonb(progression.attributes()));
                    stmt.setString(9, jsonb(progression.raw()));
                    stmt.addBatch();
                    count++;
                }
            }
            if (count > 0) {
                stmt.executeBatch();
            }
        }
        return count;
    }

    private void upsertSyncStatus(Connection conn, List<ProcessFetchResult> results) throws SQLException {
        String successSql = """
            INSERT INTO sync_status (protocol, metadata_status, metadata_fetched_at, metadata_error,
                                     documents_status, documents_total, progressions_status, progressions_total)
            VALUES (?, 'completed', NOW(), NULL, ?, ?, 'completed', ?)
            ON CONFLICT (protocol) DO UPDATE SET
                metadata_status = EXCLUDED.metadata_status,
                metadata_fetched_at = EXCLUDED.metadata_fetched_at,
                metadata_error = NULL,
                documents_status = EXCLUDED.documents_status,
                documents_total = EXCLUDED.documents_total,
                progressions_status = EXCLUDED.progressions_status,
                progressions_total = EXCLUDED.progressions_total,
                progressions_error = NULL,
                updated_at = NOW()
            """;

        String failureSql = """
            INSERT INTO sync_status (protocol, metadata_status, metadata_error, retry_count, last_retry_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (protocol) DO UPDATE SET
                metadata_status = EXCLUDED.metadata_status,
                metadata_error = EXCLUDED.metadata_error,
                retry_count = sync_status.retry_count + EXCLUDED.retry_count,
                last_retry_at = COALESCE(EXCLUDED.last_retry_at, sync_status.last_retry_at),
                updated_at = NOW()
            """;

        try (PreparedStatement success = conn.prepareStatement(successSql);
             PreparedStatement failure = conn.prepareStatement(failureSql)) {
            int successes = 0;
            int failures = 0;
            Timestamp now = Timestamp.valueOf(LocalDateTime.now());

            for (ProcessFetchResult result : results) {
                if (result.isSuccess()) {
                    int documents = (int) result.documents().stream().filter(d -> d.documentId() > 0).count();
                    int progressions = (int) result.progressions().stream().filter(p -> p.progressionId() > 0).count();
                    success.setString(1, result.protocol());
                    success.setString(2, (documents > 0 ? StageStatus.PENDING : StageStatus.COMPLETED).dbValue());
                    success.setInt(3, documents);
                    success.setInt(4, progressions);
                    success.addBatch();
                    successes++;
                } else {
                    boolean retryable = result.status() == ProcessFetchResult.Status.ERROR;
                    failure.setString(1, result.protocol());
                    failure.setString(2, StageStatus.forMetadata(result.status()).dbValue());
                    failure.setString(3, result.message());
                    failure.setInt(4, retryable ? 1 : 0);
                    failure.setTimestamp(5, retryable ? now : null);
                    failure.addBatch();
                    failures++;
                }
            }

            if (successes > 0) {
                success.executeBatch();
            }
            if (failures > 0) {
                failure.executeBatch();
            }
        }
    }

    /**
     * Queue entries whose metadata has not reached a terminal status, newest first.
     *
     * @param tenantFilter only units starting with this prefix (null or blank for all)
     * @param since        only entries registered on or after this date (null for all)
     * @param limit        maximum rows (0 or less for no limit)
     */
    public List<PendingProcess> loadPendingProcesses(String tenantFilter, LocalDate since, int limit) throws SQLException {
        StringBuilder sql = new StringBuilder("""
            SELECT q.protocol, q.scope_name
            FROM process_queue q
            LEFT JOIN sync_status s ON s.protocol = q.protocol
            WHERE (s.protocol IS NULL OR s.metadata_status NOT IN (?, ?, ?))
            """);
        List<Object> params = new ArrayList<>();
        for (StageStatus terminal : List.of(StageStatus.COMPLETED, StageStatus.NOT_FOUND, StageStatus.ACCESS_DENIED)) {
            params.add(terminal.dbValue());
        }
        if (tenantFilter != null && !tenantFilter.isBlank()) {
            sql.append(" AND q.scope_name LIKE ?");
            params.add(tenantFilter.trim() + "%");
        }
        if (since != null) {
            sql.append(" AND q.registered_at >= ?");
            params.add(Timestamp.valueOf(since.atStartOfDay()));
        }
        sql.append(" ORDER BY q.registered_at DESC, q.protocol");
        if (limit > 0) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }

        List<PendingProcess> pending = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    pending.add(new PendingProcess(rs.getString("protocol"), rs.getString("scope_name")));
                }
            }
        }
        log.info("Loaded {} pending processes (tenant filter: {}, since: {}, limit: {})",
                pending.size(), tenantFilter, since, limit > 0 ? limit : "none");
        return pending;
    }

    /**
     * Counts sync_status rows by metadata status.
     */
    public Map<String, Long> countMetadataStatuses() throws SQLException {
        Map<String, Long> counts = new TreeMap<>();
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "SELECT metadata_status, COUNT(*) AS total FROM sync_status GROUP BY metadata_status");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("metadata_status"), rs.getLong("total"));
            }
        }
        return counts;
    }

    // ===== Document downloads =====

    public List<PendingDocument> loadPendingDocuments(int limit, int maxAttempts) throws SQLException {
        String sql = """
            SELECT d.id, d.document_id, p.protocol, p.scope_id, d.download_attempts
            FROM documents d
            JOIN processes p ON p.id = d.process_id
            WHERE d.status = ?
            AND d.download_attempts < ?
            AND p.scope_id IS NOT NULL
            ORDER BY d.id
            LIMIT ?
            """;

        List<PendingDocument> pending = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, StageStatus.PENDING.dbValue());
            stmt.setInt(2, maxAttempts);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    pending.add(new PendingDocument(
                            rs.getLong("id"),
                            rs.getLong("document_id"),
                            rs.getString("protocol"),
                            rs.getString("scope_id"),
                            rs.getInt("download_attempts")));
                }
            }
        }
        return pending;
    }

    /**
     * Hands documents claimed more than {@code staleMinutes} ago back to pending, or to error
     * once their attempts are used up.
     *
     * @return number of rows released
     */
    public int releaseStaleDocumentClaims(int staleMinutes, int maxAttempts) throws SQLException {
        String sql = """
            UPDATE documents
            SET status = CASE WHEN download_attempts >= ? THEN ? ELSE ? END,
                last_error = 'Claim abandoned while processing', updated_at = NOW()
            WHERE status = ?
            AND updated_at < NOW() - make_interval(mins => ?)
            """;
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, maxAttempts);
            stmt.setString(2, StageStatus.ERROR.dbValue());
            stmt.setString(3, StageStatus.PENDING.dbValue());
            stmt.setString(4, StageStatus.PROCESSING.dbValue());
            stmt.setInt(5, staleMinutes);
            return stmt.executeUpdate();
        }
    }

    /**
     * Claims the document for download and counts the attempt.
     */
    public void markDocumentDownloading(long rowId) throws SQLException {
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "UPDATE documents SET status = ?, download_attempts = download_attempts + 1, updated_at = NOW() WHERE id = ?")) {
            stmt.setString(1, StageStatus.PROCESSING.dbValue());
            stmt.setLong(2, rowId);
            stmt.executeUpdate();
        }
    }

    public void markDocumentDownloaded(long rowId, String bucket, String path, long sizeBytes,
                                       String sha256, String fileFormat) throws SQLException {
        String sql = """
            UPDATE documents
            SET status = ?, storage_bucket = ?, storage_path = ?, size_bytes = ?, sha256 = ?, file_format = ?,
                last_error = NULL, downloaded_at = NOW(), updated_at = NOW()
            WHERE id = ?
            """;
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, StageStatus.COMPLETED.dbValue());
            stmt.setString(2, bucket);
            stmt.setString(3, path);
            stmt.setLong(4, sizeBytes);
            stmt.setString(5, sha256);
            stmt.setString(6, fileFormat);
            stmt.setLong(7, rowId);
            stmt.executeUpdate();
        }
    }

    /**
     * Back to pending for another try, or error once maxAttempts have been used.
     */
    public void markDocumentFailed(long rowId, String error, int maxAttempts) throws SQLException {
        String sql = """
            UPDATE documents
            SET status = CASE WHEN download_attempts >= ? THEN ? ELSE ? END,
                last_error = ?, updated_at = NOW()
            WHERE id = ?
            """;
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, maxAttempts);
            stmt.setString(2, StageStatus.ERROR.dbValue());
            stmt.setString(3, StageStatus.PENDING.dbValue());
            stmt.setString(4, error);
            stmt.setLong(5, rowId);
            stmt.executeUpdate();
        }
    }

    /**
     * Recomputes documents_downloaded and documents_status in sync_status from the document rows.
     */
    public void refreshDocumentProgress(Collection<String> protocols) throws SQLException {
        if (protocols.isEmpty()) {
            return;
        }
        String sql = """
            UPDATE sync_status s
            SET documents_downloaded = c.done,
                documents_status = CASE
                    WHEN c.done = c.total THEN 'completed'
                    WHEN c.done + c.failed = c.total THEN 'error'
                    ELSE 'pending' END,
                documents_error = CASE WHEN c.failed > 0 THEN c.failed || ' document(s) failed' ELSE NULL END,
                updated_at = NOW()
            FROM (
                SELECT p.protocol,
                       COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE d.status = 'completed') AS done,
                       COUNT(*) FILTER (WHERE d.status = 'error') AS failed
                FROM documents d
                JOIN processes p ON p.id = d.process_id
                WHERE p.protocol = ANY(?)
                GROUP BY p.protocol
            ) c
            WHERE s.protocol = c.protocol
            """;
        try (Connection conn = getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setArray(1, conn.createArrayOf("text", protocols.toArray()));
            int updated = stmt.executeUpdate();
            log.debug("Refreshed document progress for {} protocols", updated);
        }
    }

    private static Timestamp toTimestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    // PostgreSQL jsonb rejects \u0000 inside strings
    private static String jsonb(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.toString().replace("\\u0000", "");
    }
}
