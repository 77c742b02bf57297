package com.harvest.coordinator.crawl.persistence;

import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fingerprints keyed by {@code (lineage_id, iteration_number, uri)}. Writes are upserts, so a
 * redelivered fetch outcome for the same iteration simply overwrites the earlier row.
 */
@Repository
public class FingerprintRepository {
    private static final Logger log = LoggerFactory.getLogger(FingerprintRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public FingerprintRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.isPostgres(jdbc);
    }

    public void upsert(String lineageId, ResourceFingerprint fingerprint) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lineageId", lineageId)
            .addValue("iteration", fingerprint.iterationNumber())
            .addValue("uri", fingerprint.uri())
            .addValue("contentHash", fingerprint.contentHash())
            .addValue("etag", truncate(fingerprint.etag(), 512))
            .addValue("lastModified", truncate(fingerprint.lastModified(), 128))
            .addValue("contentLength", fingerprint.contentLength())
            .addValue("recordedAt", toTimestamp(fingerprint.recordedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO resource_fingerprints (
                        lineage_id, iteration_number, uri, content_hash, etag, last_modified, content_length, recorded_at
                    )
                    VALUES (
                        :lineageId, :iteration, :uri, :contentHash, :etag, :lastModified, :contentLength, :recordedAt
                    )
                    ON CONFLICT (lineage_id, iteration_number, uri)
                    DO UPDATE SET
                        content_hash = EXCLUDED.content_hash,
                        etag = EXCLUDED.etag,
                        last_modified = EXCLUDED.last_modified,
                        content_length = EXCLUDED.content_length,
                        recorded_at = EXCLUDED.recorded_at
                    """,
                params
            );
        } else {
            jdbc.update(
                """
                    MERGE INTO resource_fingerprints (
                        lineage_id, iteration_number, uri, content_hash, etag, last_modified, content_length, recorded_at
                    )
                    KEY(lineage_id, iteration_number, uri)
                    VALUES (
                        :lineageId, :iteration, :uri, :contentHash, :etag, :lastModified, :contentLength, :recordedAt
                    )
                    """,
                params
            );
        }
        // a fetched resource supersedes any carryover recorded for it in the same iteration
        jdbc.update(
            """
                DELETE FROM iteration_carryovers
                WHERE lineage_id = :lineageId AND iteration_number = :iteration AND uri = :uri
                """,
            params
        );
    }

    public void upsertCarryover(String lineageId, int iteration, String uri, int sourceIteration, Instant recordedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lineageId", lineageId)
            .addValue("iteration", iteration)
            .addValue("uri", uri)
            .addValue("sourceIteration", sourceIteration)
            .addValue("recordedAt", toTimestamp(recordedAt));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO iteration_carryovers (lineage_id, iteration_number, uri, source_iteration, recorded_at)
                    VALUES (:lineageId, :iteration, :uri, :sourceIteration, :recordedAt)
                    ON CONFLICT (lineage_id, iteration_number, uri)
                    DO UPDATE SET
                        source_iteration = EXCLUDED.source_iteration,
                        recorded_at = EXCLUDED.recorded_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO iteration_carryovers (lineage_id, iteration_number, uri, source_iteration, recorded_at)
                KEY(lineage_id, iteration_number, uri)
                VALUES (:lineageId, :iteration, :uri, :sourceIteration, :recordedAt)
                """,
            params
        );
    }

    public Optional<ResourceFingerprint> find(String lineageId, int iteration, String uri) {
        List<ResourceFingerprint> rows = jdbc.query(
            """
                SELECT uri, iteration_number, content_hash, etag, last_modified, content_length, recorded_at
                FROM resource_fingerprints
                WHERE lineage_id = :lineageId AND iteration_number = :iteration AND uri = :uri
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration)
                .addValue("uri", uri),
            fingerprintMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Integer> findCarryoverSource(String lineageId, int iteration, String uri) {
        List<Integer> rows = jdbc.query(
            """
                SELECT source_iteration
                FROM iteration_carryovers
                WHERE lineage_id = :lineageId AND iteration_number = :iteration AND uri = :uri
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration)
                .addValue("uri", uri),
            (rs, rowNum) -> rs.getInt("source_iteration")
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ResourceFingerprint> findByIteration(String lineageId, int iteration) {
        return jdbc.query(
            """
                SELECT uri, iteration_number, content_hash, etag, last_modified, content_length, recorded_at
                FROM resource_fingerprints
                WHERE lineage_id = :lineageId AND iteration_number = :iteration
                ORDER BY uri
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration),
            fingerprintMapper()
        );
    }

    /** URI to source iteration for every carryover of the iteration. */
    public Map<String, Integer> findCarryovers(String lineageId, int iteration) {
        Map<String, Integer> carryovers = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT uri, source_iteration
                FROM iteration_carryovers
                WHERE lineage_id = :lineageId AND iteration_number = :iteration
                ORDER BY uri
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration),
            rs -> {
                carryovers.put(rs.getString("uri"), rs.getInt("source_iteration"));
            }
        );
        return carryovers;
    }

    public int countByIteration(String lineageId, int iteration) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM resource_fingerprints
                WHERE lineage_id = :lineageId AND iteration_number = :iteration
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public int deleteLineage(String lineageId) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("lineageId", lineageId);
        int carryovers = jdbc.update("DELETE FROM iteration_carryovers WHERE lineage_id = :lineageId", params);
        int fingerprints = jdbc.update("DELETE FROM resource_fingerprints WHERE lineage_id = :lineageId", params);
        log.debug("Deleted {} fingerprints and {} carryovers for lineage {}", fingerprints, carryovers, lineageId);
        return fingerprints;
    }

    private RowMapper<ResourceFingerprint> fingerprintMapper() {
        return (rs, rowNum) -> new ResourceFingerprint(
            rs.getString("uri"),
            rs.getInt("iteration_number"),
            rs.getString("content_hash"),
            rs.getString("etag"),
            rs.getString("last_modified"),
            rs.getLong("content_length"),
            toInstant(rs.getTimestamp("recorded_at"))
        );
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
