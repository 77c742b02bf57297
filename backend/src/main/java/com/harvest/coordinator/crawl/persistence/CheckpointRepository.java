package com.harvest.coordinator.crawl.persistence;

import com.harvest.coordinator.crawl.checkpoint.CheckpointRecord;
import com.harvest.coordinator.crawl.checkpoint.CheckpointType;
import com.harvest.coordinator.crawl.checkpoint.StoredCheckpoint;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class CheckpointRepository {
    private static final String METADATA_COLUMNS = """
        job_id, checkpoint_id, checkpoint_number, checkpoint_type, created_at, state_name, substate_name, payload_size
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CheckpointRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int nextCheckpointNumber(String jobId) {
        Integer max = jdbc.queryForObject(
            "SELECT MAX(checkpoint_number) FROM crawl_checkpoints WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            Integer.class
        );
        return max == null ? 1 : max + 1;
    }

    public void insert(StoredCheckpoint checkpoint) {
        CheckpointRecord record = checkpoint.record();
        jdbc.update(
            """
                INSERT INTO crawl_checkpoints (
                    job_id, checkpoint_id, checkpoint_number, checkpoint_type, created_at,
                    state_name, substate_name, payload, payload_size, payload_sha256
                )
                VALUES (
                    :jobId, :checkpointId, :checkpointNumber, :type, :createdAt,
                    :stateName, :substateName, :payload, :payloadSize, :payloadSha256
                )
                """,
            new MapSqlParameterSource()
                .addValue("jobId", record.jobId())
                .addValue("checkpointId", record.checkpointId())
                .addValue("checkpointNumber", record.checkpointNumber())
                .addValue("type", record.type().name())
                .addValue("createdAt", toTimestamp(record.createdAt()))
                .addValue("stateName", record.state().name())
                .addValue("substateName", record.substate() == null ? null : record.substate().name())
                .addValue("payload", checkpoint.payload())
                .addValue("payloadSize", record.payloadSize())
                .addValue("payloadSha256", checkpoint.payloadSha256())
        );
    }

    /** Newest first. */
    public List<CheckpointRecord> findByJob(String jobId) {
        return jdbc.query(
            "SELECT " + METADATA_COLUMNS + """
                FROM crawl_checkpoints
                WHERE job_id = :jobId
                ORDER BY checkpoint_number DESC
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            recordMapper()
        );
    }

    public Optional<CheckpointRecord> findLatest(String jobId) {
        List<CheckpointRecord> rows = jdbc.query(
            "SELECT " + METADATA_COLUMNS + """
                FROM crawl_checkpoints
                WHERE job_id = :jobId
                ORDER BY checkpoint_number DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            recordMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<StoredCheckpoint> findWithPayload(String jobId, String checkpointId) {
        List<StoredCheckpoint> rows = jdbc.query(
            "SELECT " + METADATA_COLUMNS + """
                , payload, payload_sha256
                FROM crawl_checkpoints
                WHERE job_id = :jobId AND checkpoint_id = :checkpointId
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("checkpointId", checkpointId),
            (rs, rowNum) -> new StoredCheckpoint(
                mapRecord(rs),
                rs.getBytes("payload"),
                rs.getString("payload_sha256")
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int delete(String jobId, Collection<String> checkpointIds) {
        if (checkpointIds == null || checkpointIds.isEmpty()) {
            return 0;
        }
        return jdbc.update(
            "DELETE FROM crawl_checkpoints WHERE job_id = :jobId AND checkpoint_id IN (:ids)",
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("ids", List.copyOf(checkpointIds))
        );
    }

    public int deleteAll(String jobId) {
        return jdbc.update(
            "DELETE FROM crawl_checkpoints WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId)
        );
    }

    private RowMapper<CheckpointRecord> recordMapper() {
        return (rs, rowNum) -> mapRecord(rs);
    }

    private CheckpointRecord mapRecord(ResultSet rs) throws SQLException {
        String substate = rs.getString("substate_name");
        return new CheckpointRecord(
            rs.getString("checkpoint_id"),
            rs.getString("job_id"),
            rs.getInt("checkpoint_number"),
            CheckpointType.valueOf(rs.getString("checkpoint_type")),
            toInstant(rs.getTimestamp("created_at")),
            CrawlState.valueOf(rs.getString("state_name")),
            substate == null ? null : CrawlSubstate.valueOf(substate),
            rs.getInt("payload_size")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
