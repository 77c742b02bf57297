package com.harvest.coordinator.crawl.persistence;

import com.harvest.coordinator.crawl.iteration.ComparisonSummary;
import com.harvest.coordinator.crawl.iteration.Iteration;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class IterationRepository {
    private static final String COLUMNS = """
        lineage_id, iteration_number, job_id, mode, parent_iteration, started_at, completed_at,
        new_count, modified_count, unchanged_count, deleted_count
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public IterationRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(Iteration iteration) {
        jdbc.update(
            """
                INSERT INTO crawl_iterations (
                    lineage_id, iteration_number, job_id, mode, parent_iteration, started_at
                )
                VALUES (:lineageId, :iteration, :jobId, :mode, :parentIteration, :startedAt)
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", iteration.lineageId())
                .addValue("iteration", iteration.iterationNumber())
                .addValue("jobId", iteration.jobId())
                .addValue("mode", iteration.mode().name())
                .addValue("parentIteration", iteration.parentIteration())
                .addValue("startedAt", toTimestamp(iteration.startedAt()))
        );
    }

    /** Hands an unfinished iteration over to a recovery job. */
    public int reassign(String lineageId, int iteration, String jobId) {
        return jdbc.update(
            """
                UPDATE crawl_iterations
                SET job_id = :jobId
                WHERE lineage_id = :lineageId AND iteration_number = :iteration
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration)
                .addValue("jobId", jobId)
        );
    }

    public int complete(String lineageId, int iteration, Instant completedAt, ComparisonSummary summary) {
        return jdbc.update(
            """
                UPDATE crawl_iterations
                SET completed_at = :completedAt,
                    new_count = :newCount,
                    modified_count = :modifiedCount,
                    unchanged_count = :unchangedCount,
                    deleted_count = :deletedCount
                WHERE lineage_id = :lineageId AND iteration_number = :iteration
                """,
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration)
                .addValue("completedAt", toTimestamp(completedAt))
                .addValue("newCount", summary.newCount())
                .addValue("modifiedCount", summary.modifiedCount())
                .addValue("unchangedCount", summary.unchangedCount())
                .addValue("deletedCount", summary.deletedCount())
        );
    }

    public Optional<Iteration> find(String lineageId, int iteration) {
        List<Iteration> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_iterations WHERE lineage_id = :lineageId AND iteration_number = :iteration",
            new MapSqlParameterSource()
                .addValue("lineageId", lineageId)
                .addValue("iteration", iteration),
            iterationMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Iteration> findByJobId(String jobId) {
        List<Iteration> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_iterations WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            iterationMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Iteration> findByLineage(String lineageId) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_iterations WHERE lineage_id = :lineageId ORDER BY iteration_number",
            new MapSqlParameterSource().addValue("lineageId", lineageId),
            iterationMapper()
        );
    }

    public Optional<Iteration> findLatestCompleted(String lineageId) {
        List<Iteration> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM crawl_iterations
                WHERE lineage_id = :lineageId AND completed_at IS NOT NULL
                ORDER BY iteration_number DESC
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("lineageId", lineageId),
            iterationMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Integer> findMaxIterationNumber(String lineageId) {
        Integer max = jdbc.queryForObject(
            "SELECT MAX(iteration_number) FROM crawl_iterations WHERE lineage_id = :lineageId",
            new MapSqlParameterSource().addValue("lineageId", lineageId),
            Integer.class
        );
        return Optional.ofNullable(max);
    }

    public int deleteLineage(String lineageId) {
        return jdbc.update(
            "DELETE FROM crawl_iterations WHERE lineage_id = :lineageId",
            new MapSqlParameterSource().addValue("lineageId", lineageId)
        );
    }

    private RowMapper<Iteration> iterationMapper() {
        return (rs, rowNum) -> new Iteration(
            rs.getString("lineage_id"),
            rs.getInt("iteration_number"),
            rs.getString("job_id"),
            IterationMode.valueOf(rs.getString("mode")),
            nullableInt(rs, "parent_iteration"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            summaryOf(rs)
        );
    }

    private ComparisonSummary summaryOf(ResultSet rs) throws SQLException {
        Integer newCount = nullableInt(rs, "new_count");
        if (newCount == null) {
            return null;
        }
        return new ComparisonSummary(
            newCount,
            rs.getInt("modified_count"),
            rs.getInt("unchanged_count"),
            rs.getInt("deleted_count")
        );
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
