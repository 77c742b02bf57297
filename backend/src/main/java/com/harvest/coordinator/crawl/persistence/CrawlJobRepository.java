package com.harvest.coordinator.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.model.CrawlJobConfig;
import com.harvest.coordinator.crawl.model.StoredJob;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import com.harvest.coordinator.crawl.state.JobCounters;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;
import com.harvest.coordinator.crawl.state.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class CrawlJobRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<StateTransition>> HISTORY = new TypeReference<>() {};
    private static final String COLUMNS = """
        job_id, lineage_id, parent_job_id, targets_json, config_json, mode, iteration_number,
        current_state, substate, error_message, urls_crawled, urls_failed, urls_skipped, documents_found,
        state_history_json, paused_from, paused_substate, created_at, started_at, paused_at, completed_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public void insert(CrawlJob job, JobStateSnapshot state) {
        MapSqlParameterSource params = stateParams(job.jobId(), state)
            .addValue("lineageId", job.lineageId())
            .addValue("parentJobId", job.parentJobId())
            .addValue("targetsJson", toJson(job.targets()))
            .addValue("configJson", toJson(job.config()))
            .addValue("mode", job.mode().name())
            .addValue("iteration", job.iterationNumber())
            .addValue("createdAt", toTimestamp(job.createdAt()));
        jdbc.update(
            """
                INSERT INTO crawl_jobs (
                    job_id, lineage_id, parent_job_id, targets_json, config_json, mode, iteration_number,
                    current_state, substate, error_message, urls_crawled, urls_failed, urls_skipped, documents_found,
                    state_history_json, paused_from, paused_substate, created_at, started_at, paused_at, completed_at,
                    updated_at
                )
                VALUES (
                    :jobId, :lineageId, :parentJobId, :targetsJson, :configJson, :mode, :iteration,
                    :currentState, :substate, :errorMessage, :urlsCrawled, :urlsFailed, :urlsSkipped, :documentsFound,
                    :historyJson, :pausedFrom, :pausedSubstate, :createdAt, :startedAt, :pausedAt, :completedAt,
                    :updatedAt
                )
                """,
            params
        );
    }

    public int updateState(String jobId, JobStateSnapshot state) {
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET current_state = :currentState,
                    substate = :substate,
                    error_message = :errorMessage,
                    urls_crawled = :urlsCrawled,
                    urls_failed = :urlsFailed,
                    urls_skipped = :urlsSkipped,
                    documents_found = :documentsFound,
                    state_history_json = :historyJson,
                    paused_from = :pausedFrom,
                    paused_substate = :pausedSubstate,
                    started_at = :startedAt,
                    paused_at = :pausedAt,
                    completed_at = :completedAt,
                    updated_at = :updatedAt
                WHERE job_id = :jobId
                """,
            stateParams(jobId, state)
        );
    }

    public Optional<StoredJob> find(String jobId) {
        List<StoredJob> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_jobs WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            jobMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<StoredJob> findRecent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_jobs ORDER BY created_at DESC, job_id LIMIT :limit",
            new MapSqlParameterSource().addValue("limit", safeLimit),
            jobMapper()
        );
    }

    public List<StoredJob> findByStates(Collection<CrawlState> states) {
        if (states == null || states.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_jobs WHERE current_state IN (:states) ORDER BY created_at",
            new MapSqlParameterSource().addValue("states", states.stream().map(Enum::name).toList()),
            jobMapper()
        );
    }

    public List<StoredJob> findByLineage(String lineageId) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM crawl_jobs WHERE lineage_id = :lineageId ORDER BY iteration_number, created_at",
            new MapSqlParameterSource().addValue("lineageId", lineageId),
            jobMapper()
        );
    }

    public int delete(String jobId) {
        return jdbc.update(
            "DELETE FROM crawl_jobs WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId)
        );
    }

    private MapSqlParameterSource stateParams(String jobId, JobStateSnapshot state) {
        JobCounters counters = state.counters();
        return new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("currentState", state.currentState().name())
            .addValue("substate", state.substate() == null ? null : state.substate().name())
            .addValue("errorMessage", state.error())
            .addValue("urlsCrawled", counters.urlsCrawled())
            .addValue("urlsFailed", counters.urlsFailed())
            .addValue("urlsSkipped", counters.urlsSkipped())
            .addValue("documentsFound", counters.documentsFound())
            .addValue("historyJson", toJson(state.history()))
            .addValue("pausedFrom", state.pausedFrom() == null ? null : state.pausedFrom().name())
            .addValue("pausedSubstate", state.pausedSubstate() == null ? null : state.pausedSubstate().name())
            .addValue("startedAt", toTimestamp(state.startedAt()))
            .addValue("pausedAt", toTimestamp(state.pausedAt()))
            .addValue("completedAt", toTimestamp(state.completedAt()))
            .addValue("updatedAt", toTimestamp(Instant.now()));
    }

    private RowMapper<StoredJob> jobMapper() {
        return (rs, rowNum) -> {
            String jobId = rs.getString("job_id");
            CrawlJob job = new CrawlJob(
                jobId,
                rs.getString("lineage_id"),
                rs.getString("parent_job_id"),
                fromJson(rs.getString("targets_json"), STRING_LIST, List.of()),
                fromJson(rs.getString("config_json"), CrawlJobConfig.class, CrawlJobConfig.defaults()),
                IterationMode.valueOf(rs.getString("mode")),
                rs.getInt("iteration_number"),
                toInstant(rs.getTimestamp("created_at"))
            );
            JobStateSnapshot state = new JobStateSnapshot(
                jobId,
                CrawlState.valueOf(rs.getString("current_state")),
                parseSubstate(rs.getString("substate")),
                rs.getString("error_message"),
                new JobCounters(
                    rs.getLong("urls_crawled"),
                    rs.getLong("urls_failed"),
                    rs.getLong("urls_skipped"),
                    rs.getLong("documents_found")
                ),
                fromJson(rs.getString("state_history_json"), HISTORY, List.of()),
                parseState(rs.getString("paused_from")),
                parseSubstate(rs.getString("paused_substate")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("paused_at")),
                toInstant(rs.getTimestamp("completed_at"))
            );
            return new StoredJob(job, state);
        };
    }

    private CrawlState parseState(String raw) {
        return raw == null || raw.isBlank() ? null : CrawlState.valueOf(raw);
    }

    private CrawlSubstate parseSubstate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return CrawlSubstate.valueOf(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown substate value in crawl_jobs: {}", raw);
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unable to parse {} column; using defaults", type.getSimpleName(), e);
            return fallback;
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unable to parse JSON column of type {}; using defaults", type.getType(), e);
            return fallback;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
