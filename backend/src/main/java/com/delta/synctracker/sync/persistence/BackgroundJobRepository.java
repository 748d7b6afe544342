package com.delta.synctracker.sync.persistence;

import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.JobStatus;
import com.delta.synctracker.sync.model.JobSummary;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job record store. Every status change is a compare-and-set update guarded by the expected
 * source states, so concurrent callers racing on the same job see at most one winner.
 */
@Repository
public class BackgroundJobRepository {
    private static final String JOB_COLUMNS = """
        id,
        job_type,
        payload,
        status,
        result,
        last_error,
        retry_count,
        created_at,
        started_at,
        completed_at,
        scheduled_at,
        created_by,
        correlation_id
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public BackgroundJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(BackgroundJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("jobType", job.jobType())
            .addValue("payload", job.payload(), Types.VARCHAR)
            .addValue("status", job.status().name())
            .addValue("retryCount", job.retryCount())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("scheduledAt", toTimestamp(job.scheduledAt()), Types.TIMESTAMP)
            .addValue("createdBy", job.createdBy(), Types.VARCHAR)
            .addValue("correlationId", job.correlationId(), Types.VARCHAR);
        jdbc.update(
            """
                INSERT INTO background_jobs (
                    id,
                    job_type,
                    payload,
                    status,
                    retry_count,
                    created_at,
                    scheduled_at,
                    created_by,
                    correlation_id,
                    updated_at
                )
                VALUES (
                    :id,
                    :jobType,
                    :payload,
                    :status,
                    :retryCount,
                    :createdAt,
                    :scheduledAt,
                    :createdBy,
                    :correlationId,
                    :createdAt
                )
                """,
            params
        );
    }

    public BackgroundJob findById(UUID id) {
        List<BackgroundJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM background_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            jobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<JobSummary> findPage(JobStatus status, String jobType, int limit, int offset) {
        MapSqlParameterSource params = filterParams(status, jobType)
            .addValue("limit", limit)
            .addValue("offset", offset);
        return jdbc.query(
            """
                SELECT id,
                       job_type,
                       status,
                       retry_count,
                       created_at,
                       completed_at,
                       last_error
                FROM background_jobs
                WHERE (:status IS NULL OR status = :status)
                  AND (:jobType IS NULL OR job_type = :jobType)
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                OFFSET :offset
                """,
            params,
            (rs, rowNum) -> new JobSummary(
                rs.getObject("id", UUID.class),
                rs.getString("job_type"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getInt("retry_count"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getString("last_error")
            )
        );
    }

    public long countJobs(JobStatus status, String jobType) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM background_jobs
                WHERE (:status IS NULL OR status = :status)
                  AND (:jobType IS NULL OR job_type = :jobType)
                """,
            filterParams(status, jobType),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        jdbc.query(
            """
                SELECT status, COUNT(*) AS job_count
                FROM background_jobs
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getLong("job_count"));
            }
        );
        return counts;
    }

    /** FAILED or CANCELLED back to PENDING; returns false when the job was not in a retryable state. */
    public boolean retry(UUID id, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE background_jobs
                SET status = 'PENDING',
                    retry_count = retry_count + 1,
                    last_error = NULL,
                    result = NULL,
                    started_at = NULL,
                    completed_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('FAILED', 'CANCELLED')
                """,
            params
        );
        return updated == 1;
    }

    public boolean cancel(UUID id, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE background_jobs
                SET status = 'CANCELLED',
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('PENDING', 'PROCESSING')
                """,
            params
        );
        return updated == 1;
    }

    public boolean markProcessing(UUID id, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE background_jobs
                SET status = 'PROCESSING',
                    started_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'PENDING'
                """,
            params
        );
        return updated == 1;
    }

    public boolean markCompleted(UUID id, String result, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("result", result, Types.VARCHAR)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE background_jobs
                SET status = 'COMPLETED',
                    result = :result,
                    last_error = NULL,
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'PROCESSING'
                """,
            params
        );
        return updated == 1;
    }

    public boolean markFailed(UUID id, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastError", error, Types.VARCHAR)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE background_jobs
                SET status = 'FAILED',
                    last_error = :lastError,
                    completed_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'PROCESSING'
                """,
            params
        );
        return updated == 1;
    }

    /** Oldest due pending job ids, oldest first; the caller claims one with {@link #markProcessing}. */
    public List<UUID> findDuePendingIds(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id
                FROM background_jobs
                WHERE status = 'PENDING'
                  AND (scheduled_at IS NULL OR scheduled_at <= :now)
                ORDER BY created_at ASC, id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getObject("id", UUID.class)
        );
    }

    private MapSqlParameterSource filterParams(JobStatus status, String jobType) {
        String safeJobType = jobType == null || jobType.isBlank() ? null : jobType.trim();
        return new MapSqlParameterSource()
            .addValue("status", status == null ? null : status.name(), Types.VARCHAR)
            .addValue("jobType", safeJobType, Types.VARCHAR);
    }

    private RowMapper<BackgroundJob> jobRowMapper() {
        return (rs, rowNum) -> new BackgroundJob(
            rs.getObject("id", UUID.class),
            rs.getString("job_type"),
            rs.getString("payload"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("result"),
            rs.getString("last_error"),
            rs.getInt("retry_count"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            toInstant(rs.getTimestamp("scheduled_at")),
            rs.getString("created_by"),
            rs.getString("correlation_id")
        );
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
