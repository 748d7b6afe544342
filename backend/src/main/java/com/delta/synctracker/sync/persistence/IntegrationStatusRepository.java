package com.delta.synctracker.sync.persistence;

import com.delta.synctracker.sync.model.IntegrationHealth;
import com.delta.synctracker.sync.model.IntegrationStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Repository
public class IntegrationStatusRepository {
    private static final String STATUS_COLUMNS = """
        integration_name,
        health,
        consecutive_failures,
        total_successes,
        total_failures,
        last_success_at,
        last_failure_at,
        last_attempt_at,
        last_error_message,
        last_error_details,
        average_sync_duration_ms,
        stale_threshold_seconds,
        is_manually_disabled,
        disabled_reason,
        disabled_by,
        disabled_at,
        created_at,
        updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public IntegrationStatusRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Inserts the row unless one already exists for the name. Returns true when a row was created. */
    public boolean insertIfMissing(IntegrationStatus status) {
        int inserted = jdbc.update(
            """
                INSERT INTO integration_statuses (
                    integration_name,
                    health,
                    consecutive_failures,
                    total_successes,
                    total_failures,
                    stale_threshold_seconds,
                    is_manually_disabled,
                    created_at,
                    updated_at
                )
                VALUES (
                    :integrationName,
                    :health,
                    :consecutiveFailures,
                    :totalSuccesses,
                    :totalFailures,
                    :staleThresholdSeconds,
                    :manuallyDisabled,
                    :createdAt,
                    :updatedAt
                )
                ON CONFLICT DO NOTHING
                """,
            toParams(status)
        );
        return inserted == 1;
    }

    public IntegrationStatus findByName(String integrationName) {
        List<IntegrationStatus> rows = jdbc.query(
            "SELECT " + STATUS_COLUMNS + " FROM integration_statuses WHERE integration_name = :name",
            new MapSqlParameterSource().addValue("name", integrationName),
            statusRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Locks the row until the surrounding transaction ends. */
    public IntegrationStatus findForUpdate(String integrationName) {
        List<IntegrationStatus> rows = jdbc.query(
            "SELECT " + STATUS_COLUMNS + " FROM integration_statuses WHERE integration_name = :name FOR UPDATE",
            new MapSqlParameterSource().addValue("name", integrationName),
            statusRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<IntegrationStatus> findAll() {
        return jdbc.query(
            "SELECT " + STATUS_COLUMNS + " FROM integration_statuses ORDER BY integration_name ASC",
            new MapSqlParameterSource(),
            statusRowMapper()
        );
    }

    public void update(IntegrationStatus status) {
        jdbc.update(
            """
                UPDATE integration_statuses
                SET health = :health,
                    consecutive_failures = :consecutiveFailures,
                    total_successes = :totalSuccesses,
                    total_failures = :totalFailures,
                    last_success_at = :lastSuccessAt,
                    last_failure_at = :lastFailureAt,
                    last_attempt_at = :lastAttemptAt,
                    last_error_message = :lastErrorMessage,
                    last_error_details = :lastErrorDetails,
                    average_sync_duration_ms = :averageSyncDurationMs,
                    stale_threshold_seconds = :staleThresholdSeconds,
                    is_manually_disabled = :manuallyDisabled,
                    disabled_reason = :disabledReason,
                    disabled_by = :disabledBy,
                    disabled_at = :disabledAt,
                    updated_at = :updatedAt
                WHERE integration_name = :integrationName
                """,
            toParams(status)
        );
    }

    private MapSqlParameterSource toParams(IntegrationStatus status) {
        Duration average = status.averageSyncDuration();
        return new MapSqlParameterSource()
            .addValue("integrationName", status.integrationName())
            .addValue("health", status.health().name())
            .addValue("consecutiveFailures", status.consecutiveFailures())
            .addValue("totalSuccesses", status.totalSuccesses())
            .addValue("totalFailures", status.totalFailures())
            .addValue("lastSuccessAt", toTimestamp(status.lastSuccessAt()), Types.TIMESTAMP)
            .addValue("lastFailureAt", toTimestamp(status.lastFailureAt()), Types.TIMESTAMP)
            .addValue("lastAttemptAt", toTimestamp(status.lastAttemptAt()), Types.TIMESTAMP)
            .addValue("lastErrorMessage", truncate(status.lastErrorMessage(), 1000), Types.VARCHAR)
            .addValue("lastErrorDetails", status.lastErrorDetails(), Types.VARCHAR)
            .addValue("averageSyncDurationMs", average == null ? null : average.toMillis(), Types.BIGINT)
            .addValue("staleThresholdSeconds", status.staleThreshold().getSeconds())
            .addValue("manuallyDisabled", status.manuallyDisabled())
            .addValue("disabledReason", truncate(status.disabledReason(), 500), Types.VARCHAR)
            .addValue("disabledBy", truncate(status.disabledBy(), 200), Types.VARCHAR)
            .addValue("disabledAt", toTimestamp(status.disabledAt()), Types.TIMESTAMP)
            .addValue("createdAt", toTimestamp(status.createdAt()))
            .addValue("updatedAt", toTimestamp(status.updatedAt()));
    }

    private RowMapper<IntegrationStatus> statusRowMapper() {
        return (rs, rowNum) -> new IntegrationStatus(
            rs.getString("integration_name"),
            IntegrationHealth.valueOf(rs.getString("health")),
            rs.getInt("consecutive_failures"),
            rs.getLong("total_successes"),
            rs.getLong("total_failures"),
            toInstant(rs.getTimestamp("last_success_at")),
            toInstant(rs.getTimestamp("last_failure_at")),
            toInstant(rs.getTimestamp("last_attempt_at")),
            rs.getString("last_error_message"),
            rs.getString("last_error_details"),
            readMillis(rs, "average_sync_duration_ms"),
            Duration.ofSeconds(rs.getLong("stale_threshold_seconds")),
            rs.getBoolean("is_manually_disabled"),
            rs.getString("disabled_reason"),
            rs.getString("disabled_by"),
            toInstant(rs.getTimestamp("disabled_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private Duration readMillis(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Duration.ofMillis(millis);
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
