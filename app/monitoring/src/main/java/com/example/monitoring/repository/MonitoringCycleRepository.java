/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_cycles の参照/ロック/状態更新を行う
 * なぜ: 状態遷移を「期待する現在状態」付きの条件更新で行い、取りこぼしを検知するため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.monitoring.model.MonitoringCycleRecord;
import com.example.monitoring.model.MonitoringCycleStatus;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class MonitoringCycleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MonitoringCycleRecord> findById(long cycleId) {
    final String sql =
        """
        SELECT cycle_id, plan_id, period_start_date, period_end_date, status, plan_version_id,
               version_locked_at, version_locked_by_user_id, notes, scope_materialized_at
        FROM monitoring_cycles
        WHERE cycle_id = :cycleId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<MonitoringCycleRecord> lockById(long cycleId) {
    final String sql =
        """
        SELECT cycle_id, plan_id, period_start_date, period_end_date, status, plan_version_id,
               version_locked_at, version_locked_by_user_id, notes, scope_materialized_at
        FROM monitoring_cycles
        WHERE cycle_id = :cycleId
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<MonitoringCycleRecord> findFirstByPlanIdAndStatusIn(
      long planId, Collection<MonitoringCycleStatus> statuses) {
    final String sql =
        """
        SELECT cycle_id, plan_id, period_start_date, period_end_date, status, plan_version_id,
               version_locked_at, version_locked_by_user_id, notes, scope_materialized_at
        FROM monitoring_cycles
        WHERE plan_id = :planId
          AND status IN (:statuses)
        ORDER BY cycle_id ASC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("planId", planId)
            .addValue("statuses", statuses.stream().map(Enum::name).toList());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markStarted(
      long cycleId, long planVersionId, Instant lockedAt, String lockedByUserId) {
    // PENDING からの遷移だけを通す。0 件なら呼び出し側で不変条件違反として扱う。
    final String sql =
        """
        UPDATE monitoring_cycles
        SET status = 'DATA_COLLECTION',
            plan_version_id = :planVersionId,
            version_locked_at = :lockedAt,
            version_locked_by_user_id = :lockedByUserId,
            scope_materialized_at = :lockedAt,
            updated_at = :lockedAt
        WHERE cycle_id = :cycleId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("planVersionId", planVersionId)
            .addValue("lockedAt", toTimestamp(lockedAt))
            .addValue("lockedByUserId", lockedByUserId);
    return jdbcTemplate.update(sql, params);
  }

  public int updateStatus(
      long cycleId,
      MonitoringCycleStatus expected,
      MonitoringCycleStatus next,
      String notes,
      Instant now) {
    final String sql =
        """
        UPDATE monitoring_cycles
        SET status = :next,
            notes = :notes,
            updated_at = :now
        WHERE cycle_id = :cycleId
          AND status = :expected
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cycleId", cycleId)
            .addValue("expected", expected.name())
            .addValue("next", next.name())
            .addValue("notes", notes)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MonitoringCycleRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long planVersionId = rs.getLong("plan_version_id");
    final Long nullablePlanVersionId = rs.wasNull() ? null : planVersionId;
    return new MonitoringCycleRecord(
        rs.getLong("cycle_id"),
        rs.getLong("plan_id"),
        toLocalDate(rs.getDate("period_start_date")),
        toLocalDate(rs.getDate("period_end_date")),
        MonitoringCycleStatus.valueOf(rs.getString("status")),
        nullablePlanVersionId,
        getInstant(rs, "version_locked_at"),
        rs.getString("version_locked_by_user_id"),
        rs.getString("notes"),
        getInstant(rs, "scope_materialized_at"));
  }

  private LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
