/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_audit_log の登録を行う
 * なぜ: 所属変更とサイクル遷移の操作履歴を追跡できるようにするため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.monitoring.model.MonitoringAuditRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MonitoringAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(MonitoringAuditRecord record) {
    final String sql =
        """
        INSERT INTO monitoring_audit_log (
          audit_id,
          occurred_at,
          entity_type,
          entity_id,
          action,
          actor_user_id,
          request_id,
          detail
        ) VALUES (
          :auditId,
          :occurredAt,
          :entityType,
          :entityId,
          :action,
          :actorUserId,
          :requestId,
          :detail::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("entityType", record.entityType())
            .addValue("entityId", record.entityId())
            .addValue("action", record.action())
            .addValue("actorUserId", record.actorUserId())
            .addValue("requestId", record.requestId())
            .addValue("detail", record.detailJson());
    return jdbcTemplate.update(sql, params);
  }
}
