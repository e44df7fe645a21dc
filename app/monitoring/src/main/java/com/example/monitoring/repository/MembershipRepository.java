/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_plan_memberships(所属台帳)の参照/ロック/追記/クローズを行う
 * なぜ: 「モデルごとに有効な所属は高々 1 件」を SQL 単位で守るため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.monitoring.model.MembershipRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class MembershipRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MembershipRecord> findActiveByModelId(long modelId) {
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE model_id = :modelId
          AND effective_to IS NULL
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelId", modelId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<MembershipRecord> findActiveByModelIds(Collection<Long> modelIds) {
    if (modelIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE model_id IN (:modelIds)
          AND effective_to IS NULL
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelIds", modelIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<MembershipRecord> findActiveByPlanId(long planId) {
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE plan_id = :planId
          AND effective_to IS NULL
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public List<MembershipRecord> lockActiveByPlanIdOrModelIds(
      long planId, Collection<Long> modelIds) {
    if (modelIds.isEmpty()) {
      return lockActiveByPlanId(planId);
    }
    // プランの現メンバーと指定モデルの有効行をまとめて model_id 昇順でロックする。
    // 1 文で取ることで、複数回に分けたロック取得による順序の逆転を起こさない。
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE effective_to IS NULL
          AND (plan_id = :planId OR model_id IN (:modelIds))
        ORDER BY model_id ASC
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("planId", planId)
            .addValue("modelIds", modelIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public List<MembershipRecord> lockActiveByModelIds(Collection<Long> modelIds) {
    if (modelIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE model_id IN (:modelIds)
          AND effective_to IS NULL
        ORDER BY model_id ASC
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelIds", modelIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public List<MembershipRecord> lockActiveByPlanId(long planId) {
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE plan_id = :planId
          AND effective_to IS NULL
        ORDER BY model_id ASC
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public MembershipRecord insertActive(
      long modelId, long planId, Instant effectiveFrom, String reason, String changedByUserId) {
    final String sql =
        """
        INSERT INTO monitoring_plan_memberships (
          model_id,
          plan_id,
          effective_from,
          effective_to,
          reason,
          changed_by_user_id,
          created_at,
          updated_at
        ) VALUES (
          :modelId,
          :planId,
          :effectiveFrom,
          NULL,
          :reason,
          :changedByUserId,
          :effectiveFrom,
          :effectiveFrom
        )
        RETURNING membership_id, model_id, plan_id, effective_from, effective_to, reason,
                  changed_by_user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("modelId", modelId)
            .addValue("planId", planId)
            .addValue("effectiveFrom", toTimestamp(effectiveFrom))
            .addValue("reason", reason)
            .addValue("changedByUserId", changedByUserId);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int close(long membershipId, Instant effectiveTo) {
    // 既にクローズ済みの行は再クローズしない(0 件更新で呼び出し側が検知する)。
    final String sql =
        """
        UPDATE monitoring_plan_memberships
        SET effective_to = :effectiveTo,
            updated_at = :effectiveTo
        WHERE membership_id = :membershipId
          AND effective_to IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("membershipId", membershipId)
            .addValue("effectiveTo", toTimestamp(effectiveTo));
    return jdbcTemplate.update(sql, params);
  }

  public List<MembershipRecord> findByModelId(long modelId) {
    final String sql =
        """
        SELECT membership_id, model_id, plan_id, effective_from, effective_to, reason,
               changed_by_user_id
        FROM monitoring_plan_memberships
        WHERE model_id = :modelId
        ORDER BY effective_from DESC, membership_id DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelId", modelId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MembershipRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MembershipRecord(
        rs.getLong("membership_id"),
        rs.getLong("model_id"),
        rs.getLong("plan_id"),
        getInstant(rs, "effective_from"),
        getInstant(rs, "effective_to"),
        rs.getString("reason"),
        rs.getString("changed_by_user_id"));
  }
}
