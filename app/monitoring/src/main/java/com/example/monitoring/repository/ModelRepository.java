/*
 * どこで: Monitoring データアクセス
 * 何を: models の存在確認と名称解決を行う
 * なぜ: スコープ行とレスポンスにモデル名を添えるため
 */
package com.example.monitoring.repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ModelRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Long> findExistingIds(Collection<Long> modelIds) {
    if (modelIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT model_id
        FROM models
        WHERE model_id IN (:modelIds)
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelIds", modelIds);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  public Map<Long, String> findNamesByIds(Collection<Long> modelIds) {
    final Map<Long, String> names = new HashMap<>();
    if (modelIds.isEmpty()) {
      return names;
    }
    final String sql =
        """
        SELECT model_id, model_name
        FROM models
        WHERE model_id IN (:modelIds)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("modelIds", modelIds);
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          names.put(rs.getLong("model_id"), rs.getString("model_name"));
        });
    return names;
  }
}
