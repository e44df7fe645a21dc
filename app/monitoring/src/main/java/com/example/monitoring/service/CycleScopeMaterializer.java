/*
 * どこで: Monitoring サービス層
 * 何を: サイクル開始時点の有効所属をスコープ行として書き込む
 * なぜ: 開始後の移管や置換がサイクルの対象モデルに波及しないよう、開始時点で凍結するため
 */
package com.example.monitoring.service;

import com.example.monitoring.model.ScopeModel;
import com.example.monitoring.model.ScopeSource;
import com.example.monitoring.repository.CycleScopeRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class CycleScopeMaterializer {

  private final CycleScopeRepository scopeRepository;
  private final MonitoringAuditWriter auditWriter;

  // 既に行があれば書き込まずにそれを返す。スコープ行は DB 側でも変更不可。
  @Transactional(propagation = Propagation.MANDATORY)
  public List<ScopeModel> materialize(
      long cycleId, long planId, List<ScopeModel> lockedMembers, Instant lockedAt) {
    if (scopeRepository.existsByCycleId(cycleId)) {
      return scopeRepository.findByCycleId(cycleId).stream()
          .map(row -> new ScopeModel(row.modelId(), row.modelName()))
          .toList();
    }
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("plan_id", planId);
    details.put("source", "monitoring_plan_memberships");
    scopeRepository.insertAll(
        cycleId, lockedMembers, lockedAt, ScopeSource.LEDGER_DIRECT, auditWriter.toJson(details));
    return lockedMembers;
  }
}
