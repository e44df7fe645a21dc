/*
 * どこで: Monitoring サービス層
 * 何を: サイクルの対象モデルを、凍結行 → 版スナップショット → 結果 → 現所属の順で解決する
 * なぜ: 開始処理を経ていない過去サイクルや版だけを持つサイクルでも、最も確かな根拠で答えるため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.ResourceNotFoundException;
import com.example.monitoring.model.CycleScopeRecord;
import com.example.monitoring.model.MembershipRecord;
import com.example.monitoring.model.MonitoringCycleRecord;
import com.example.monitoring.model.ResolvedScope;
import com.example.monitoring.model.ScopeModel;
import com.example.monitoring.model.ScopeSource;
import com.example.monitoring.repository.CycleScopeRepository;
import com.example.monitoring.repository.MembershipRepository;
import com.example.monitoring.repository.ModelRepository;
import com.example.monitoring.repository.MonitoringCycleRepository;
import com.example.monitoring.repository.MonitoringResultRepository;
import com.example.monitoring.repository.PlanVersionRepository;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CycleScopeResolver {

  private final MonitoringCycleRepository cycleRepository;
  private final CycleScopeRepository scopeRepository;
  private final PlanVersionRepository versionRepository;
  private final MonitoringResultRepository resultRepository;
  private final MembershipRepository membershipRepository;
  private final ModelRepository modelRepository;

  /**
   * サイクルのスコープを解決する。
   *
   * <p>開始処理で凍結したサイクルは凍結行だけで答える(0 件なら空)。フォールバックは凍結を経ていない
   * サイクル向けで、MEMBERSHIP_FALLBACK はサイクル時点ではなく現在の所属なので、
   * 他の根拠が全て空のときだけ使う。
   */
  @Transactional(readOnly = true)
  public ResolvedScope resolve(long cycleId) {
    final MonitoringCycleRecord cycle =
        cycleRepository
            .findById(cycleId)
            .orElseThrow(
                () -> new ResourceNotFoundException("monitoring cycle not found: " + cycleId));

    final List<CycleScopeRecord> rows = scopeRepository.findByCycleId(cycleId);
    if (!rows.isEmpty()) {
      final List<ScopeModel> models =
          rows.stream().map(row -> new ScopeModel(row.modelId(), row.modelName())).toList();
      return new ResolvedScope(cycleId, rows.get(0).scopeSource(), models);
    }
    if (cycle.isScopeMaterialized()) {
      // 空のプランで開始したサイクル。後からの所属変更や版スナップショットで埋めない。
      return new ResolvedScope(cycleId, ScopeSource.LEDGER_DIRECT, List.of());
    }

    if (cycle.planVersionId() != null) {
      final List<ScopeModel> snapshot = versionRepository.findModelSnapshots(cycle.planVersionId());
      if (!snapshot.isEmpty()) {
        return new ResolvedScope(cycleId, ScopeSource.VERSION_SNAPSHOT, snapshot);
      }
    }

    final List<Long> evidence = resultRepository.findDistinctModelIdsByCycleId(cycleId);
    if (!evidence.isEmpty()) {
      return new ResolvedScope(cycleId, ScopeSource.RESULT_EVIDENCE, withNames(evidence));
    }

    final List<Long> members =
        membershipRepository.findActiveByPlanId(cycle.planId()).stream()
            .map(MembershipRecord::modelId)
            .toList();
    if (!members.isEmpty()) {
      return new ResolvedScope(cycleId, ScopeSource.MEMBERSHIP_FALLBACK, withNames(members));
    }
    return new ResolvedScope(cycleId, ScopeSource.NONE, List.of());
  }

  @Transactional(readOnly = true)
  public List<Long> getScopeModelIds(long cycleId) {
    return resolve(cycleId).modelIds();
  }

  private List<ScopeModel> withNames(List<Long> modelIds) {
    final Map<Long, String> names = modelRepository.findNamesByIds(modelIds);
    return modelIds.stream().sorted().map(id -> new ScopeModel(id, names.get(id))).toList();
  }
}
