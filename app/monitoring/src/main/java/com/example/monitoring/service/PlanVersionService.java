/*
 * どこで: Monitoring サービス層
 * 何を: プラン設定版の公開と、サイクル開始時の有効版の解決を行う
 * なぜ: サイクルが「どの版の設定で実施されたか」を開始時点で一意に固定するため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.response.PlanVersionResponse;
import com.example.monitoring.model.MembershipRecord;
import com.example.monitoring.model.PlanVersionRecord;
import com.example.monitoring.model.ScopeModel;
import com.example.monitoring.repository.ModelRepository;
import com.example.monitoring.repository.PlanVersionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PlanVersionService {

  private static final Logger logger = LoggerFactory.getLogger(PlanVersionService.class);

  static final String ACTION_PUBLISH = "PUBLISH_PLAN_VERSION";

  private final PlanVersionRepository versionRepository;
  private final ModelRepository modelRepository;
  private final MembershipLockCoordinator lockCoordinator;
  private final MonitoringAuditWriter auditWriter;
  private final Clock clock;

  /**
   * 新しい版を公開し、それまでの有効版を無効化する。
   *
   * <p>includeModels が真なら、公開時点の有効所属をモデルスナップショットとして版に持たせる。
   */
  @Transactional
  public PlanVersionResponse publishVersion(
      long planId, String versionName, boolean includeModels, String actorUserId) {
    PlanMembershipService.requireActor(actorUserId);
    return lockCoordinator.runLocked(
        "publish plan version",
        () -> {
          lockCoordinator.lockPlans(Set.of(planId));
          final List<ScopeModel> members =
              includeModels ? toScopeModels(lockCoordinator.lockAllPlanMembers(planId)) : List.of();
          final Instant now = Instant.now(clock);
          final PlanVersionRecord version =
              publish(planId, versionName, members, actorUserId, now);
          return new PlanVersionResponse(
              version.versionId(),
              version.planId(),
              version.versionNumber(),
              version.versionName(),
              version.effectiveDate(),
              version.publishedAt(),
              members.size());
        });
  }

  /**
   * サイクル開始用に有効版をロックして返す。有効版が無ければ、ロック済みの所属を持つ版をその場で公開する。
   *
   * <p>プラン行と所属行のロックを保持したトランザクション内で呼ぶこと。
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public PlanVersionRecord resolveActiveVersion(
      long planId, List<ScopeModel> lockedMembers, String actorUserId, Instant now) {
    final Optional<PlanVersionRecord> active = versionRepository.lockActiveByPlanId(planId);
    if (active.isPresent()) {
      return active.get();
    }
    return publish(planId, null, lockedMembers, actorUserId, now);
  }

  List<ScopeModel> toScopeModels(List<MembershipRecord> memberships) {
    final List<Long> modelIds = memberships.stream().map(MembershipRecord::modelId).toList();
    final Map<Long, String> names = modelRepository.findNamesByIds(modelIds);
    return modelIds.stream().map(id -> new ScopeModel(id, names.get(id))).toList();
  }

  private PlanVersionRecord publish(
      long planId,
      String versionName,
      List<ScopeModel> members,
      String actorUserId,
      Instant now) {
    versionRepository.lockActiveByPlanId(planId);
    versionRepository.deactivateActive(planId);
    final int versionNumber = versionRepository.nextVersionNumber(planId);
    final String resolvedName =
        versionName == null || versionName.isBlank() ? "Version " + versionNumber : versionName;
    final PlanVersionRecord version =
        versionRepository.insertActive(
            planId,
            versionNumber,
            resolvedName,
            LocalDate.ofInstant(now, ZoneOffset.UTC),
            actorUserId,
            now);
    versionRepository.insertModelSnapshots(version.versionId(), members);

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("version_id", version.versionId());
    detail.put("version_number", versionNumber);
    detail.put("model_count", members.size());
    auditWriter.write(
        MonitoringAuditWriter.ENTITY_PLAN, planId, ACTION_PUBLISH, actorUserId, detail, now);
    logger.info(
        "plan version published planId={} versionId={} versionNumber={} models={}",
        planId,
        version.versionId(),
        versionNumber,
        members.size());
    return version;
  }
}
