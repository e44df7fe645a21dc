/*
 * どこで: Monitoring サービス層
 * 何を: プランとモデルの所属台帳(有効期間付き)を更新し、投影テーブルと監査ログを揃える
 * なぜ: 「モデルごとに有効な所属は高々 1 件」を保ったまま、置換と移管を同じ規則で扱うため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.MembershipConflictException;
import com.example.monitoring.api.ResourceNotFoundException;
import com.example.monitoring.api.response.MembershipHistoryResponse;
import com.example.monitoring.api.response.MembershipSummary;
import com.example.monitoring.api.response.PlanModelListResponse;
import com.example.monitoring.api.response.PlanModelsResponse;
import com.example.monitoring.api.response.ScopeModelResponse;
import com.example.monitoring.api.response.TransferModelResponse;
import com.example.monitoring.model.MembershipRecord;
import com.example.monitoring.repository.MembershipRepository;
import com.example.monitoring.repository.ModelRepository;
import com.example.monitoring.repository.MonitoringPlanRepository;
import com.example.monitoring.repository.PlanModelProjectionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PlanMembershipService {

  private static final Logger logger = LoggerFactory.getLogger(PlanMembershipService.class);

  static final String ACTION_REPLACE = "REPLACE_PLAN_MODELS";
  static final String ACTION_TRANSFER = "TRANSFER_MODEL";

  private final MembershipRepository membershipRepository;
  private final PlanModelProjectionRepository projectionRepository;
  private final MonitoringPlanRepository planRepository;
  private final ModelRepository modelRepository;
  private final MembershipLockCoordinator lockCoordinator;
  private final MonitoringAuditWriter auditWriter;
  private final Clock clock;

  /**
   * プランの所属モデルを desiredModelIds に置き換える。
   *
   * <p>差分だけを書き込むため、同じ集合での再実行は書き込みを行わない。他プランで有効なモデルを追加する場合は
   * 移管として扱い、移管元プランのサイクル状態を確認する。
   */
  @Transactional
  public PlanModelsResponse replacePlanModels(
      long planId, Collection<Long> desiredModelIds, String actorUserId, String reason) {
    requireActor(actorUserId);
    final Set<Long> desired = new TreeSet<>(desiredModelIds);
    if (!planRepository.existsById(planId)) {
      throw new ResourceNotFoundException("monitoring plan not found: " + planId);
    }
    // ロック前の読み取りは「どのプラン行をロックするか」を決めるためだけに使う。
    final Set<Long> currentBeforeLock =
        toModelIds(membershipRepository.findActiveByPlanId(planId));
    if (currentBeforeLock.equals(desired)) {
      return new PlanModelsResponse(planId, List.of(), List.of(), List.copyOf(desired));
    }
    requireModelsExist(desired);
    final Set<Long> planIdsToLock = new TreeSet<>();
    planIdsToLock.add(planId);
    membershipRepository.findActiveByModelIds(desired).stream()
        .map(MembershipRecord::planId)
        .forEach(planIdsToLock::add);

    return lockCoordinator.runLocked(
        "replace plan models",
        () -> {
          lockCoordinator.lockPlans(planIdsToLock);
          final List<MembershipRecord> locked =
              lockCoordinator.lockPlanMembers(planId, desired, planIdsToLock);
          return applyReplacement(planId, desired, locked, actorUserId, reason);
        });
  }

  /**
   * モデルを toPlanId へ移管する。既に toPlanId で有効なら何も書き込まずに成功を返す。
   */
  @Transactional
  public TransferModelResponse transferModel(
      long modelId, long toPlanId, String actorUserId, String reason) {
    requireActor(actorUserId);
    requireModelsExist(Set.of(modelId));
    final Optional<MembershipRecord> beforeLock = membershipRepository.findActiveByModelId(modelId);
    if (beforeLock.isPresent() && beforeLock.get().planId() == toPlanId) {
      return new TransferModelResponse(modelId, toPlanId, toPlanId, false);
    }
    final Set<Long> planIdsToLock = new TreeSet<>();
    planIdsToLock.add(toPlanId);
    beforeLock.ifPresent(record -> planIdsToLock.add(record.planId()));

    return lockCoordinator.runLocked(
        "transfer model",
        () -> {
          lockCoordinator.lockPlans(planIdsToLock);
          final Optional<MembershipRecord> current = lockCoordinator.lockActiveMembership(modelId);
          final Long fromPlanId = current.map(MembershipRecord::planId).orElse(null);
          if (fromPlanId != null && fromPlanId == toPlanId) {
            return new TransferModelResponse(modelId, toPlanId, toPlanId, false);
          }
          if (fromPlanId != null && !planIdsToLock.contains(fromPlanId)) {
            throw new MembershipConflictException(
                "membership changed concurrently; model "
                    + modelId
                    + " moved to plan "
                    + fromPlanId);
          }
          final Instant now = Instant.now(clock);
          final Set<Long> touchedPlans = new TreeSet<>();
          touchedPlans.add(toPlanId);
          if (current.isPresent()) {
            lockCoordinator.assertTransferAllowed(fromPlanId);
            closeMembership(current.get(), now);
            touchedPlans.add(fromPlanId);
          }
          openMembership(modelId, toPlanId, now, reason, actorUserId);
          planRepository.markDirty(touchedPlans, now);

          final Map<String, Object> detail = new LinkedHashMap<>();
          detail.put("from_plan_id", fromPlanId);
          detail.put("to_plan_id", toPlanId);
          detail.put("reason", reason);
          auditWriter.write(
              MonitoringAuditWriter.ENTITY_MODEL,
              modelId,
              ACTION_TRANSFER,
              actorUserId,
              detail,
              now);
          logger.info(
              "model transferred modelId={} fromPlanId={} toPlanId={} actor={}",
              modelId,
              fromPlanId,
              toPlanId,
              actorUserId);
          return new TransferModelResponse(modelId, fromPlanId, toPlanId, true);
        });
  }

  @Transactional(readOnly = true)
  public PlanModelListResponse listPlanModels(long planId) {
    if (!planRepository.existsById(planId)) {
      throw new ResourceNotFoundException("monitoring plan not found: " + planId);
    }
    final List<Long> modelIds = projectionRepository.findModelIdsByPlanId(planId);
    final Map<Long, String> names = modelRepository.findNamesByIds(modelIds);
    final List<ScopeModelResponse> models =
        modelIds.stream().map(id -> new ScopeModelResponse(id, names.get(id))).toList();
    return new PlanModelListResponse(planId, models);
  }

  @Transactional(readOnly = true)
  public MembershipHistoryResponse listModelMemberships(long modelId) {
    requireModelsExist(Set.of(modelId));
    final List<MembershipSummary> memberships =
        membershipRepository.findByModelId(modelId).stream()
            .map(
                record ->
                    new MembershipSummary(
                        record.membershipId(),
                        record.planId(),
                        record.effectiveFrom(),
                        record.effectiveTo(),
                        record.reason(),
                        record.changedByUserId(),
                        record.isActive()))
            .toList();
    return new MembershipHistoryResponse(modelId, memberships);
  }

  private PlanModelsResponse applyReplacement(
      long planId,
      Set<Long> desired,
      List<MembershipRecord> locked,
      String actorUserId,
      String reason) {
    // ロック取得後の状態で差分を取り直す。
    final Map<Long, MembershipRecord> inPlan = new TreeMap<>();
    final Map<Long, MembershipRecord> inOtherPlans = new TreeMap<>();
    for (MembershipRecord record : locked) {
      if (record.planId() == planId) {
        inPlan.put(record.modelId(), record);
      } else if (desired.contains(record.modelId())) {
        inOtherPlans.put(record.modelId(), record);
      }
    }
    final List<Long> removed = new ArrayList<>();
    for (Long modelId : inPlan.keySet()) {
      if (!desired.contains(modelId)) {
        removed.add(modelId);
      }
    }
    final List<Long> added = new ArrayList<>();
    for (Long modelId : desired) {
      if (!inPlan.containsKey(modelId)) {
        added.add(modelId);
      }
    }
    if (removed.isEmpty() && added.isEmpty()) {
      return new PlanModelsResponse(planId, List.of(), List.of(), List.copyOf(desired));
    }

    // 移管元プランの状態確認を書き込みより先に済ませ、拒否時は何も書かない。
    final Set<Long> sourcePlans = new TreeSet<>();
    inOtherPlans.values().forEach(record -> sourcePlans.add(record.planId()));
    sourcePlans.forEach(lockCoordinator::assertTransferAllowed);

    final Instant now = Instant.now(clock);
    final Set<Long> touchedPlans = new TreeSet<>();
    touchedPlans.add(planId);
    for (Long modelId : removed) {
      closeMembership(inPlan.get(modelId), now);
    }
    final Map<Long, Long> transferredFrom = new HashMap<>();
    for (Long modelId : added) {
      final MembershipRecord other = inOtherPlans.get(modelId);
      if (other != null) {
        closeMembership(other, now);
        touchedPlans.add(other.planId());
        transferredFrom.put(modelId, other.planId());
      }
      openMembership(modelId, planId, now, reason, actorUserId);
    }
    planRepository.markDirty(touchedPlans, now);

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("added", added);
    detail.put("removed", removed);
    detail.put("transferred_from", new TreeMap<>(transferredFrom));
    detail.put("reason", reason);
    auditWriter.write(
        MonitoringAuditWriter.ENTITY_PLAN, planId, ACTION_REPLACE, actorUserId, detail, now);
    logger.info(
        "plan models replaced planId={} added={} removed={} transferred={} actor={}",
        planId,
        added,
        removed,
        transferredFrom.keySet(),
        actorUserId);
    return new PlanModelsResponse(
        planId, List.copyOf(added), List.copyOf(removed), List.copyOf(desired));
  }

  private void closeMembership(MembershipRecord record, Instant now) {
    final int updated = membershipRepository.close(record.membershipId(), now);
    if (updated != 1) {
      // 行ロック下で有効だった所属が閉じられないのはロック順序の破れを意味する。
      throw new IllegalStateException(
          "active membership disappeared under lock membershipId=" + record.membershipId());
    }
    projectionRepository.remove(record.planId(), record.modelId());
  }

  private void openMembership(
      long modelId, long planId, Instant now, String reason, String actorUserId) {
    membershipRepository.insertActive(modelId, planId, now, reason, actorUserId);
    projectionRepository.add(planId, modelId);
  }

  private void requireModelsExist(Set<Long> modelIds) {
    if (modelIds.isEmpty()) {
      return;
    }
    final Set<Long> missing = new TreeSet<>(modelIds);
    modelRepository.findExistingIds(modelIds).forEach(missing::remove);
    if (!missing.isEmpty()) {
      throw new ResourceNotFoundException("model not found: " + missing);
    }
  }

  private Set<Long> toModelIds(List<MembershipRecord> records) {
    final Set<Long> ids = new TreeSet<>();
    records.forEach(record -> ids.add(record.modelId()));
    return ids;
  }

  static void requireActor(String actorUserId) {
    if (actorUserId == null || actorUserId.isBlank()) {
      throw new IllegalArgumentException("actor user id is required");
    }
  }
}
