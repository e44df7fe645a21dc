/*
 * どこで: Monitoring サービス層
 * 何を: サイクルの開始(版固定とスコープ凍結)と以降の状態遷移を行う
 * なぜ: 開始処理を移管と同じロック順序で直列化し、開始時点の所属を正確に凍結するため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.InvalidCycleTransitionException;
import com.example.monitoring.api.ResourceNotFoundException;
import com.example.monitoring.api.response.CycleStatusResponse;
import com.example.monitoring.api.response.ScopeModelResponse;
import com.example.monitoring.api.response.StartCycleResponse;
import com.example.monitoring.model.MonitoringCycleRecord;
import com.example.monitoring.model.MonitoringCycleStatus;
import com.example.monitoring.model.PlanVersionRecord;
import com.example.monitoring.model.ScopeModel;
import com.example.monitoring.repository.MonitoringCycleRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MonitoringCycleService {

  private static final Logger logger = LoggerFactory.getLogger(MonitoringCycleService.class);

  static final String ACTION_START = "START_CYCLE";
  private static final String CANCELLED_NOTE_PREFIX = "[CANCELLED] ";

  private final MonitoringCycleRepository cycleRepository;
  private final MembershipLockCoordinator lockCoordinator;
  private final PlanVersionService planVersionService;
  private final CycleScopeMaterializer scopeMaterializer;
  private final MonitoringAuditWriter auditWriter;
  private final MonitoringMetrics metrics;
  private final Clock clock;

  /**
   * PENDING のサイクルを DATA_COLLECTION へ進め、プランの有効所属をスコープとして凍結する。
   *
   * <p>ロック順序はプラン行 → サイクル行 → 有効所属行(model_id 昇順)。状態の確認はロック取得後に行う。
   */
  @Transactional
  public StartCycleResponse startCycle(long cycleId, String actorUserId) {
    PlanMembershipService.requireActor(actorUserId);
    final long planId = requireCycle(cycleId).planId();
    return lockCoordinator.runLocked(
        "start cycle",
        () -> {
          lockCoordinator.lockPlans(Set.of(planId));
          final MonitoringCycleRecord cycle =
              cycleRepository.lockById(cycleId).orElseThrow(() -> cycleNotFound(cycleId));
          if (cycle.status() != MonitoringCycleStatus.PENDING) {
            throw new InvalidCycleTransitionException(
                "cycle " + cycleId + " cannot start from " + cycle.status().name() + " status",
                cycle.status());
          }
          final List<ScopeModel> members =
              planVersionService.toScopeModels(lockCoordinator.lockAllPlanMembers(planId));
          final Instant now = Instant.now(clock);
          final PlanVersionRecord version =
              planVersionService.resolveActiveVersion(planId, members, actorUserId, now);
          final List<ScopeModel> scope =
              scopeMaterializer.materialize(cycleId, planId, members, now);
          if (cycleRepository.markStarted(cycleId, version.versionId(), now, actorUserId) != 1) {
            throw new IllegalStateException(
                "locked PENDING cycle was not updated cycleId=" + cycleId);
          }

          final Map<String, Object> detail = new LinkedHashMap<>();
          detail.put("plan_id", planId);
          detail.put("plan_version_id", version.versionId());
          detail.put("scope_model_ids", scope.stream().map(ScopeModel::modelId).toList());
          auditWriter.write(
              MonitoringAuditWriter.ENTITY_CYCLE, cycleId, ACTION_START, actorUserId, detail, now);
          metrics.recordCycleScopeSize(scope.size());
          logger.info(
              "cycle started cycleId={} planId={} planVersionId={} scopeSize={} actor={}",
              cycleId,
              planId,
              version.versionId(),
              scope.size(),
              actorUserId);
          return new StartCycleResponse(
              cycleId,
              planId,
              MonitoringCycleStatus.DATA_COLLECTION.name(),
              version.versionId(),
              now,
              scope.stream().map(m -> new ScopeModelResponse(m.modelId(), m.modelName())).toList());
        });
  }

  @Transactional
  public CycleStatusResponse submitCycle(long cycleId, String actorUserId) {
    return transition(
        cycleId,
        MonitoringCycleStatus.UNDER_REVIEW,
        actorUserId,
        "SUBMIT_CYCLE",
        null,
        UnaryOperator.identity());
  }

  @Transactional
  public CycleStatusResponse requestApproval(long cycleId, String actorUserId) {
    return transition(
        cycleId,
        MonitoringCycleStatus.PENDING_APPROVAL,
        actorUserId,
        "REQUEST_APPROVAL",
        null,
        UnaryOperator.identity());
  }

  @Transactional
  public CycleStatusResponse approveCycle(long cycleId, String actorUserId) {
    return transition(
        cycleId,
        MonitoringCycleStatus.APPROVED,
        actorUserId,
        "APPROVE_CYCLE",
        null,
        UnaryOperator.identity());
  }

  /** 未完了のサイクルを中止する。理由は既存のメモの先頭に追記する。 */
  @Transactional
  public CycleStatusResponse cancelCycle(long cycleId, String cancelReason, String actorUserId) {
    if (cancelReason == null || cancelReason.isBlank()) {
      throw new IllegalArgumentException("cancel reason is required");
    }
    final String prefix = CANCELLED_NOTE_PREFIX + cancelReason.trim();
    return transition(
        cycleId,
        MonitoringCycleStatus.CANCELLED,
        actorUserId,
        "CANCEL_CYCLE",
        cancelReason,
        notes -> notes == null || notes.isBlank() ? prefix : prefix + "\n\n" + notes);
  }

  // スコープ行には触れない。凍結済みスコープは中止後も参照できる。
  private CycleStatusResponse transition(
      long cycleId,
      MonitoringCycleStatus next,
      String actorUserId,
      String action,
      String reason,
      UnaryOperator<String> notesUpdater) {
    PlanMembershipService.requireActor(actorUserId);
    return lockCoordinator.runLocked(
        "change cycle status",
        () -> {
          final MonitoringCycleRecord cycle =
              cycleRepository.lockById(cycleId).orElseThrow(() -> cycleNotFound(cycleId));
          if (!cycle.status().canTransitionTo(next)) {
            throw new InvalidCycleTransitionException(
                "cycle "
                    + cycleId
                    + " cannot move from "
                    + cycle.status().name()
                    + " to "
                    + next.name(),
                cycle.status());
          }
          final Instant now = Instant.now(clock);
          final String notes = notesUpdater.apply(cycle.notes());
          if (cycleRepository.updateStatus(cycleId, cycle.status(), next, notes, now) != 1) {
            throw new IllegalStateException("locked cycle was not updated cycleId=" + cycleId);
          }
          final Map<String, Object> detail = new LinkedHashMap<>();
          detail.put("from_status", cycle.status().name());
          detail.put("to_status", next.name());
          if (reason != null) {
            detail.put("reason", reason);
          }
          auditWriter.write(
              MonitoringAuditWriter.ENTITY_CYCLE, cycleId, action, actorUserId, detail, now);
          logger.info(
              "cycle status changed cycleId={} from={} to={} actor={}",
              cycleId,
              cycle.status(),
              next,
              actorUserId);
          return new CycleStatusResponse(cycleId, cycle.planId(), next.name(), notes);
        });
  }

  private MonitoringCycleRecord requireCycle(long cycleId) {
    return cycleRepository.findById(cycleId).orElseThrow(() -> cycleNotFound(cycleId));
  }

  private ResourceNotFoundException cycleNotFound(long cycleId) {
    return new ResourceNotFoundException("monitoring cycle not found: " + cycleId);
  }
}
