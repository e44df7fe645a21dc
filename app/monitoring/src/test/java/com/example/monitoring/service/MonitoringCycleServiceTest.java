/*
 * どこで: MonitoringCycleService の統合テスト
 * 何を: サイクル開始時のスコープ凍結、版の固定、以降の状態遷移を検証する
 * なぜ: 開始後の所属変更がサイクルの対象モデルへ波及しないことを保証するため
 */
package com.example.monitoring.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.monitoring.AbstractPostgresContainerTest;
import com.example.monitoring.MonitoringFixtures;
import com.example.monitoring.api.InvalidCycleTransitionException;
import com.example.monitoring.api.MembershipConflictException;
import com.example.monitoring.api.ResourceNotFoundException;
import com.example.monitoring.api.response.CycleStatusResponse;
import com.example.monitoring.api.response.PlanVersionResponse;
import com.example.monitoring.api.response.ScopeModelResponse;
import com.example.monitoring.api.response.StartCycleResponse;
import com.example.monitoring.model.MonitoringCycleRecord;
import com.example.monitoring.model.MonitoringCycleStatus;
import com.example.monitoring.model.ResolvedScope;
import com.example.monitoring.model.ScopeSource;
import com.example.monitoring.repository.MonitoringCycleRepository;
import com.example.monitoring.repository.PlanModelProjectionRepository;
import com.example.monitoring.repository.PlanVersionRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MonitoringCycleServiceTest extends AbstractPostgresContainerTest {

  private static final String ACTOR = "user-1";

  @Autowired private MonitoringCycleService cycleService;

  @Autowired private PlanMembershipService membershipService;

  @Autowired private PlanVersionService planVersionService;

  @Autowired private CycleScopeResolver scopeResolver;

  @Autowired private MonitoringCycleRepository cycleRepository;

  @Autowired private PlanVersionRepository versionRepository;

  @Autowired private PlanModelProjectionRepository projectionRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private MonitoringFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new MonitoringFixtures(jdbcTemplate);
    fixtures.truncateAll();
  }

  @Test
  void transferBeforeStartMovesModelIntoOtherPlansScope() {
    final long planA = fixtures.createPlan("plan-a");
    final long planB = fixtures.createPlan("plan-b");
    final long m1 = fixtures.createModel("model-1");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");

    membershipService.transferModel(m1, planB, ACTOR, "move");

    assertThat(projectionRepository.findModelIdsByPlanId(planA)).isEmpty();
    assertThat(projectionRepository.findModelIdsByPlanId(planB)).containsExactly(m1);

    final long cycleA = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);
    final long cycleB = fixtures.createCycle(planB, MonitoringCycleStatus.PENDING);
    final StartCycleResponse startedA = cycleService.startCycle(cycleA, ACTOR);
    final StartCycleResponse startedB = cycleService.startCycle(cycleB, ACTOR);

    assertThat(startedA.scopeModels()).isEmpty();
    assertThat(scopeResolver.getScopeModelIds(cycleA)).isEmpty();
    assertThat(scopeResolver.resolve(cycleA).scopeSource()).isEqualTo(ScopeSource.NONE);
    assertThat(startedB.scopeModels()).extracting(ScopeModelResponse::modelId).containsExactly(m1);
    assertThat(scopeResolver.getScopeModelIds(cycleB)).containsExactly(m1);
  }

  @Test
  void transferAfterStartIsRejectedAndMembershipStays() {
    final long planA = fixtures.createPlan("plan-a");
    final long planB = fixtures.createPlan("plan-b");
    final long m1 = fixtures.createModel("model-1");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");
    final long cycleA = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);

    final StartCycleResponse started = cycleService.startCycle(cycleA, ACTOR);

    assertThat(started.status()).isEqualTo("DATA_COLLECTION");
    assertThat(started.scopeModels()).containsExactly(new ScopeModelResponse(m1, "model-1"));

    assertThatThrownBy(() -> membershipService.transferModel(m1, planB, ACTOR, "move"))
        .isInstanceOf(MembershipConflictException.class)
        .hasMessageContaining("DATA_COLLECTION");

    assertThat(projectionRepository.findModelIdsByPlanId(planA)).containsExactly(m1);
    assertThat(fixtures.countActiveMemberships(m1)).isEqualTo(1);
    assertThat(membershipService.listModelMemberships(m1).memberships())
        .singleElement()
        .satisfies(m -> assertThat(m.planId()).isEqualTo(planA));
  }

  @Test
  void startCyclePinsNewVersionWithSnapshotWhenPlanHasNone() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    final long m2 = fixtures.createModel("model-2");
    membershipService.replacePlanModels(planA, List.of(m1, m2), ACTOR, "initial");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);

    final StartCycleResponse started = cycleService.startCycle(cycleId, ACTOR);

    assertThat(fixtures.findVersion(started.planVersionId()))
        .containsEntry("version_number", 1)
        .containsEntry("version_name", "Version 1")
        .containsEntry("is_active", true);
    assertThat(versionRepository.findModelSnapshots(started.planVersionId()))
        .extracting(m -> m.modelId())
        .containsExactly(m1, m2);

    final MonitoringCycleRecord cycle = cycleRepository.findById(cycleId).orElseThrow();
    assertThat(cycle.status()).isEqualTo(MonitoringCycleStatus.DATA_COLLECTION);
    assertThat(cycle.planVersionId()).isEqualTo(started.planVersionId());
    assertThat(cycle.versionLockedByUserId()).isEqualTo(ACTOR);
    assertThat(cycle.versionLockedAt()).isNotNull();
    assertThat(cycle.scopeMaterializedAt()).isEqualTo(cycle.versionLockedAt());
  }

  @Test
  void startCycleReusesPublishedActiveVersion() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");
    final PlanVersionResponse published =
        planVersionService.publishVersion(planA, "2026 Q1 config", true, ACTOR);
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);

    final StartCycleResponse started = cycleService.startCycle(cycleId, ACTOR);

    assertThat(published.modelCount()).isEqualTo(1);
    assertThat(started.planVersionId()).isEqualTo(published.versionId());
  }

  @Test
  void publishVersionDeactivatesPreviousVersion() {
    final long planA = fixtures.createPlan("plan-a");
    final PlanVersionResponse first = planVersionService.publishVersion(planA, null, false, ACTOR);
    final PlanVersionResponse second = planVersionService.publishVersion(planA, "v2", false, ACTOR);

    assertThat(first.versionName()).isEqualTo("Version 1");
    assertThat(second.versionNumber()).isEqualTo(2);
    assertThat(fixtures.findVersion(first.versionId())).containsEntry("is_active", false);
    assertThat(fixtures.findVersion(second.versionId())).containsEntry("is_active", true);
  }

  @Test
  void frozenScopeIsNotAffectedByLaterMembershipChanges() {
    final long planA = fixtures.createPlan("plan-a");
    final long planB = fixtures.createPlan("plan-b");
    final long m1 = fixtures.createModel("model-1");
    final long m2 = fixtures.createModel("model-2");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);
    cycleService.startCycle(cycleId, ACTOR);

    // 追加/削除は移管ではないので開始済みでも受け付けるが、凍結スコープは変わらない
    membershipService.replacePlanModels(planA, List.of(m2), ACTOR, "swap");
    cycleService.submitCycle(cycleId, ACTOR);
    cycleService.requestApproval(cycleId, ACTOR);
    cycleService.approveCycle(cycleId, ACTOR);
    membershipService.transferModel(m2, planB, ACTOR, "after approval");

    final ResolvedScope scope = scopeResolver.resolve(cycleId);
    assertThat(scope.scopeSource()).isEqualTo(ScopeSource.LEDGER_DIRECT);
    assertThat(scope.modelIds()).containsExactly(m1);
  }

  @Test
  void scopeRowsRejectDirectUpdateAndDelete() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);
    cycleService.startCycle(cycleId, ACTOR);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE monitoring_cycle_model_scopes SET model_name = 'x'"
                        + " WHERE cycle_id = :cycleId",
                    params))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "DELETE FROM monitoring_cycle_model_scopes WHERE cycle_id = :cycleId", params))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(scopeResolver.getScopeModelIds(cycleId)).containsExactly(m1);
  }

  @Test
  void startCycleTwiceIsRejected() {
    final long planA = fixtures.createPlan("plan-a");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);
    cycleService.startCycle(cycleId, ACTOR);

    assertThatThrownBy(() -> cycleService.startCycle(cycleId, ACTOR))
        .isInstanceOfSatisfying(
            InvalidCycleTransitionException.class,
            ex ->
                assertThat(ex.getCurrentStatus())
                    .isEqualTo(MonitoringCycleStatus.DATA_COLLECTION));
  }

  @Test
  void startUnknownCycleFails() {
    assertThatThrownBy(() -> cycleService.startCycle(777L, ACTOR))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void workflowTransitionsFollowStateMachine() {
    final long planA = fixtures.createPlan("plan-a");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);

    assertThatThrownBy(() -> cycleService.submitCycle(cycleId, ACTOR))
        .isInstanceOf(InvalidCycleTransitionException.class)
        .hasMessageContaining("PENDING");

    cycleService.startCycle(cycleId, ACTOR);
    assertThat(cycleService.submitCycle(cycleId, ACTOR).status()).isEqualTo("UNDER_REVIEW");
    assertThat(cycleService.requestApproval(cycleId, ACTOR).status())
        .isEqualTo("PENDING_APPROVAL");
    assertThat(cycleService.approveCycle(cycleId, ACTOR).status()).isEqualTo("APPROVED");

    assertThatThrownBy(() -> cycleService.cancelCycle(cycleId, "too late", ACTOR))
        .isInstanceOf(InvalidCycleTransitionException.class)
        .hasMessageContaining("APPROVED");
  }

  @Test
  void cancelCyclePrefixesReasonToNotesAndKeepsScope() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    membershipService.replacePlanModels(planA, List.of(m1), ACTOR, "initial");
    final long cycleId = fixtures.createCycle(planA, MonitoringCycleStatus.PENDING);
    cycleService.startCycle(cycleId, ACTOR);

    final CycleStatusResponse cancelled =
        cycleService.cancelCycle(cycleId, "data source outage", ACTOR);

    assertThat(cancelled.status()).isEqualTo("CANCELLED");
    assertThat(cancelled.notes()).isEqualTo("[CANCELLED] data source outage");
    assertThat(scopeResolver.getScopeModelIds(cycleId)).containsExactly(m1);
    // 置換 + 版の自動公開 + 開始 + 中止
    assertThat(fixtures.count("monitoring_audit_log")).isEqualTo(4);
  }
}
