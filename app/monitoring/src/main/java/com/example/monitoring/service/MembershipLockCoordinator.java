/*
 * どこで: Monitoring サービス層
 * 何を: 移管とサイクル開始に共通のロック順序/ロック待ち上限/例外変換を提供する
 * なぜ: 全ての書き手が同じ順序(プラン行 → 有効所属行)でロックし、デッドロックと
 *       「開始済みサイクルからのモデル流出」を防ぐため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.MembershipConflictException;
import com.example.monitoring.api.MembershipInvariantViolationException;
import com.example.monitoring.api.ResourceNotFoundException;
import com.example.monitoring.config.MonitoringLockingProperties;
import com.example.monitoring.model.MembershipRecord;
import com.example.monitoring.model.MonitoringCycleRecord;
import com.example.monitoring.model.MonitoringCycleStatus;
import com.example.monitoring.repository.MembershipRepository;
import com.example.monitoring.repository.MonitoringCycleRepository;
import com.example.monitoring.repository.MonitoringPlanRepository;
import com.example.monitoring.repository.TransactionLockSettingsRepository;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

// 呼び出し側のトランザクション内で使う。ロック系リポジトリは MANDATORY なので単独では動かない。
@Component
@RequiredArgsConstructor
public class MembershipLockCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(MembershipLockCoordinator.class);

  private final MonitoringPlanRepository planRepository;
  private final MembershipRepository membershipRepository;
  private final MonitoringCycleRepository cycleRepository;
  private final TransactionLockSettingsRepository lockSettingsRepository;
  private final MonitoringLockingProperties lockingProperties;

  /**
   * ロック待ち上限を設定したうえで work を実行し、ロック失敗と制約違反を業務例外へ変換する。
   *
   * <p>ロック待ちタイムアウト(55P03)とデッドロック(40P01)は衝突として返す。呼び出し側は同じ要求を
   * 再試行してよい。
   */
  public <T> T runLocked(String operation, Supplier<T> work) {
    try {
      lockSettingsRepository.applyLockTimeout(lockingProperties.lockTimeout());
      return work.get();
    } catch (PessimisticLockingFailureException ex) {
      logger.warn("lock acquisition failed operation={} cause={}", operation, ex.getMessage());
      throw new MembershipConflictException(
          operation + " could not acquire locks; retry the request", ex);
    } catch (DataIntegrityViolationException ex) {
      throw new MembershipInvariantViolationException(
          operation + " violated a membership ledger constraint", ex);
    }
  }

  /** プラン行を plan_id 昇順でロックする。1 件でも存在しなければ 404。 */
  public void lockPlans(Collection<Long> planIds) {
    final Set<Long> ordered = new TreeSet<>(planIds);
    final List<Long> locked = planRepository.lockByIds(ordered);
    if (locked.size() != ordered.size()) {
      final Set<Long> missing = new TreeSet<>(ordered);
      locked.forEach(missing::remove);
      throw new ResourceNotFoundException("monitoring plan not found: " + missing);
    }
  }

  /**
   * プランの有効所属と指定モデルの有効所属を model_id 昇順でロックする。
   *
   * <p>ロックした所属が lockedPlanIds 以外のプランに属していた場合、事前読込の後に所属が動いたので衝突とする。
   */
  public List<MembershipRecord> lockPlanMembers(
      long planId, Collection<Long> modelIds, Set<Long> lockedPlanIds) {
    final List<MembershipRecord> locked =
        membershipRepository.lockActiveByPlanIdOrModelIds(planId, new TreeSet<>(modelIds));
    final Set<Long> unexpectedPlans = new HashSet<>();
    for (MembershipRecord record : locked) {
      if (!lockedPlanIds.contains(record.planId())) {
        unexpectedPlans.add(record.planId());
      }
    }
    if (!unexpectedPlans.isEmpty()) {
      throw new MembershipConflictException(
          "membership changed concurrently; models moved to plans " + unexpectedPlans);
    }
    return locked;
  }

  /** 単一モデルの有効所属をロックする。 */
  public Optional<MembershipRecord> lockActiveMembership(long modelId) {
    return membershipRepository.lockActiveByModelIds(List.of(modelId)).stream().findFirst();
  }

  /** サイクル開始用にプランの有効所属を全件ロックする。 */
  public List<MembershipRecord> lockAllPlanMembers(long planId) {
    return membershipRepository.lockActiveByPlanId(planId);
  }

  /**
   * 移管元プランにスコープ凍結後かつ未完了のサイクルがあれば拒否する。
   *
   * <p>移管元プラン行のロックを保持した状態で呼ぶこと。開始処理も同じプラン行を先にロックするため、
   * ここで見えない DATA_COLLECTION は移管のコミットまで現れない。
   */
  public void assertTransferAllowed(long sourcePlanId) {
    final Optional<MonitoringCycleRecord> blocking =
        cycleRepository
            .findFirstByPlanIdAndStatusIn(
                sourcePlanId, MonitoringCycleStatus.transferBlockingStatuses())
            .filter(cycle -> cycle.status().blocksTransfer());
    if (blocking.isPresent()) {
      final MonitoringCycleStatus status = blocking.get().status();
      logger.warn(
          "transfer rejected sourcePlanId={} cycleId={} status={}",
          sourcePlanId,
          blocking.get().cycleId(),
          status);
      throw new MembershipConflictException(
          "transfer not allowed: plan "
              + sourcePlanId
              + " has a cycle in "
              + status.name()
              + " status",
          status);
    }
  }
}
