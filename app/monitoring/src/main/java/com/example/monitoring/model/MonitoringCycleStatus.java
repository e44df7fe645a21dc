/*
 * どこで: Monitoring ドメインモデル
 * 何を: サイクルの状態と許可される遷移を定義する
 * なぜ: 遷移判定と移管ブロック判定を一箇所に集約するため
 */
package com.example.monitoring.model;

import java.util.EnumSet;
import java.util.Set;

// DB の CHECK 制約と値を一致させる。
public enum MonitoringCycleStatus {
  PENDING,
  DATA_COLLECTION,
  UNDER_REVIEW,
  PENDING_APPROVAL,
  APPROVED,
  CANCELLED;

  private static final Set<MonitoringCycleStatus> TRANSFER_BLOCKING =
      EnumSet.of(DATA_COLLECTION, UNDER_REVIEW, PENDING_APPROVAL);

  public boolean isTerminal() {
    return this == APPROVED || this == CANCELLED;
  }

  // スコープ凍結後かつ未完了のサイクルがあるプランからは移管できない。
  public boolean blocksTransfer() {
    return TRANSFER_BLOCKING.contains(this);
  }

  public boolean canTransitionTo(MonitoringCycleStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == CANCELLED) {
      return true;
    }
    return switch (this) {
      case PENDING -> next == DATA_COLLECTION;
      case DATA_COLLECTION -> next == UNDER_REVIEW;
      case UNDER_REVIEW -> next == PENDING_APPROVAL;
      case PENDING_APPROVAL -> next == APPROVED;
      case APPROVED, CANCELLED -> false;
    };
  }

  public static Set<MonitoringCycleStatus> transferBlockingStatuses() {
    return EnumSet.copyOf(TRANSFER_BLOCKING);
  }
}
