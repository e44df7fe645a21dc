/*
 * どこで: Monitoring ドメインモデル
 * 何を: monitoring_cycles の読込結果を表す
 * なぜ: 状態遷移とスコープ解決で同じスナップショットを使うため
 */
package com.example.monitoring.model;

import java.time.Instant;
import java.time.LocalDate;

public record MonitoringCycleRecord(
    long cycleId,
    long planId,
    LocalDate periodStartDate,
    LocalDate periodEndDate,
    MonitoringCycleStatus status,
    Long planVersionId,
    Instant versionLockedAt,
    String versionLockedByUserId,
    String notes,
    Instant scopeMaterializedAt) {

  // 凍結行が 0 件でも、開始処理を経たサイクルのスコープは空で確定している。
  public boolean isScopeMaterialized() {
    return scopeMaterializedAt != null;
  }
}
