/*
 * どこで: Monitoring ドメインモデル
 * 何を: monitoring_plan_memberships の 1 行(モデルがプランに所属していた区間)を表す
 * なぜ: 台帳の読み書きとロック結果を同じ型で扱うため
 */
package com.example.monitoring.model;

import java.time.Instant;

public record MembershipRecord(
    long membershipId,
    long modelId,
    long planId,
    Instant effectiveFrom,
    Instant effectiveTo,
    String reason,
    String changedByUserId) {

  public boolean isActive() {
    return effectiveTo == null;
  }
}
