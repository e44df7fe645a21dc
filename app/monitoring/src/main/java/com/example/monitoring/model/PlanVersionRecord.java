/*
 * どこで: Monitoring ドメインモデル
 * 何を: monitoring_plan_versions の読込結果を表す
 * なぜ: サイクル開始時の版固定とスコープのフォールバックで共通化するため
 */
package com.example.monitoring.model;

import java.time.Instant;
import java.time.LocalDate;

public record PlanVersionRecord(
    long versionId,
    long planId,
    int versionNumber,
    String versionName,
    LocalDate effectiveDate,
    String publishedByUserId,
    Instant publishedAt,
    boolean active) {}
