/*
 * どこで: Monitoring ドメインモデル
 * 何を: monitoring_audit_log の登録用データを表す
 * なぜ: 監査ログの構築を呼び出し側から隠蔽するため
 */
package com.example.monitoring.model;

import java.time.Instant;
import java.util.UUID;

public record MonitoringAuditRecord(
    UUID auditId,
    Instant occurredAt,
    String entityType,
    long entityId,
    String action,
    String actorUserId,
    String requestId,
    String detailJson) {}
