/*
 * どこで: Monitoring サービス層
 * 何を: 所属変更/サイクル遷移の監査ログを同一トランザクションで書き込む
 * なぜ: 業務更新と監査記録の片方だけが残る状態を作らないため
 */
package com.example.monitoring.service;

import com.example.common.RequestIds;
import com.example.monitoring.model.MonitoringAuditRecord;
import com.example.monitoring.repository.MonitoringAuditRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
public class MonitoringAuditWriter {

  static final String ENTITY_PLAN = "MONITORING_PLAN";
  static final String ENTITY_MODEL = "MODEL";
  static final String ENTITY_CYCLE = "MONITORING_CYCLE";

  private final MonitoringAuditRepository auditRepository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public MonitoringAuditWriter(
      MonitoringAuditRepository auditRepository, ObjectMapper objectMapper) {
    this.auditRepository = auditRepository;
    this.objectMapper = objectMapper;
  }

  public void write(
      String entityType,
      long entityId,
      String action,
      String actorUserId,
      Map<String, ?> detail,
      Instant occurredAt) {
    auditRepository.insert(
        new MonitoringAuditRecord(
            UUID.randomUUID(),
            occurredAt,
            entityType,
            entityId,
            action,
            actorUserId,
            resolveRequestId(),
            toJson(detail)));
  }

  String toJson(Map<String, ?> detail) {
    try {
      return objectMapper.writeValueAsString(detail);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize audit detail", ex);
    }
  }

  // HTTP 外(テストやバッチ)から呼ばれた場合は MDC が空なので採番する。
  private String resolveRequestId() {
    final String requestId = MDC.get("request_id");
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return RequestIds.newRequestId();
  }
}
