/*
 * どこで: Monitoring API
 * 何を: サイクルの開始/提出/承認依頼/承認/中止とスコープ参照のエンドポイントを公開する
 * なぜ: サイクルのワークフローと凍結スコープを HTTP から扱う入口を提供するため
 */
package com.example.monitoring.api;

import com.example.monitoring.api.request.CancelCycleRequest;
import com.example.monitoring.api.response.CycleScopeResponse;
import com.example.monitoring.api.response.CycleStatusResponse;
import com.example.monitoring.api.response.ScopeModelResponse;
import com.example.monitoring.api.response.StartCycleResponse;
import com.example.monitoring.model.ResolvedScope;
import com.example.monitoring.service.CycleScopeResolver;
import com.example.monitoring.service.MonitoringCycleService;
import com.example.monitoring.service.MonitoringMetrics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/monitoring/cycles/{cycle_id}")
@RequiredArgsConstructor
public class MonitoringCycleController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MonitoringCycleService cycleService;
  private final CycleScopeResolver scopeResolver;
  private final MonitoringMetrics metrics;

  @PostMapping("/start")
  public ResponseEntity<StartCycleResponse> startCycle(
      @PathVariable("cycle_id") long cycleId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId) {
    return ResponseEntity.ok(
        metrics.recordOutcome("start_cycle", () -> cycleService.startCycle(cycleId, userId)));
  }

  @PostMapping("/submit")
  public ResponseEntity<CycleStatusResponse> submitCycle(
      @PathVariable("cycle_id") long cycleId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId) {
    return ResponseEntity.ok(
        metrics.recordOutcome("submit_cycle", () -> cycleService.submitCycle(cycleId, userId)));
  }

  @PostMapping("/request-approval")
  public ResponseEntity<CycleStatusResponse> requestApproval(
      @PathVariable("cycle_id") long cycleId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId) {
    return ResponseEntity.ok(
        metrics.recordOutcome(
            "request_approval", () -> cycleService.requestApproval(cycleId, userId)));
  }

  @PostMapping("/approve")
  public ResponseEntity<CycleStatusResponse> approveCycle(
      @PathVariable("cycle_id") long cycleId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId) {
    return ResponseEntity.ok(
        metrics.recordOutcome("approve_cycle", () -> cycleService.approveCycle(cycleId, userId)));
  }

  @PostMapping("/cancel")
  public ResponseEntity<CycleStatusResponse> cancelCycle(
      @PathVariable("cycle_id") long cycleId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId,
      @Valid @RequestBody CancelCycleRequest request) {
    return ResponseEntity.ok(
        metrics.recordOutcome(
            "cancel_cycle",
            () -> cycleService.cancelCycle(cycleId, request.cancelReason(), userId)));
  }

  @GetMapping("/scope")
  public ResponseEntity<CycleScopeResponse> getScope(@PathVariable("cycle_id") long cycleId) {
    final ResolvedScope scope = scopeResolver.resolve(cycleId);
    return ResponseEntity.ok(
        new CycleScopeResponse(
            scope.cycleId(),
            scope.scopeSource().name(),
            scope.models().stream()
                .map(model -> new ScopeModelResponse(model.modelId(), model.modelName()))
                .toList()));
  }
}
