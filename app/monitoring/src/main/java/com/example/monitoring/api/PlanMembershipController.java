/*
 * どこで: Monitoring API
 * 何を: プラン所属の置換/参照、モデル移管/履歴、プラン版公開のエンドポイントを公開する
 * なぜ: 所属台帳への変更を HTTP から受け付ける入口を提供するため
 */
package com.example.monitoring.api;

import com.example.monitoring.api.request.PublishPlanVersionRequest;
import com.example.monitoring.api.request.ReplacePlanModelsRequest;
import com.example.monitoring.api.request.TransferModelRequest;
import com.example.monitoring.api.response.MembershipHistoryResponse;
import com.example.monitoring.api.response.PlanModelListResponse;
import com.example.monitoring.api.response.PlanModelsResponse;
import com.example.monitoring.api.response.PlanVersionResponse;
import com.example.monitoring.api.response.TransferModelResponse;
import com.example.monitoring.service.MonitoringMetrics;
import com.example.monitoring.service.PlanMembershipService;
import com.example.monitoring.service.PlanVersionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PlanMembershipController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final PlanMembershipService membershipService;
  private final PlanVersionService planVersionService;
  private final MonitoringMetrics metrics;

  @PutMapping("/v1/monitoring/plans/{plan_id}/models")
  public ResponseEntity<PlanModelsResponse> replacePlanModels(
      @PathVariable("plan_id") long planId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId,
      @Valid @RequestBody ReplacePlanModelsRequest request) {
    return ResponseEntity.ok(
        metrics.recordOutcome(
            "replace_plan_models",
            () ->
                membershipService.replacePlanModels(
                    planId, request.modelIds(), userId, request.reason())));
  }

  @GetMapping("/v1/monitoring/plans/{plan_id}/models")
  public ResponseEntity<PlanModelListResponse> listPlanModels(
      @PathVariable("plan_id") long planId) {
    return ResponseEntity.ok(membershipService.listPlanModels(planId));
  }

  @PostMapping("/v1/monitoring/plans/{plan_id}/versions")
  public ResponseEntity<PlanVersionResponse> publishVersion(
      @PathVariable("plan_id") long planId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId,
      @Valid @RequestBody PublishPlanVersionRequest request) {
    return ResponseEntity.ok(
        metrics.recordOutcome(
            "publish_plan_version",
            () ->
                planVersionService.publishVersion(
                    planId, request.versionName(), request.includeModelsOrDefault(), userId)));
  }

  @PostMapping("/v1/models/{model_id}/monitoring-plan-transfer")
  public ResponseEntity<TransferModelResponse> transferModel(
      @PathVariable("model_id") long modelId,
      @RequestHeader(HEADER_USER_ID) @NotBlank String userId,
      @Valid @RequestBody TransferModelRequest request) {
    return ResponseEntity.ok(
        metrics.recordOutcome(
            "transfer_model",
            () ->
                membershipService.transferModel(
                    modelId, request.toPlanId(), userId, request.reason())));
  }

  @GetMapping("/v1/models/{model_id}/monitoring-memberships")
  public ResponseEntity<MembershipHistoryResponse> listModelMemberships(
      @PathVariable("model_id") long modelId) {
    return ResponseEntity.ok(membershipService.listModelMemberships(modelId));
  }
}
