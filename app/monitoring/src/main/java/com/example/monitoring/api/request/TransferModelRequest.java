/*
 * どこで: Monitoring API リクエスト DTO
 * 何を: モデル移管の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.monitoring.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransferModelRequest(
    @NotNull(message = "to_plan_id is required") Long toPlanId, String reason) {}
