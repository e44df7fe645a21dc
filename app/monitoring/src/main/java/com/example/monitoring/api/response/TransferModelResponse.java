/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: モデル移管の結果を定義する
 * なぜ: 移管元が無い場合や変更なしの場合も同じ構造で返すため
 */
package com.example.monitoring.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransferModelResponse(
    long modelId,
    Long fromPlanId,
    long toPlanId,
    boolean changed) {}
