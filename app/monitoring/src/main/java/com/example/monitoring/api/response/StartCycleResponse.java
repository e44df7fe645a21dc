/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: サイクル開始の結果を定義する
 * なぜ: 固定した版と凍結したスコープを開始応答でそのまま確認できるようにするため
 */
package com.example.monitoring.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、生成時に不変リストを渡すため")
public record StartCycleResponse(
    long cycleId,
    long planId,
    String status,
    long planVersionId,
    Instant versionLockedAt,
    List<ScopeModelResponse> scopeModels) {}
