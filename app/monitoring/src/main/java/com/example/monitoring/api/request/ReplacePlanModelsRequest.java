/*
 * どこで: Monitoring API リクエスト DTO
 * 何を: プラン所属モデルの一括置換の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.monitoring.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotNull;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record ReplacePlanModelsRequest(
    @NotNull(message = "model_ids is required") List<@NotNull Long> modelIds, String reason) {}
