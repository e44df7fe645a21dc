/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: サイクルスコープの解決結果を定義する
 * なぜ: どの根拠(凍結行/版/結果/現所属)で得たスコープかを明示するため
 */
package com.example.monitoring.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス返却専用であり、生成時に不変リストを渡すため")
public record CycleScopeResponse(
    long cycleId, String scopeSource, List<ScopeModelResponse> models) {}
