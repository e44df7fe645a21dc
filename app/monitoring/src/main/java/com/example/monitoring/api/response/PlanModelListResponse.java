/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: プランの現在の所属モデル一覧を定義する
 * なぜ: 投影テーブルの内容をモデル名付きで返すため
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
public record PlanModelListResponse(long planId, List<ScopeModelResponse> models) {}
