/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: プラン所属モデル置換の結果を定義する
 * なぜ: 追加/削除の差分と置換後の全体を一度に返すため
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
public record PlanModelsResponse(
    long planId, List<Long> added, List<Long> removed, List<Long> modelIds) {}
