/*
 * どこで: Monitoring API レスポンス DTO
 * 何を: モデルの所属履歴を定義する
 * なぜ: どの期間どのプランで監視されていたかを新しい順に返すため
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
public record MembershipHistoryResponse(long modelId, List<MembershipSummary> memberships) {}
