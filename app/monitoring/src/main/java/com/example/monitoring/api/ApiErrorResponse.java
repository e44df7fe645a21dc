/*
 * どこで: Monitoring API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因とブロック中のサイクル状態を識別しやすくするため
 */
package com.example.monitoring.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(ApiErrorCode code, String message, String cycleStatus) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
