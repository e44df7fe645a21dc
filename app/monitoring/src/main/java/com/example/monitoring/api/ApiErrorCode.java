/*
 * どこで: Monitoring API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ 409 でも「移管不可」と「状態遷移不可」を区別できるようにするため
 */
package com.example.monitoring.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  MEMBERSHIP_CONFLICT,
  CYCLE_STATE_CONFLICT,
  MEMBERSHIP_INVARIANT_VIOLATION
}
