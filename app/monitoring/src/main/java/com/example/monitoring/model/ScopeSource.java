/*
 * どこで: Monitoring ドメインモデル
 * 何を: サイクルスコープがどの根拠から得られたかを表す
 * なぜ: スコープ解決のフォールバック順を型で閉じるため
 */
package com.example.monitoring.model;

public enum ScopeSource {
  // 開始時に台帳から凍結したスコープ行
  LEDGER_DIRECT,
  // サイクルが参照するプラン版のモデルスナップショット
  VERSION_SNAPSHOT,
  // 結果が記録済みのモデル
  RESULT_EVIDENCE,
  // 現在の有効な所属(サイクル時点ではなく「今」の答え)
  MEMBERSHIP_FALLBACK,
  NONE
}
