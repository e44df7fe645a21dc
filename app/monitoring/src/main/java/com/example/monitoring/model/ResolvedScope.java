/*
 * どこで: Monitoring ドメインモデル
 * 何を: サイクルスコープの解決結果(根拠と対象モデル)を表す
 * なぜ: 凍結行が無い過去サイクルでも、どの根拠で答えたかを呼び出し側が判別できるようにするため
 */
package com.example.monitoring.model;

import java.util.List;

public record ResolvedScope(long cycleId, ScopeSource scopeSource, List<ScopeModel> models) {

  public List<Long> modelIds() {
    return models.stream().map(ScopeModel::modelId).sorted().toList();
  }
}
