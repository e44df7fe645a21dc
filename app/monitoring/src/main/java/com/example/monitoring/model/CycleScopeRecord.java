/*
 * どこで: Monitoring ドメインモデル
 * 何を: monitoring_cycle_model_scopes の 1 行を表す
 * なぜ: 凍結済みスコープを読み出し専用で扱うため
 */
package com.example.monitoring.model;

import java.time.Instant;

public record CycleScopeRecord(
    long cycleId, long modelId, String modelName, Instant lockedAt, ScopeSource scopeSource) {}
