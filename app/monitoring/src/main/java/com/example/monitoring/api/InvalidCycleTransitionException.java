/*
 * どこで: Monitoring API
 * 何を: サイクル状態遷移の衝突(409)を表す例外を定義する
 * なぜ: 現在状態では許されない遷移を明確に扱うため
 */
package com.example.monitoring.api;

import com.example.monitoring.model.MonitoringCycleStatus;

public class InvalidCycleTransitionException extends RuntimeException {

  private final MonitoringCycleStatus currentStatus;

  public InvalidCycleTransitionException(String message, MonitoringCycleStatus currentStatus) {
    super(message);
    this.currentStatus = currentStatus;
  }

  public MonitoringCycleStatus getCurrentStatus() {
    return currentStatus;
  }
}
