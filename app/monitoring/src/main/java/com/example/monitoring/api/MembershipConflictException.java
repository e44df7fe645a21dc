/*
 * どこで: Monitoring API
 * 何を: 所属変更の衝突(409)を表す例外を定義する
 * なぜ: 移管ブロックやロック競合を呼び出し側が判別して再試行を判断できるようにするため
 */
package com.example.monitoring.api;

import com.example.monitoring.model.MonitoringCycleStatus;

public class MembershipConflictException extends RuntimeException {

  private final MonitoringCycleStatus blockingStatus;

  public MembershipConflictException(String message) {
    super(message);
    this.blockingStatus = null;
  }

  public MembershipConflictException(String message, MonitoringCycleStatus blockingStatus) {
    super(message);
    this.blockingStatus = blockingStatus;
  }

  public MembershipConflictException(String message, Throwable cause) {
    super(message, cause);
    this.blockingStatus = null;
  }

  // 移管を止めたサイクルの状態。ロック競合など状態起因でない場合は null。
  public MonitoringCycleStatus getBlockingStatus() {
    return blockingStatus;
  }
}
