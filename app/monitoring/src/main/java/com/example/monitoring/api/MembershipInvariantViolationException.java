/*
 * どこで: Monitoring API
 * 何を: 台帳の一意制約/CHECK 制約違反を表す例外を定義する
 * なぜ: 有効所属の重複やスコープ改変の試みをロールバックさせた上で必ず表に出すため
 */
package com.example.monitoring.api;

public class MembershipInvariantViolationException extends RuntimeException {

  public MembershipInvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
