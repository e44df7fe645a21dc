/*
 * どこで: Monitoring 設定
 * 何を: 所属変更/サイクル開始のロック待ち上限を保持する
 * なぜ: 競合時に無制限に待たず、衝突として呼び出し側へ返すため
 */
package com.example.monitoring.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

// lock-timeout が 0 の場合は PostgreSQL の既定どおり無期限に待つ。
@Validated
@ConfigurationProperties(prefix = "monitoring.locking")
public record MonitoringLockingProperties(@NotNull Duration lockTimeout) {}
