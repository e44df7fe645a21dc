/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: 台帳の effective_from/effective_to とロック時刻を同一の時刻源で刻むため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
