/*
 * どこで: Monitoring Web 設定
 * 何を: RequestMdcInterceptor を /v1 配下の API に適用し、plan_id/model_id/cycle_id を MDC へ載せる
 * なぜ: 所属変更やサイクル開始のログへ対象 ID を安定して埋め込み、actuator は対象外にするため
 */
package com.example.monitoring.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**");
  }
}
