package com.example.monitoring.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.handler.MappedInterceptor;

class WebMvcConfigTest {

  @Test
  void mdcInterceptorAppliesToApiPathsOnly() {
    final ExposedInterceptorRegistry registry = new ExposedInterceptorRegistry();

    new WebMvcConfig(new RequestMdcInterceptor()).addInterceptors(registry);

    final List<Object> interceptors = registry.registered();
    assertThat(interceptors).hasSize(1).first().isInstanceOf(MappedInterceptor.class);
    final MappedInterceptor mapped = (MappedInterceptor) interceptors.get(0);
    assertThat(mapped.getInterceptor()).isInstanceOf(RequestMdcInterceptor.class);
    assertThat(mapped.matches(new MockHttpServletRequest("POST", "/v1/monitoring/cycles/3/start")))
        .isTrue();
    assertThat(mapped.matches(new MockHttpServletRequest("GET", "/actuator/health"))).isFalse();
  }

  private static final class ExposedInterceptorRegistry extends InterceptorRegistry {

    List<Object> registered() {
      return getInterceptors();
    }
  }
}
