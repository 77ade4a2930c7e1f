package addsvc.gateway.config;

import addsvc.gateway.global.security.filter.BearerTokenFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class WebConfig {

  static final String API_URL_PATTERN = "/api/add/*";

  /**
   * bearer 토큰 추출 필터는 API 경로에만 적용합니다. /metrics 등 관리 경로는 대상이 아닙니다.
   *
   * <p>MDCFilter 다음에 실행되어야 추출 로그에 requestId가 남습니다.
   */
  @Bean
  public FilterRegistrationBean<BearerTokenFilter> bearerTokenFilterRegistration() {
    FilterRegistrationBean<BearerTokenFilter> registration =
        new FilterRegistrationBean<>(new BearerTokenFilter());
    registration.addUrlPatterns(API_URL_PATTERN);
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
