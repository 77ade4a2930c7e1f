package addsvc.gateway.config;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry 설정
 *
 * <p>SDK나 Java agent가 OpenTelemetry 빈/전역 인스턴스를 제공하면 그것을 쓰고, 없으면 no-op 구현이 잡힙니다.
 */
@Slf4j
@Configuration
public class TracingConfig {

  public static final String INSTRUMENTATION_NAME = "addsvc.gateway";

  @Bean
  @ConditionalOnMissingBean(OpenTelemetry.class)
  public OpenTelemetry openTelemetry() {
    log.info("[OpenTelemetry] 등록된 SDK 빈이 없어 GlobalOpenTelemetry 사용");
    return GlobalOpenTelemetry.get();
  }

  @Bean
  public Tracer gatewayTracer(OpenTelemetry openTelemetry) {
    return openTelemetry.getTracer(INSTRUMENTATION_NAME);
  }
}
