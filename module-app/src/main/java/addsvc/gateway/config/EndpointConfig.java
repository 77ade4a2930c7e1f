package addsvc.gateway.config;

import addsvc.gateway.core.endpoint.AddEndpoints;
import addsvc.gateway.core.endpoint.EndpointChain;
import addsvc.gateway.core.endpoint.EndpointMiddleware;
import addsvc.gateway.core.endpoint.middleware.TokenRequiredMiddleware;
import addsvc.gateway.core.service.AddService;
import addsvc.gateway.core.service.DefaultAddService;
import addsvc.gateway.global.tracing.MicrometerTracingMiddleware;
import addsvc.gateway.global.tracing.OpenTelemetryTracingMiddleware;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 엔드포인트 세트와 미들웨어 체인 구성
 *
 * <p>체인 순서 (바깥 → 안쪽):
 *
 * <ul>
 *   <li>서버: [토큰 필수 검사] → OpenTelemetry 스팬 → Micrometer 타이머 → 도메인 호출
 *   <li>클라이언트: OpenTelemetry 스팬 → Micrometer 타이머 → HTTP 호출
 * </ul>
 *
 * <p>모든 빈은 시작 시 한 번 만들어지고 이후 변경되지 않습니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
  GatewayProperties.class,
  AddServiceProperties.class,
  ClientProperties.class
})
public class EndpointConfig {

  @Bean
  public AddService addService(AddServiceProperties properties) {
    return new DefaultAddService(properties.getMaxConcatLength());
  }

  @Bean
  public EndpointChain serverEndpointChain(
      GatewayProperties properties, MeterRegistry meterRegistry, Tracer gatewayTracer) {
    List<EndpointMiddleware> middlewares = new ArrayList<>();
    if (properties.getAuth().isRequired()) {
      middlewares.add(new TokenRequiredMiddleware());
    }
    middlewares.addAll(
        tracingMiddlewares(properties, meterRegistry, gatewayTracer, SpanKind.SERVER));
    log.info(
        "[EndpointConfig] server chain: authRequired={}, middlewares={}",
        properties.getAuth().isRequired(),
        middlewares.size());
    return EndpointChain.of(middlewares);
  }

  @Bean
  public EndpointChain clientEndpointChain(
      GatewayProperties properties, MeterRegistry meterRegistry, Tracer gatewayTracer) {
    return EndpointChain.of(
        tracingMiddlewares(properties, meterRegistry, gatewayTracer, SpanKind.CLIENT));
  }

  @Bean
  public AddEndpoints serverEndpoints(
      @Qualifier("addService") AddService addService,
      @Qualifier("serverEndpointChain") EndpointChain serverEndpointChain) {
    return AddEndpoints.of(addService, serverEndpointChain);
  }

  private List<EndpointMiddleware> tracingMiddlewares(
      GatewayProperties properties, MeterRegistry meterRegistry, Tracer tracer, SpanKind kind) {
    GatewayProperties.Tracing tracing = properties.getTracing();
    List<EndpointMiddleware> middlewares = new ArrayList<>(2);
    if (tracing.isOpentelemetryEnabled()) {
      middlewares.add(new OpenTelemetryTracingMiddleware(tracer, kind));
    }
    if (tracing.isMicrometerEnabled()) {
      middlewares.add(
          new MicrometerTracingMiddleware(meterRegistry, kind.name().toLowerCase(Locale.ROOT)));
    }
    return middlewares;
  }
}
