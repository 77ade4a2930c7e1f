package addsvc.gateway.global.tracing;

import addsvc.gateway.core.endpoint.Endpoint;
import addsvc.gateway.core.endpoint.EndpointMiddleware;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 엔드포인트 호출 시간을 Micrometer 타이머로 기록합니다.
 *
 * <p>메트릭 이름: {@code add.endpoint} (Prometheus: {@code add_endpoint_seconds_*})
 *
 * <p>태그: endpoint(Sum/Concat), side(server/client), result(success/failure), exception(예외 클래스명 또는
 * none)
 */
public class MicrometerTracingMiddleware implements EndpointMiddleware {

  public static final String METRIC_NAME = "add.endpoint";

  private final MeterRegistry meterRegistry;
  private final String side;

  public MicrometerTracingMiddleware(MeterRegistry meterRegistry, String side) {
    this.meterRegistry = meterRegistry;
    this.side = side;
  }

  @Override
  public <Q, R> Endpoint<Q, R> apply(String operation, Endpoint<Q, R> next) {
    return (context, request) -> {
      Timer.Sample sample = Timer.start(meterRegistry);
      try {
        R response = next.call(context, request);
        stop(sample, operation, "success", "none");
        return response;
      } catch (RuntimeException e) {
        stop(sample, operation, "failure", e.getClass().getSimpleName());
        throw e;
      }
    };
  }

  private void stop(Timer.Sample sample, String operation, String result, String exception) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .description("add endpoint latency")
            .tag("endpoint", operation)
            .tag("side", side)
            .tag("result", result)
            .tag("exception", exception)
            .register(meterRegistry));
  }
}
