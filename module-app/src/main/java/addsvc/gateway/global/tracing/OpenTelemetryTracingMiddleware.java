package addsvc.gateway.global.tracing;

import addsvc.gateway.core.endpoint.Endpoint;
import addsvc.gateway.core.endpoint.EndpointMiddleware;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * 엔드포인트 호출마다 OpenTelemetry 스팬을 엽니다.
 *
 * <p>스팬은 호출 동안 현재 컨텍스트가 되므로, 클라이언트 측에서는 안쪽 HTTP 엔드포인트가 이 스팬을 W3C traceparent로 전파합니다.
 */
public class OpenTelemetryTracingMiddleware implements EndpointMiddleware {

  private final Tracer tracer;
  private final SpanKind kind;

  public OpenTelemetryTracingMiddleware(Tracer tracer, SpanKind kind) {
    this.tracer = tracer;
    this.kind = kind;
  }

  @Override
  public <Q, R> Endpoint<Q, R> apply(String operation, Endpoint<Q, R> next) {
    return (context, request) -> {
      Span span = tracer.spanBuilder(operation).setSpanKind(kind).startSpan();
      if (!context.requestId().isEmpty()) {
        span.setAttribute("request.id", context.requestId());
      }
      try (Scope ignored = span.makeCurrent()) {
        return next.call(context, request);
      } catch (RuntimeException e) {
        span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
        span.recordException(e);
        throw e;
      } finally {
        span.end();
      }
    };
  }
}
