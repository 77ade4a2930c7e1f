package addsvc.gateway.client;

import addsvc.gateway.core.endpoint.Endpoint;
import addsvc.gateway.core.endpoint.EndpointContext;
import addsvc.gateway.error.exception.ClientCodecException;
import addsvc.gateway.global.filter.MDCFilter;
import addsvc.gateway.transport.http.AddCodec;
import io.grpc.Status;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 원격 add 인스턴스의 한 라우트를 호출하는 클라이언트 엔드포인트
 *
 * <p>호출 스레드에서 블로킹합니다. 마감(컨텍스트 deadline과 설정 timeout 중 짧은 쪽)을 넘기면 DEADLINE_EXCEEDED 상태 에러입니다.
 */
@Slf4j
class HttpClientEndpoint<Q, R> implements Endpoint<Q, R> {

  private static final byte[] EMPTY = new byte[0];

  private static final TextMapSetter<HttpHeaders> HEADER_SETTER =
      (carrier, key, value) -> {
        if (carrier != null) {
          carrier.set(key, value);
        }
      };

  private final WebClient webClient;
  private final URI uri;
  private final String operation;
  private final Class<R> responseType;
  private final AddCodec codec;
  private final JsonErrorDecoder errorDecoder;
  private final TextMapPropagator propagator;
  private final Duration timeout;
  private final Clock clock;

  HttpClientEndpoint(
      WebClient webClient,
      URI uri,
      String operation,
      Class<R> responseType,
      AddCodec codec,
      JsonErrorDecoder errorDecoder,
      TextMapPropagator propagator,
      Duration timeout,
      Clock clock) {
    this.webClient = webClient;
    this.uri = uri;
    this.operation = operation;
    this.responseType = responseType;
    this.codec = codec;
    this.errorDecoder = errorDecoder;
    this.propagator = propagator;
    this.timeout = timeout;
    this.clock = clock;
  }

  @Override
  public R call(EndpointContext context, Q request) {
    byte[] payload;
    try {
      payload = codec.encodeRequest(request);
    } catch (IOException e) {
      throw new ClientCodecException(operation, e);
    }

    Duration budget = context.remaining(clock, timeout);
    if (budget.isZero()) {
      throw Status.DEADLINE_EXCEEDED
          .withDescription(operation + " deadline already passed")
          .asRuntimeException();
    }

    return webClient
        .post()
        .uri(uri)
        .contentType(MediaType.APPLICATION_JSON)
        .headers(headers -> writeHeaders(headers, context))
        .bodyValue(payload)
        .exchangeToMono(
            response ->
                response
                    .bodyToMono(byte[].class)
                    .defaultIfEmpty(EMPTY)
                    .map(body -> handle(response, body)))
        .timeout(budget)
        .onErrorMap(
            TimeoutException.class,
            e ->
                Status.DEADLINE_EXCEEDED
                    .withDescription(operation + " timed out after " + budget.toMillis() + "ms")
                    .withCause(e)
                    .asRuntimeException())
        .block();
  }

  private void writeHeaders(HttpHeaders headers, EndpointContext context) {
    context.findBearerToken().ifPresent(headers::setBearerAuth);
    if (!context.requestId().isEmpty()) {
      headers.set(MDCFilter.CORRELATION_ID_HEADER, context.requestId());
    }
    propagator.inject(Context.current(), headers, HEADER_SETTER);
  }

  private R handle(ClientResponse response, byte[] body) {
    int status = response.statusCode().value();
    if (!response.statusCode().is2xxSuccessful()) {
      String contentType = response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
      log.debug("[{}] remote returned {} ({})", operation, status, contentType);
      throw errorDecoder.decode(status, contentType, body);
    }
    R decoded;
    try {
      decoded = codec.decodeResponse(body, responseType);
    } catch (IOException e) {
      throw new ClientCodecException(operation, e);
    }
    if (decoded == null) {
      throw new ClientCodecException(operation, "response body is JSON null");
    }
    return decoded;
  }
}
