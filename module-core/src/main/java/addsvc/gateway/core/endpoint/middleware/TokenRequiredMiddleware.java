package addsvc.gateway.core.endpoint.middleware;

import addsvc.gateway.core.endpoint.Endpoint;
import addsvc.gateway.core.endpoint.EndpointMiddleware;
import addsvc.gateway.error.exception.TokenContextMissingException;
import lombok.extern.slf4j.Slf4j;

/**
 * 컨텍스트에 bearer 토큰이 없으면 엔드포인트 실행 전에 실패시킵니다.
 *
 * <p>토큰 검증은 하지 않습니다. 추출은 전송 계층(서블릿 필터)의 몫입니다.
 */
@Slf4j
public class TokenRequiredMiddleware implements EndpointMiddleware {

  @Override
  public <Q, R> Endpoint<Q, R> apply(String operation, Endpoint<Q, R> next) {
    return (context, request) -> {
      if (context.findBearerToken().isEmpty()) {
        log.debug("[{}] bearer token missing: requestId={}", operation, context.requestId());
        throw new TokenContextMissingException();
      }
      return next.call(context, request);
    };
  }
}
