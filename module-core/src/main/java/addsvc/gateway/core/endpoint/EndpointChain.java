package addsvc.gateway.core.endpoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 순서가 고정된 미들웨어 목록
 *
 * <p>목록은 바깥 → 안쪽 순서입니다. {@code EndpointChain.of(a, b)}로 감싼 엔드포인트는 a → b → 도메인 호출 순으로 실행됩니다.
 * 생성 후 변경되지 않으므로 요청 간 공유가 안전합니다.
 */
public final class EndpointChain {

  private static final EndpointChain EMPTY = new EndpointChain(List.of());

  private final List<EndpointMiddleware> middlewares;

  private EndpointChain(List<EndpointMiddleware> middlewares) {
    this.middlewares = List.copyOf(middlewares);
  }

  public static EndpointChain empty() {
    return EMPTY;
  }

  public static EndpointChain of(EndpointMiddleware... middlewares) {
    return of(Arrays.asList(middlewares));
  }

  public static EndpointChain of(List<EndpointMiddleware> middlewares) {
    Objects.requireNonNull(middlewares, "middlewares must not be null");
    for (int i = 0; i < middlewares.size(); i++) {
      Objects.requireNonNull(middlewares.get(i), "middlewares[" + i + "] is null");
    }
    return new EndpointChain(middlewares);
  }

  /** 가장 바깥에 미들웨어를 하나 더한 새 체인 */
  public EndpointChain prepend(EndpointMiddleware outermost) {
    Objects.requireNonNull(outermost, "outermost must not be null");
    List<EndpointMiddleware> next = new ArrayList<>(middlewares.size() + 1);
    next.add(outermost);
    next.addAll(middlewares);
    return new EndpointChain(next);
  }

  public <Q, R> Endpoint<Q, R> decorate(String operation, Endpoint<Q, R> endpoint) {
    Objects.requireNonNull(endpoint, "endpoint must not be null");
    Endpoint<Q, R> current = endpoint;
    // 안쪽부터 감싸야 목록 첫 번째가 가장 바깥이 됩니다.
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      current = middlewares.get(i).apply(operation, current);
    }
    return current;
  }

  public List<EndpointMiddleware> middlewares() {
    return middlewares;
  }
}
