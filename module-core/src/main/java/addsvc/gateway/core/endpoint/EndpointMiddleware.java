package addsvc.gateway.core.endpoint;

/**
 * 엔드포인트 데코레이터
 *
 * <p>관측 부수효과(스팬, 메트릭)만 추가하고 예외는 같은 인스턴스 그대로 다시 던져야 합니다.
 */
public interface EndpointMiddleware {

  <Q, R> Endpoint<Q, R> apply(String operation, Endpoint<Q, R> next);
}
