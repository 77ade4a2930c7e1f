package addsvc.gateway.core.endpoint;

/**
 * 전송 계층과 무관한 원격 연산 한 개
 *
 * <p>실패는 예외로 전달되며, 응답과 예외가 동시에 나오는 경우는 없습니다. 구현체는 호출 간 가변 상태를 갖지 않아야 합니다.
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 */
@FunctionalInterface
public interface Endpoint<Q, R> {

  R call(EndpointContext context, Q request);
}
