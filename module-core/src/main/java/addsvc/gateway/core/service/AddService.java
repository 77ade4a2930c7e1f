package addsvc.gateway.core.service;

import addsvc.gateway.core.endpoint.EndpointContext;

/**
 * 덧셈 서비스 계약
 *
 * <p>로컬 구현({@link DefaultAddService})과 원격 HTTP 클라이언트가 같은 계약을 구현하므로 호출 측은 둘을 구분하지 않습니다.
 */
public interface AddService {

  /**
   * 두 정수의 합
   *
   * @throws addsvc.gateway.core.exception.IntOverflowException 결과가 long 범위를 벗어날 때
   */
  long sum(EndpointContext context, long a, long b);

  /**
   * 두 문자열 연결
   *
   * @throws addsvc.gateway.core.exception.MaxSizeExceededException 결과가 최대 길이를 넘을 때
   */
  String concat(EndpointContext context, String a, String b);
}
