package addsvc.gateway.transport.http;

import io.grpc.Status;

/**
 * RPC 상태 코드 → HTTP 상태 매핑 (grpc-gateway 관례)
 *
 * <p>모든 {@link Status.Code}에 대해 정의된 전역 테이블이며, 테이블에 없는 값은 500입니다.
 */
public final class RpcStatusHttpMapper {

  private RpcStatusHttpMapper() {}

  public static int toHttpStatus(Status.Code code) {
    if (code == null) {
      return 500;
    }
    return switch (code) {
      case OK -> 200;
      case CANCELLED -> 408;
      case UNKNOWN -> 500;
      case INVALID_ARGUMENT -> 400;
      case DEADLINE_EXCEEDED -> 504;
      case NOT_FOUND -> 404;
      case ALREADY_EXISTS -> 409;
      case PERMISSION_DENIED -> 403;
      case RESOURCE_EXHAUSTED -> 429;
      case FAILED_PRECONDITION -> 400;
      case ABORTED -> 409;
      case OUT_OF_RANGE -> 400;
      case UNIMPLEMENTED -> 501;
      case INTERNAL -> 500;
      case UNAVAILABLE -> 503;
      case DATA_LOSS -> 500;
      case UNAUTHENTICATED -> 401;
    };
  }

  /** 숫자 코드 버전. 정의되지 않은 값은 UNKNOWN으로 해석되어 500 */
  public static int toHttpStatus(int codeValue) {
    return toHttpStatus(Status.fromCodeValue(codeValue).getCode());
  }
}
