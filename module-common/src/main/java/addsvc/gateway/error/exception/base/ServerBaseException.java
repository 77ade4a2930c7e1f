package addsvc.gateway.error.exception.base;

import addsvc.gateway.error.ErrorCode;

/** ServerBaseException: 게이트웨이 내부나 상대 서버 쪽 문제로 발생하는 5xx 계열 예외 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
