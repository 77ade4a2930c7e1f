package addsvc.gateway.error.exception.base;

import addsvc.gateway.error.ErrorCode;

/** ClientBaseException: 호출자의 입력이나 요청 상태가 잘못되었을 때 발생하는 4xx 계열 예외 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
