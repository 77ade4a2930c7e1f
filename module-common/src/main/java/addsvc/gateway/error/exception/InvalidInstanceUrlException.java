package addsvc.gateway.error.exception;

import addsvc.gateway.error.CommonErrorCode;
import addsvc.gateway.error.exception.base.ClientBaseException;

public class InvalidInstanceUrlException extends ClientBaseException {

  // 원본 instance 문자열을 메시지에 남겨 설정 오류를 바로 찾을 수 있게 합니다.
  public InvalidInstanceUrlException(String instance, Throwable cause) {
    super(CommonErrorCode.INVALID_INSTANCE_URL, cause, instance);
  }
}
