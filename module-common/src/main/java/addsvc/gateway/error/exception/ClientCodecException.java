package addsvc.gateway.error.exception;

import addsvc.gateway.error.CommonErrorCode;
import addsvc.gateway.error.exception.base.ServerBaseException;

/** 원격 인스턴스의 2xx 응답 본문을 해석하지 못했을 때 */
public class ClientCodecException extends ServerBaseException {

  public ClientCodecException(String operation, Throwable cause) {
    super(CommonErrorCode.CLIENT_CODEC_FAILURE, cause, operation, cause.getMessage());
  }

  public ClientCodecException(String operation, String reason) {
    super(CommonErrorCode.CLIENT_CODEC_FAILURE, operation, reason);
  }
}
