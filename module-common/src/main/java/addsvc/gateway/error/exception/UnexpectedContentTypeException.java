package addsvc.gateway.error.exception;

import addsvc.gateway.error.CommonErrorCode;
import addsvc.gateway.error.exception.base.ServerBaseException;

public class UnexpectedContentTypeException extends ServerBaseException {

  public UnexpectedContentTypeException(String contentType) {
    super(CommonErrorCode.UNEXPECTED_CONTENT_TYPE, contentType);
  }
}
