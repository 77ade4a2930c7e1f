package addsvc.gateway.error.exception;

import addsvc.gateway.error.CommonErrorCode;
import addsvc.gateway.error.exception.base.ClientBaseException;

public class TokenContextMissingException extends ClientBaseException {

  public TokenContextMissingException() {
    super(CommonErrorCode.TOKEN_CONTEXT_MISSING);
  }
}
