package addsvc.gateway.core.exception;

import addsvc.gateway.error.dto.ErrorDetail;
import addsvc.gateway.error.exception.DomainException;
import java.util.List;

public class MaxSizeExceededException extends DomainException {

  public MaxSizeExceededException(int maxLength) {
    super("result exceeds maximum size", List.of(ErrorDetail.of("res", "max length " + maxLength)));
  }
}
