package addsvc.gateway.core.exception;

import addsvc.gateway.error.dto.ErrorDetail;
import addsvc.gateway.error.exception.DomainException;
import java.util.List;

public class IntOverflowException extends DomainException {

  public IntOverflowException(long a, long b, Throwable cause) {
    super(
        "integer overflow",
        List.of(ErrorDetail.of("res", "sum of " + a + " and " + b + " overflows a 64-bit integer")),
        cause);
  }
}
