package addsvc.gateway.error.exception;

import addsvc.gateway.error.dto.ErrorDetail;
import java.util.List;
import lombok.Getter;

/** 원격 인스턴스가 돌려준 ErrorRes 봉투를 다시 에러 값으로 복원한 것 */
@Getter
public class RemoteServiceException extends DomainException {

  private final int statusCode;

  public RemoteServiceException(int statusCode, String message, List<ErrorDetail> errors) {
    super(message, errors);
    this.statusCode = statusCode;
  }
}
