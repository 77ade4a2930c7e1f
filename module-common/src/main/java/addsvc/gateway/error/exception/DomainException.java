package addsvc.gateway.error.exception;

import addsvc.gateway.error.dto.ErrorDetail;
import java.util.List;

/**
 * 도메인 계층이 던지는 타입 있는 에러
 *
 * <p>사람이 읽을 메시지와 0개 이상의 구조화된 하위 에러를 담습니다. HTTP 상태는 에러 자신이 아니라 번역기가 결정합니다 (기본 500).
 */
public class DomainException extends RuntimeException {

  private final List<ErrorDetail> errors;

  public DomainException(String message) {
    this(message, List.of());
  }

  public DomainException(String message, List<ErrorDetail> errors) {
    super(message);
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public DomainException(String message, List<ErrorDetail> errors, Throwable cause) {
    super(message, cause);
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public List<ErrorDetail> getErrors() {
    return errors;
  }
}
