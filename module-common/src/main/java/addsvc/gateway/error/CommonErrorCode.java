package addsvc.gateway.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 게이트웨이 공통 에러 코드
 *
 * <p>메시지는 와이어(ErrorRes)에 그대로 노출되므로 클라이언트 호환을 위해 영문 고정 문구를 사용합니다.
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INSTANCE_URL("C001", "invalid instance url: %s", HttpStatus.BAD_REQUEST),

  // === Auth Errors ===
  TOKEN_CONTEXT_MISSING(
      "A001", "token up for parsing was not found in context", HttpStatus.UNAUTHORIZED),

  // === Server Errors (5xx) ===
  UNEXPECTED_CONTENT_TYPE(
      "S001", "expected JSON formatted error, got Content-Type %s", HttpStatus.BAD_GATEWAY),
  CLIENT_CODEC_FAILURE("S002", "failed to decode %s response: %s", HttpStatus.BAD_GATEWAY);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
