package addsvc.gateway.error;

import static org.assertj.core.api.Assertions.assertThat;

import addsvc.gateway.error.exception.InvalidInstanceUrlException;
import addsvc.gateway.error.exception.TokenContextMissingException;
import addsvc.gateway.error.exception.UnexpectedContentTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class CommonErrorCodeTest {

  @Test
  @DisplayName("토큰 누락은 401 + A001")
  void tokenContextMissing_isUnauthorized() {
    TokenContextMissingException e = new TokenContextMissingException();

    assertThat(e.getErrorCode()).isEqualTo(CommonErrorCode.TOKEN_CONTEXT_MISSING);
    assertThat(e.getErrorCode().getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(e.getMessage()).isEqualTo("token up for parsing was not found in context");
  }

  @Test
  @DisplayName("동적 인자가 메시지에 포맷된다")
  void dynamicArgs_areFormattedIntoMessage() {
    UnexpectedContentTypeException e = new UnexpectedContentTypeException("text/html");

    assertThat(e.getMessage()).isEqualTo("expected JSON formatted error, got Content-Type text/html");
    assertThat(e.getErrorCode().getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
  }

  @Test
  @DisplayName("cause를 포함한 생성자는 예외 체인을 보존한다")
  void causeIsPreserved() {
    IllegalArgumentException cause = new IllegalArgumentException("bad port");

    InvalidInstanceUrlException e = new InvalidInstanceUrlException("host:abc", cause);

    assertThat(e.getCause()).isSameAs(cause);
    assertThat(e.getMessage()).isEqualTo("invalid instance url: host:abc");
  }

  @Test
  void codesAreUnique() {
    assertThat(CommonErrorCode.values())
        .extracting(CommonErrorCode::getCode)
        .doesNotHaveDuplicates();
  }
}
