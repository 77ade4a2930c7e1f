package addsvc.gateway.transport.http;

import addsvc.gateway.error.dto.ErrorRes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * add API의 유일한 에러 응답 작성자
 *
 * <p>디코드, 엔드포인트, 인코드 중 어디서 실패하든 한 번만 여기로 넘어옵니다. 로깅은 응답에 영향을 주지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
@RestControllerAdvice(assignableTypes = AddHttpController.class)
public class HttpErrorEncoder {

  private final ErrorTranslator errorTranslator;

  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorRes> handleException(Exception e) {
    ErrorTranslation translation = errorTranslator.translate(e);
    if (translation.status() >= 500) {
      log.error("[AddApi] request failed: status={}", translation.status(), e);
    } else {
      log.warn(
          "[AddApi] request rejected: status={} | {}: {}",
          translation.status(),
          e.getClass().getSimpleName(),
          translation.body().error().message());
    }
    return translation.toResponseEntity();
  }
}
