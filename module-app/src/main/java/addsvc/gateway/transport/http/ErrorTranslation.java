package addsvc.gateway.transport.http;

import addsvc.gateway.error.dto.ErrorRes;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/** 번역 결과: HTTP 상태 + 에러 봉투 */
public record ErrorTranslation(int status, ErrorRes body) {

  public ResponseEntity<ErrorRes> toResponseEntity() {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
