package addsvc.gateway.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 하위 에러 한 건
 *
 * @param field 문제가 된 필드 (없으면 JSON에서 생략)
 * @param message 에러 메시지
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(String field, String message) {

  public static ErrorDetail of(String message) {
    return new ErrorDetail(null, message);
  }

  public static ErrorDetail of(String field, String message) {
    return new ErrorDetail(field, message);
  }
}
