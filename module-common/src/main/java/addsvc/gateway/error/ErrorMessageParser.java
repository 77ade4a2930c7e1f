package addsvc.gateway.error;

import addsvc.gateway.error.dto.ErrorDetail;
import java.util.List;

/**
 * 구조화되지 않은 에러 문자열을 하위 에러 목록으로 변환합니다.
 *
 * <p>결과는 항상 원소 1개짜리 목록이며, 원소의 message는 입력 문자열 그대로입니다. ErrorRes의 errors가 비지 않는다는 불변식은 이
 * 파서가 보장합니다.
 */
public final class ErrorMessageParser {

  private ErrorMessageParser() {}

  public static List<ErrorDetail> parse(String message) {
    return List.of(ErrorDetail.of(message == null ? "" : message));
  }
}
