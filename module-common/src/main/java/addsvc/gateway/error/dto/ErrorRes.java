package addsvc.gateway.error.dto;

import java.util.List;

/**
 * 모든 전송 계층이 공유하는 에러 봉투
 *
 * <pre>{@code
 * {"error": {"code": 400, "message": "...", "errors": [{"message": "..."}]}}
 * }</pre>
 */
public record ErrorRes(ErrorResItem error) {

  public static ErrorRes of(int code, String message, List<ErrorDetail> errors) {
    return new ErrorRes(new ErrorResItem(code, message, errors));
  }
}
