package addsvc.gateway.client;

import addsvc.gateway.error.dto.ErrorDetail;
import addsvc.gateway.error.exception.ClientCodecException;
import addsvc.gateway.error.exception.RemoteServiceException;
import addsvc.gateway.error.exception.UnexpectedContentTypeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * 원격 인스턴스의 non-2xx 응답을 에러 값으로 복원합니다.
 *
 * <p>ErrorRes 봉투({@code {"error":{...}}})와 문자열 한 줄짜리 구 형식({@code {"error":"..."}})을 모두 읽습니다.
 */
@Component
@RequiredArgsConstructor
public class JsonErrorDecoder {

  private final ObjectMapper objectMapper;

  /** 던질 예외를 돌려줍니다. 이 메서드 자체는 던지지 않습니다. */
  public RuntimeException decode(int status, String contentType, byte[] body) {
    if (contentType == null || !contentType.contains(MediaType.APPLICATION_JSON_VALUE)) {
      return new UnexpectedContentTypeException(contentType == null ? "" : contentType);
    }
    try {
      JsonNode root = objectMapper.readTree(body == null ? new byte[0] : body);
      JsonNode error = root == null ? null : root.get("error");
      if (error == null || error.isNull()) {
        return new RemoteServiceException(status, "", List.of());
      }
      if (error.isTextual()) {
        return new RemoteServiceException(status, error.asText(), List.of());
      }
      return new RemoteServiceException(
          status, error.path("message").asText(""), readDetails(error.path("errors")));
    } catch (IOException e) {
      return new ClientCodecException("error", e);
    }
  }

  private static List<ErrorDetail> readDetails(JsonNode errors) {
    List<ErrorDetail> details = new ArrayList<>();
    for (JsonNode item : errors) {
      String field = item.hasNonNull("field") ? item.get("field").asText() : null;
      details.add(ErrorDetail.of(field, item.path("message").asText("")));
    }
    return details;
  }
}
