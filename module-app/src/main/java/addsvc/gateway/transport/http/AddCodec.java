package addsvc.gateway.transport.http;

import addsvc.gateway.core.endpoint.capability.BodyProvider;
import addsvc.gateway.core.endpoint.capability.HeaderCarrier;
import addsvc.gateway.core.endpoint.capability.StatusCarrier;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * add API의 JSON 코덱 (서버/클라이언트 공용)
 *
 * <p>디코드 실패는 Jackson 예외 그대로 던집니다. 상태 결정은 {@link ErrorTranslator}의 몫입니다.
 */
@Component
public class AddCodec {

  public static final String JSON_UTF8 = "application/json; charset=utf-8";

  private static final byte[] EMPTY = new byte[0];

  private final ObjectMapper objectMapper;
  private final ObjectMapper strictMapper;

  public AddCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.strictMapper = strictCopyOf(objectMapper);
  }

  /**
   * 디코드 전용 매퍼. 공유 ObjectMapper는 건드리지 않습니다.
   *
   * <p>정수 필드에 실수/문자열, 문자열 필드에 숫자/불리언이 오면 타입 불일치로 실패합니다. JSON null은 기본값으로 남습니다.
   */
  static ObjectMapper strictCopyOf(ObjectMapper source) {
    ObjectMapper strict = source.copy();
    strict.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    strict
        .coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    strict
        .coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    return strict;
  }

  /**
   * 요청 본문을 디코드합니다. 본문이 없으면 end-of-input 에러, JSON {@code null}이면 기본값 요청입니다.
   *
   * @throws IOException JSON 문법 오류, 타입 불일치, 본문 끝 조기 도달
   */
  public <T> T decodeRequest(byte[] body, Class<T> type, Supplier<T> zeroValue)
      throws IOException {
    T decoded = strictMapper.readValue(body == null ? EMPTY : body, type);
    return decoded != null ? decoded : zeroValue.get();
  }

  /** 응답 능력(헤더/상태/본문 대체)을 반영해 성공 응답을 만듭니다. */
  public ResponseEntity<byte[]> encodeResponse(Object response) throws IOException {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.CONTENT_TYPE, JSON_UTF8);
    if (response instanceof HeaderCarrier carrier) {
      for (Map.Entry<String, List<String>> entry : carrier.headers().entrySet()) {
        for (String value : entry.getValue()) {
          headers.add(entry.getKey(), value);
        }
      }
    }

    int status = HttpStatus.OK.value();
    if (response instanceof StatusCarrier carrier) {
      status = carrier.statusCode();
    }
    if (status == HttpStatus.NO_CONTENT.value()) {
      return ResponseEntity.status(status).headers(headers).build();
    }

    Object body = response instanceof BodyProvider provider ? provider.body() : response;
    return ResponseEntity.status(status).headers(headers).body(objectMapper.writeValueAsBytes(body));
  }

  public byte[] encodeRequest(Object request) throws IOException {
    return objectMapper.writeValueAsBytes(request);
  }

  /** 성공 응답 본문. JSON {@code null}이면 null을 돌려주며 처리는 호출 측 몫입니다. */
  public <R> R decodeResponse(byte[] body, Class<R> type) throws IOException {
    return strictMapper.readValue(body == null ? EMPTY : body, type);
  }
}
