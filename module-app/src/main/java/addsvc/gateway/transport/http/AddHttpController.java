package addsvc.gateway.transport.http;

import addsvc.gateway.core.endpoint.AddEndpoints;
import addsvc.gateway.core.endpoint.EndpointContext;
import addsvc.gateway.core.endpoint.dto.ConcatRequest;
import addsvc.gateway.core.endpoint.dto.SumRequest;
import addsvc.gateway.global.filter.MDCFilter;
import addsvc.gateway.global.security.filter.BearerTokenFilter;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * add API 라우트
 *
 * <p>본문은 원시 바이트로 받아 {@link AddCodec}이 디코드합니다. 어떤 단계의 실패든 {@link HttpErrorEncoder}로 넘어갑니다.
 *
 * <p>기본 설정({@code add.gateway.auth.required=true})에서는 Bearer 토큰 없는 호출이 401로 끝납니다. 토큰 없는 호출을
 * 받으려면 {@code add.gateway.auth.required=false}로 띄웁니다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/add")
public class AddHttpController {

  private final AddEndpoints serverEndpoints;
  private final AddCodec codec;

  @PostMapping("/sum")
  public ResponseEntity<byte[]> sum(
      @RequestBody(required = false) byte[] body, HttpServletRequest request) throws IOException {
    SumRequest decoded = codec.decodeRequest(body, SumRequest.class, () -> new SumRequest(0, 0));
    return codec.encodeResponse(serverEndpoints.sumEndpoint().call(contextOf(request), decoded));
  }

  @PostMapping("/concat")
  public ResponseEntity<byte[]> concat(
      @RequestBody(required = false) byte[] body, HttpServletRequest request) throws IOException {
    ConcatRequest decoded =
        codec.decodeRequest(body, ConcatRequest.class, () -> new ConcatRequest("", ""));
    return codec.encodeResponse(
        serverEndpoints.concatEndpoint().call(contextOf(request), decoded));
  }

  private static EndpointContext contextOf(HttpServletRequest request) {
    Object token = request.getAttribute(BearerTokenFilter.TOKEN_ATTRIBUTE);
    return EndpointContext.of(MDC.get(MDCFilter.REQUEST_ID_MDC_KEY))
        .withBearerToken(token instanceof String s ? s : null);
  }
}
