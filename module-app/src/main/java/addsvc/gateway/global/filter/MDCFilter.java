package addsvc.gateway.global.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 요청 상관관계 ID 필터
 *
 * <p>ID는 {@code EndpointContext.requestId}가 되어 엔드포인트 체인, 스팬 속성, 원격 호출 헤더까지 그대로 이어집니다. 인바운드
 * X-Correlation-ID는 형식이 안전할 때만 이어받고, 아니면 새로 만듭니다. 로그 줄을 깨는 값이 MDC에 들어가지 않게 하기 위함입니다.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MDCFilter extends OncePerRequestFilter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
  public static final String REQUEST_ID_MDC_KEY = "requestId";

  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = resolveRequestId(request.getHeader(CORRELATION_ID_HEADER));
    MDC.put(REQUEST_ID_MDC_KEY, requestId);
    response.setHeader(CORRELATION_ID_HEADER, requestId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_MDC_KEY);
    }
  }

  static String resolveRequestId(String inbound) {
    if (inbound == null || inbound.isBlank()) {
      return UUID.randomUUID().toString();
    }
    String trimmed = inbound.trim();
    if (!SAFE_ID.matcher(trimmed).matches()) {
      log.debug("[MDCFilter] unsafe correlation id replaced (length={})", trimmed.length());
      return UUID.randomUUID().toString();
    }
    return trimmed;
  }
}
