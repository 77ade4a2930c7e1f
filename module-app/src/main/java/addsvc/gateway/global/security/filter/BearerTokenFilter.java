package addsvc.gateway.global.security.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authorization 헤더에서 bearer 토큰을 꺼내 요청 속성으로 옮기는 필터
 *
 * <p>검증은 하지 않습니다. 토큰이 없거나 형식이 다르면 아무것도 하지 않고 통과시키며, 거절은 엔드포인트 미들웨어가 담당합니다.
 */
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

  public static final String TOKEN_ATTRIBUTE = BearerTokenFilter.class.getName() + ".TOKEN";

  private static final String BEARER_PREFIX = "Bearer ";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token != null) {
      request.setAttribute(TOKEN_ATTRIBUTE, token);
    } else {
      log.debug("[BearerToken] no bearer token on {}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  /** "Bearer xxx" (대소문자 무시)에서 xxx. 형식이 다르거나 비어 있으면 null */
  static String extractToken(String header) {
    if (header == null || header.length() <= BEARER_PREFIX.length()) {
      return null;
    }
    if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = header.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
