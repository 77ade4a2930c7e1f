package addsvc.gateway.core.endpoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 호출 한 건에 묶인 불변 컨텍스트
 *
 * <p>요청마다 새로 만들어지며 요청 간에 공유되지 않습니다.
 *
 * @param requestId 상관관계 ID (MDC requestId와 동일)
 * @param bearerToken 인바운드에서 추출한 토큰 (없으면 null)
 * @param deadline 호출 마감 시각 (없으면 null)
 */
public record EndpointContext(String requestId, String bearerToken, Instant deadline) {

  public EndpointContext {
    if (requestId == null) {
      requestId = "";
    }
    if (bearerToken != null && bearerToken.isBlank()) {
      bearerToken = null;
    }
  }

  public static EndpointContext empty() {
    return new EndpointContext("", null, null);
  }

  public static EndpointContext of(String requestId) {
    return new EndpointContext(requestId, null, null);
  }

  public EndpointContext withBearerToken(String token) {
    return new EndpointContext(requestId, token, deadline);
  }

  public EndpointContext withDeadline(Instant newDeadline) {
    return new EndpointContext(requestId, bearerToken, newDeadline);
  }

  public Optional<String> findBearerToken() {
    return Optional.ofNullable(bearerToken);
  }

  public Optional<Instant> findDeadline() {
    return Optional.ofNullable(deadline);
  }

  /** 마감까지 남은 시간. 마감이 없으면 fallback, 이미 지났으면 0 */
  public Duration remaining(Clock clock, Duration fallback) {
    if (deadline == null) {
      return fallback;
    }
    Duration left = Duration.between(clock.instant(), deadline);
    if (left.isNegative()) {
      return Duration.ZERO;
    }
    return left.compareTo(fallback) < 0 ? left : fallback;
  }
}
