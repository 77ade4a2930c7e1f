package addsvc.gateway.transport.http;

import addsvc.gateway.error.exception.DomainException;
import java.util.Optional;
import org.springframework.http.HttpStatus;

/**
 * 도메인 에러의 HTTP 상태를 덮어쓰는 규칙
 *
 * <p>빈으로 등록하면 {@link ErrorTranslator}가 {@code @Order} 순서대로 확인하고 처음으로 값을 준 규칙을 씁니다. 등록된 규칙이
 * 없으면 도메인 에러는 500입니다.
 */
@FunctionalInterface
public interface DomainErrorStatusRule {

  Optional<HttpStatus> resolve(DomainException exception);
}
