package addsvc.gateway.transport.http;

import addsvc.gateway.error.ErrorMessageParser;
import addsvc.gateway.error.dto.ErrorDetail;
import addsvc.gateway.error.dto.ErrorRes;
import addsvc.gateway.error.exception.DomainException;
import addsvc.gateway.error.exception.TokenContextMissingException;
import addsvc.gateway.error.exception.base.BaseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.io.EOFException;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * 예외 → (HTTP 상태, ErrorRes) 번역기
 *
 * <p>분류는 순서가 있는 체인이며 먼저 맞는 단계가 이깁니다.
 *
 * <ol>
 *   <li>RPC 상태 에러 (원인 체인 어디에 있든): 고정 테이블로 상태 결정, 설명 문자열을 파싱해 하위 에러 생성
 *   <li>도메인 에러: 상태 규칙이 없으면 500, 메시지가 비어 있으면 4단계로
 *   <li>잘 알려진 전송 에러: 본문 끝 조기 도달 / JSON 문법, 타입 불일치, 범위 초과 → 400 (원인 체인 포함), 토큰 누락 →
 *       401, 그 외 {@link BaseException} → ErrorCode 상태
 *   <li>그 외: 메시지를 파싱한 단일 하위 에러, 상태는 500 (3단계에서 정해졌으면 그 값)
 * </ol>
 *
 * <p>1~2단계가 메시지를 정하지 않았으면 최상위 메시지는 항상 {@code errors[0].message}입니다. 번역은 순수 함수라 같은 예외는 같은
 * 봉투를 만듭니다.
 */
@Component
public class ErrorTranslator {

  private static final int MAX_CAUSE_DEPTH = 32;

  private final List<DomainErrorStatusRule> domainRules;

  @Autowired
  public ErrorTranslator(ObjectProvider<DomainErrorStatusRule> domainRules) {
    this(domainRules.orderedStream().toList());
  }

  public ErrorTranslator(List<DomainErrorStatusRule> domainRules) {
    this.domainRules = List.copyOf(domainRules);
  }

  public ErrorTranslation translate(Throwable error) {
    // 1. RPC 상태 에러
    Optional<Status> rpcStatus = findRpcStatus(error);
    if (rpcStatus.isPresent()) {
      Status status = rpcStatus.get();
      String message =
          status.getDescription() != null ? status.getDescription() : status.getCode().name();
      return build(
          RpcStatusHttpMapper.toHttpStatus(status.getCode()),
          message,
          ErrorMessageParser.parse(message));
    }

    // 2. 도메인 에러
    if (error instanceof DomainException domain && hasText(domain.getMessage())) {
      List<ErrorDetail> errors = domain.getErrors();
      if (errors.isEmpty()) {
        errors = ErrorMessageParser.parse(domain.getMessage());
      }
      return build(resolveDomainStatus(domain), domain.getMessage(), errors);
    }

    // 3. 전송 에러 → 4. fallback
    Optional<Throwable> decodeError = findDecodeError(error);
    if (decodeError.isPresent()) {
      List<ErrorDetail> errors = ErrorMessageParser.parse(describe(decodeError.get()));
      return build(HttpStatus.BAD_REQUEST.value(), errors.get(0).message(), errors);
    }
    List<ErrorDetail> errors = ErrorMessageParser.parse(describe(error));
    return build(resolveTransportStatus(error), errors.get(0).message(), errors);
  }

  private int resolveDomainStatus(DomainException domain) {
    for (DomainErrorStatusRule rule : domainRules) {
      Optional<HttpStatus> status = rule.resolve(domain);
      if (status.isPresent()) {
        return status.get().value();
      }
    }
    return HttpStatus.INTERNAL_SERVER_ERROR.value();
  }

  private static int resolveTransportStatus(Throwable error) {
    if (error instanceof TokenContextMissingException) {
      return HttpStatus.UNAUTHORIZED.value();
    }
    if (error instanceof BaseException base) {
      return base.getErrorCode().getStatus().value();
    }
    return HttpStatus.INTERNAL_SERVER_ERROR.value();
  }

  /**
   * 요청 본문 디코드 실패를 원인 체인에서 찾습니다.
   *
   * <p>레코드 생성자 인자로 바인딩하다 난 파서 예외(범위 밖 정수 등)는 Jackson이 JsonMappingException으로 한 번 감싸므로 체인을
   * 따라가야 합니다. 응답 직렬화 실패(InvalidDefinitionException 등)는 여기에 해당하지 않아 500으로 남습니다.
   */
  private static Optional<Throwable> findDecodeError(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      // 코덱 예외처럼 ErrorCode를 가진 예외는 자기 상태를 씁니다.
      if (current instanceof BaseException) {
        return Optional.empty();
      }
      if (isDecodeError(current)) {
        return Optional.of(current);
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return Optional.empty();
  }

  // StreamReadException: JsonParseException, JsonEOFException, InputCoercionException
  private static boolean isDecodeError(Throwable error) {
    return error instanceof EOFException
        || error instanceof StreamReadException
        || error instanceof MismatchedInputException
        || error instanceof StreamConstraintsException;
  }

  private static Optional<Status> findRpcStatus(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof StatusRuntimeException sre) {
        return Optional.of(sre.getStatus());
      }
      if (current instanceof StatusException se) {
        return Optional.of(se.getStatus());
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return Optional.empty();
  }

  /** 위치 정보가 붙지 않은 원본 메시지를 우선 사용합니다. */
  private static String describe(Throwable error) {
    if (error instanceof JsonProcessingException jpe && hasText(jpe.getOriginalMessage())) {
      return jpe.getOriginalMessage();
    }
    if (hasText(error.getMessage())) {
      return error.getMessage();
    }
    return error.getClass().getName();
  }

  private static ErrorTranslation build(int status, String message, List<ErrorDetail> errors) {
    return new ErrorTranslation(status, ErrorRes.of(status, message, errors));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
