package addsvc.gateway.core.service;

import addsvc.gateway.core.endpoint.EndpointContext;
import addsvc.gateway.core.exception.IntOverflowException;
import addsvc.gateway.core.exception.MaxSizeExceededException;

/** 상태 없는 기본 구현. 생성 이후 필드가 바뀌지 않으므로 동시 호출에 안전합니다. */
public class DefaultAddService implements AddService {

  private final int maxConcatLength;

  public DefaultAddService(int maxConcatLength) {
    if (maxConcatLength < 0) {
      throw new IllegalArgumentException("maxConcatLength must not be negative: " + maxConcatLength);
    }
    this.maxConcatLength = maxConcatLength;
  }

  @Override
  public long sum(EndpointContext context, long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException e) {
      throw new IntOverflowException(a, b, e);
    }
  }

  @Override
  public String concat(EndpointContext context, String a, String b) {
    String result = nullToEmpty(a) + nullToEmpty(b);
    if (result.length() > maxConcatLength) {
      throw new MaxSizeExceededException(maxConcatLength);
    }
    return result;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
