package addsvc.gateway.core.endpoint;

import addsvc.gateway.core.endpoint.dto.ConcatRequest;
import addsvc.gateway.core.endpoint.dto.ConcatResponse;
import addsvc.gateway.core.endpoint.dto.SumRequest;
import addsvc.gateway.core.endpoint.dto.SumResponse;
import addsvc.gateway.core.service.AddService;
import java.util.Objects;

/**
 * Sum/Concat 엔드포인트 묶음
 *
 * <p>시작 시 한 번 만들어 모든 요청이 읽기 전용으로 공유합니다. 서버에서는 도메인 서비스를 감싸고, 클라이언트에서는 HTTP 엔드포인트를
 * 감싼 뒤 {@link AddService}로 노출됩니다.
 */
public record AddEndpoints(
    Endpoint<SumRequest, SumResponse> sumEndpoint,
    Endpoint<ConcatRequest, ConcatResponse> concatEndpoint)
    implements AddService {

  public static final String SUM = "Sum";
  public static final String CONCAT = "Concat";

  public AddEndpoints {
    Objects.requireNonNull(sumEndpoint, "sumEndpoint must not be null");
    Objects.requireNonNull(concatEndpoint, "concatEndpoint must not be null");
  }

  public static AddEndpoints of(AddService service, EndpointChain chain) {
    return new AddEndpoints(
        chain.decorate(SUM, makeSumEndpoint(service)),
        chain.decorate(CONCAT, makeConcatEndpoint(service)));
  }

  public static Endpoint<SumRequest, SumResponse> makeSumEndpoint(AddService service) {
    return (context, request) -> new SumResponse(service.sum(context, request.a(), request.b()));
  }

  public static Endpoint<ConcatRequest, ConcatResponse> makeConcatEndpoint(AddService service) {
    return (context, request) ->
        new ConcatResponse(service.concat(context, request.a(), request.b()));
  }

  @Override
  public long sum(EndpointContext context, long a, long b) {
    return sumEndpoint.call(context, new SumRequest(a, b)).res();
  }

  @Override
  public String concat(EndpointContext context, String a, String b) {
    return concatEndpoint.call(context, new ConcatRequest(a, b)).res();
  }
}
