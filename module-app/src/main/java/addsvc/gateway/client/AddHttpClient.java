package addsvc.gateway.client;

import addsvc.gateway.core.endpoint.AddEndpoints;
import addsvc.gateway.core.endpoint.EndpointContext;
import addsvc.gateway.core.service.AddService;
import java.net.URI;

/**
 * 원격 add 인스턴스를 {@link AddService}로 노출합니다.
 *
 * <p>로컬 {@code DefaultAddService}와 바꿔 끼울 수 있습니다. 원격 에러는 {@code RemoteServiceException}, 상태 에러,
 * 코덱 에러로 올라옵니다.
 */
public final class AddHttpClient implements AddService {

  private final URI baseUri;
  private final AddEndpoints endpoints;

  AddHttpClient(URI baseUri, AddEndpoints endpoints) {
    this.baseUri = baseUri;
    this.endpoints = endpoints;
  }

  public URI baseUri() {
    return baseUri;
  }

  public AddEndpoints endpoints() {
    return endpoints;
  }

  @Override
  public long sum(EndpointContext context, long a, long b) {
    return endpoints.sum(context, a, b);
  }

  @Override
  public String concat(EndpointContext context, String a, String b) {
    return endpoints.concat(context, a, b);
  }
}
