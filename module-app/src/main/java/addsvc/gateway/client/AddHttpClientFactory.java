package addsvc.gateway.client;

import addsvc.gateway.config.ClientProperties;
import addsvc.gateway.core.endpoint.AddEndpoints;
import addsvc.gateway.core.endpoint.EndpointChain;
import addsvc.gateway.core.endpoint.dto.ConcatRequest;
import addsvc.gateway.core.endpoint.dto.ConcatResponse;
import addsvc.gateway.core.endpoint.dto.SumRequest;
import addsvc.gateway.core.endpoint.dto.SumResponse;
import addsvc.gateway.error.exception.InvalidInstanceUrlException;
import addsvc.gateway.transport.http.AddCodec;
import io.opentelemetry.api.OpenTelemetry;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 인스턴스 주소로 {@link AddHttpClient}를 만듭니다.
 *
 * <p>스킴이 없으면 http://를 붙입니다. 주소가 잘못되면 생성 시점에 {@link InvalidInstanceUrlException}입니다. 클라이언트 체인에는
 * 토큰 필수 검사가 없습니다.
 */
@Slf4j
@Component
public class AddHttpClientFactory {

  static final String SUM_PATH = "/api/add/sum";
  static final String CONCAT_PATH = "/api/add/concat";

  private final WebClient webClient;
  private final EndpointChain clientEndpointChain;
  private final AddCodec codec;
  private final JsonErrorDecoder errorDecoder;
  private final OpenTelemetry openTelemetry;
  private final ClientProperties properties;
  private final Clock clock;

  @Autowired
  public AddHttpClientFactory(
      WebClient.Builder webClientBuilder,
      @Qualifier("clientEndpointChain") EndpointChain clientEndpointChain,
      AddCodec codec,
      JsonErrorDecoder errorDecoder,
      OpenTelemetry openTelemetry,
      ClientProperties properties) {
    this(
        webClientBuilder.build(),
        clientEndpointChain,
        codec,
        errorDecoder,
        openTelemetry,
        properties,
        Clock.systemUTC());
  }

  AddHttpClientFactory(
      WebClient webClient,
      EndpointChain clientEndpointChain,
      AddCodec codec,
      JsonErrorDecoder errorDecoder,
      OpenTelemetry openTelemetry,
      ClientProperties properties,
      Clock clock) {
    this.webClient = webClient;
    this.clientEndpointChain = clientEndpointChain;
    this.codec = codec;
    this.errorDecoder = errorDecoder;
    this.openTelemetry = openTelemetry;
    this.properties = properties;
    this.clock = clock;
  }

  public AddHttpClient create(String instance) {
    URI base = normalizeInstance(instance);
    AddEndpoints endpoints =
        new AddEndpoints(
            clientEndpointChain.decorate(
                AddEndpoints.SUM,
                this.<SumRequest, SumResponse>endpoint(
                    base, SUM_PATH, AddEndpoints.SUM, SumResponse.class)),
            clientEndpointChain.decorate(
                AddEndpoints.CONCAT,
                this.<ConcatRequest, ConcatResponse>endpoint(
                    base, CONCAT_PATH, AddEndpoints.CONCAT, ConcatResponse.class)));
    log.info("[AddHttpClient] created for {}", base);
    return new AddHttpClient(base, endpoints);
  }

  private <Q, R> HttpClientEndpoint<Q, R> endpoint(
      URI base, String path, String operation, Class<R> responseType) {
    URI uri = UriComponentsBuilder.fromUri(base).replacePath(path).replaceQuery(null).build().toUri();
    return new HttpClientEndpoint<>(
        webClient,
        uri,
        operation,
        responseType,
        codec,
        errorDecoder,
        openTelemetry.getPropagators().getTextMapPropagator(),
        properties.getTimeout(),
        clock);
  }

  static URI normalizeInstance(String instance) {
    if (instance == null || instance.isBlank()) {
      throw new InvalidInstanceUrlException(String.valueOf(instance), null);
    }
    String candidate = instance.trim();
    if (!candidate.startsWith("http")) {
      candidate = "http://" + candidate;
    }
    URI uri;
    try {
      uri = new URI(candidate);
    } catch (URISyntaxException e) {
      throw new InvalidInstanceUrlException(instance, e);
    }
    if (uri.getHost() == null) {
      throw new InvalidInstanceUrlException(instance, null);
    }
    return uri;
  }
}
