package addsvc.gateway.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import addsvc.gateway.core.endpoint.EndpointContext;
import addsvc.gateway.core.service.AddService;
import addsvc.gateway.error.exception.RemoteServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;

/** 실제 포트로 띄운 게이트웨이를 HTTP 클라이언트로 호출하는 왕복 테스트 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("AddHttpClient 왕복 테스트")
class AddHttpClientIntegrationTest {

  @LocalServerPort private int port;

  @Autowired private AddHttpClientFactory factory;

  private AddService remote;

  @BeforeEach
  void setUp() {
    remote = factory.create("localhost:" + port);
  }

  @Test
  @DisplayName("원격 sum / concat이 로컬과 같은 결과")
  void roundTrip() {
    EndpointContext context = EndpointContext.of("rt-1").withBearerToken("tok");

    assertThat(remote.sum(context, 2, 3)).isEqualTo(5);
    assertThat(remote.concat(context, "foo", "bar")).isEqualTo("foobar");
  }

  @Test
  @DisplayName("토큰 없이 호출하면 원격 401이 RemoteServiceException으로 복원된다")
  void missingTokenSurfacesAsRemote401() {
    assertThatThrownBy(() -> remote.sum(EndpointContext.empty(), 1, 2))
        .isInstanceOfSatisfying(
            RemoteServiceException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(401);
              assertThat(e.getMessage()).isEqualTo("token up for parsing was not found in context");
            });
  }

  @Test
  @DisplayName("원격 도메인 에러의 구조화된 errors가 보존된다")
  void domainErrorDetailsArePreserved() {
    EndpointContext context = EndpointContext.empty().withBearerToken("tok");

    assertThatThrownBy(() -> remote.sum(context, Long.MAX_VALUE, 1))
        .isInstanceOfSatisfying(
            RemoteServiceException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(500);
              assertThat(e.getMessage()).isEqualTo("integer overflow");
              assertThat(e.getErrors()).hasSize(1);
              assertThat(e.getErrors().get(0).field()).isEqualTo("res");
            });
  }
}
