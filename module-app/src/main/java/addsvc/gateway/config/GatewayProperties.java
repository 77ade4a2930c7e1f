package addsvc.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HTTP 게이트웨이(서버 측) 설정
 *
 * <pre>
 * add.gateway.auth.required=true
 * add.gateway.tracing.micrometer-enabled=true
 * add.gateway.tracing.opentelemetry-enabled=true
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "add.gateway")
public class GatewayProperties {

  private Auth auth = new Auth();
  private Tracing tracing = new Tracing();

  @Getter
  @Setter
  public static class Auth {
    /** true면 bearer 토큰 없는 호출은 401 */
    private boolean required = true;
  }

  @Getter
  @Setter
  public static class Tracing {
    private boolean micrometerEnabled = true;
    private boolean opentelemetryEnabled = true;
  }
}
