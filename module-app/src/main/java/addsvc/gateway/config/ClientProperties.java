package addsvc.gateway.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 원격 add 인스턴스 호출 설정 */
@Getter
@Setter
@ConfigurationProperties(prefix = "add.client")
public class ClientProperties {

  /** 호출 한 건의 최대 대기 시간. 컨텍스트 deadline이 더 짧으면 그쪽이 우선 */
  private Duration timeout = Duration.ofSeconds(10);
}
