package addsvc.gateway.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "add.service")
public class AddServiceProperties {

  /** concat 결과 최대 길이 */
  @Min(0)
  private int maxConcatLength = 1024;
}
