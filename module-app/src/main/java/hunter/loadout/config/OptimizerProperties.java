package hunter.loadout.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 최적화 실행 설정
 *
 * <p>요청에 제한 시간이 없으면 {@code timeLimit}을 사용하고, 요청 값은 {@code maxTimeLimit}을 넘을 수 없습니다.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

  /** 기본 solve 제한 시간 */
  private Duration timeLimit = Duration.ofSeconds(10);

  /** 요청별 제한 시간 상한 */
  private Duration maxTimeLimit = Duration.ofSeconds(60);

  /** 이 시간을 넘긴 작업은 SLOW로 기록 */
  private Duration slowThreshold = Duration.ofSeconds(2);
}
