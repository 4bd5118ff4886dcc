package hunter.loadout.application.service;

import hunter.loadout.config.OptimizerProperties;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.request.OptimizationRequest;
import hunter.loadout.core.domain.result.Loadout;
import hunter.loadout.core.optimizer.LoadoutOptimizer;
import hunter.loadout.core.optimizer.SolveOptions;
import hunter.loadout.error.exception.InvalidOptimizationRequestException;
import hunter.loadout.infrastructure.executor.LogicExecutor;
import hunter.loadout.infrastructure.executor.TaskContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장비 조합 최적화 애플리케이션 서비스
 *
 * <ul>
 *   <li>제한 시간 결정: 요청 값 → 없으면 설정 기본값, 설정 상한 초과 시 거부
 *   <li>LogicExecutor로 실행 (로깅/예외 변환)
 *   <li>메트릭: {@code loadout.optimize.requests}, {@code loadout.optimize.duration{status}}
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class LoadoutApplicationService {

  static final String REQUESTS_METRIC = "loadout.optimize.requests";
  static final String DURATION_METRIC = "loadout.optimize.duration";

  private static final String STATUS_OPTIMAL = "optimal";
  private static final String STATUS_FEASIBLE = "feasible";
  private static final String STATUS_FAILED = "failed";

  private final LoadoutOptimizer optimizer;
  private final Catalog catalog;
  private final OptimizerProperties properties;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  public Loadout optimize(OptimizationRequest request) {
    meterRegistry.counter(REQUESTS_METRIC).increment();
    SolveOptions options = SolveOptions.withTimeLimit(resolveTimeLimit(request.timeLimit()));
    TaskContext context =
        TaskContext.of("Loadout", "optimize", "skills=" + request.skills().size());

    Timer.Sample sample = Timer.start(meterRegistry);
    String status = STATUS_FAILED;
    try {
      Loadout loadout =
          executor.execute(() -> optimizer.optimize(catalog, request, options), context);
      status = loadout.isOptimal() ? STATUS_OPTIMAL : STATUS_FEASIBLE;
      return loadout;
    } finally {
      sample.stop(meterRegistry.timer(DURATION_METRIC, "status", status));
    }
  }

  Duration resolveTimeLimit(Duration requested) {
    if (requested == null) {
      return properties.getTimeLimit();
    }
    if (requested.isNegative() || requested.isZero()) {
      throw new InvalidOptimizationRequestException("timeLimit must be positive: " + requested);
    }
    if (requested.compareTo(properties.getMaxTimeLimit()) > 0) {
      throw new InvalidOptimizationRequestException(
          "timeLimit " + requested + " exceeds maximum " + properties.getMaxTimeLimit());
    }
    return requested;
  }
}
