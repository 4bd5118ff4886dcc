package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.request.OptimizationRequest;
import hunter.loadout.core.domain.result.Loadout;
import hunter.loadout.error.exception.SolverInternalException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * 장비 조합 최적화 퍼사드
 *
 * <p>요청 하나에 대해 모델 구성 → 목적 함수 조합 → solve → 디코딩을 수행합니다. 카탈로그는 읽기 전용이고 모델은 요청마다 새로 만들어지므로
 * 서로 다른 요청을 동시에 실행해도 안전합니다.
 */
@Slf4j
public class LoadoutOptimizer {

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final LoadoutModelBuilder modelBuilder;
  private final ObjectiveComposer objectiveComposer;
  private final ChocoSolverAdapter solverAdapter;

  public LoadoutOptimizer() {
    this(new ObjectiveComposer());
  }

  public LoadoutOptimizer(ObjectiveComposer objectiveComposer) {
    this(
        new LoadoutModelBuilder(new SkillAggregator(), new SlotJewelAllocator()),
        objectiveComposer,
        new ChocoSolverAdapter());
  }

  public LoadoutOptimizer(
      LoadoutModelBuilder modelBuilder,
      ObjectiveComposer objectiveComposer,
      ChocoSolverAdapter solverAdapter) {
    this.modelBuilder = modelBuilder;
    this.objectiveComposer = objectiveComposer;
    this.solverAdapter = solverAdapter;
  }

  /**
   * 최적 장비 조합을 계산합니다.
   *
   * @param catalog 카탈로그 스냅샷
   * @param request 요청 스킬과 무기 필터
   * @param options 제한 시간과 취소 훅
   * @return 디코딩된 조합 (OPTIMAL 또는 FEASIBLE)
   * @throws hunter.loadout.error.exception.InvalidOptimizationRequestException 잘못된 요청
   * @throws hunter.loadout.error.exception.CatalogInconsistencyException 후보 없는 부위/무기 필터
   * @throws hunter.loadout.error.exception.SolverTimeoutException 해 없이 시간 초과
   * @throws hunter.loadout.error.exception.SolveCancelledException 취소
   * @throws hunter.loadout.error.exception.LoadoutInfeasibleException 모델 결함
   * @throws SolverInternalException 솔버 예외 또는 솔버 정수 도메인을 넘는 목적 함수 항
   */
  public Loadout optimize(Catalog catalog, OptimizationRequest request, SolveOptions options) {
    String modelName = "loadout-" + SEQUENCE.incrementAndGet();
    LoadoutModel loadoutModel;
    ObjectivePlan plan;
    try {
      loadoutModel = modelBuilder.build(catalog, request, modelName);
      plan = objectiveComposer.compose(loadoutModel);
    } catch (IllegalStateException | ArithmeticException e) {
      // 합산 항이 솔버 정수 도메인을 넘는 경우
      throw new SolverInternalException(modelName, e);
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "[Optimizer] {} built: vars={}, constraints={}, lexicographic={}, scales=({}, {})",
          modelName,
          loadoutModel.model().getNbVars(),
          loadoutModel.model().getNbCstrs(),
          plan.isLexicographic(),
          plan.primaryScale(),
          plan.secondaryScale());
    }

    SolveOutcome outcome = solverAdapter.solve(loadoutModel, plan, options);
    Loadout loadout = LoadoutDecoder.decode(loadoutModel, plan, outcome);

    log.info(
        "[Optimizer] {} solved: status={}, score={}, requested={}",
        modelName,
        loadout.status(),
        loadout.score(),
        loadout.requestedLevels());
    return loadout;
  }
}
