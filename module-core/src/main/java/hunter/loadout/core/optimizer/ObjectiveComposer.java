package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.SlotPool;
import hunter.loadout.core.domain.model.SlotTier;
import hunter.loadout.core.domain.request.SkillRequest;
import java.util.List;
import java.util.Map;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.IntVar;

/**
 * 우선순위가 엄격히 구분된 세 목적 항을 조합합니다.
 *
 * <ol>
 *   <li>Primary: Σ 요청 스킬 (weight × 상한 적용 레벨)
 *   <li>Secondary: Σ 티어 (티어 가중치 × 빈 슬롯 수). w1 = 1, w2 = maxFree1 + 1, w3 = w2 × (maxFree2 + 1)
 *   <li>Tertiary: Σ 모든 스킬 유효 레벨
 * </ol>
 *
 * <p>스케일은 카탈로그의 실제 상한에서 유도합니다: S_secondary = maxTertiary + 1, S_primary = (maxSecondary + 1) ×
 * S_secondary. 결합된 상한이 {@code scalarLimit} 이하이면 단일 스칼라 목적 함수를, 아니면 세 항을 사전식(lexicographic)
 * 단계로 반환합니다. 어느 쪽이든 우선순위는 동일합니다.
 */
public class ObjectiveComposer {

  private final long scalarLimit;

  public ObjectiveComposer() {
    this(IntVar.MAX_INT_BOUND);
  }

  /**
   * @param scalarLimit 단일 스칼라 목적 함수가 가질 수 있는 최대 상한
   */
  public ObjectiveComposer(long scalarLimit) {
    if (scalarLimit < 0 || scalarLimit > IntVar.MAX_INT_BOUND) {
      throw new IllegalArgumentException(
          "scalarLimit must be within 0.." + IntVar.MAX_INT_BOUND + ", got: " + scalarLimit);
    }
    this.scalarLimit = scalarLimit;
  }

  ObjectivePlan compose(LoadoutModel loadoutModel) {
    Model model = loadoutModel.model();

    ConditionalSum primaryTerm = new ConditionalSum();
    for (SkillRequest request : loadoutModel.request().skills()) {
      primaryTerm.add(request.weight(), loadoutModel.cappedLevels().get(request.skillId()));
    }

    JewelAllocation jewels = loadoutModel.jewels();
    long[] tierWeights = tierWeights(jewels);
    ConditionalSum secondaryTerm = new ConditionalSum();
    for (SlotPool pool : SlotPool.values()) {
      for (Map.Entry<Integer, IntVar> free : jewels.free().get(pool).entrySet()) {
        secondaryTerm.add(Math.toIntExact(tierWeights[free.getKey()]), free.getValue());
      }
    }

    ConditionalSum tertiaryTerm = new ConditionalSum();
    for (IntVar level : loadoutModel.effectiveLevels().values()) {
      tertiaryTerm.add(1, level);
    }

    IntVar primary = primaryTerm.post(model, "obj_primary");
    IntVar secondary = secondaryTerm.post(model, "obj_secondary");
    IntVar tertiary = tertiaryTerm.post(model, "obj_tertiary");

    long secondaryScale = tertiary.getUB() + 1L;
    long primaryScale = (secondary.getUB() + 1L) * secondaryScale;
    long combined =
        primary.getUB() * primaryScale + secondary.getUB() * secondaryScale + tertiary.getUB();

    List<IntVar> stages;
    if (combined <= scalarLimit && primaryScale <= scalarLimit) {
      IntVar scalar =
          new ConditionalSum()
              .add((int) primaryScale, primary)
              .add((int) secondaryScale, secondary)
              .add(1, tertiary)
              .post(model, "obj_scalar");
      stages = List.of(scalar);
    } else {
      stages = List.of(primary, secondary, tertiary);
    }
    return new ObjectivePlan(
        primary, secondary, tertiary, stages, tierWeights, secondaryScale, primaryScale);
  }

  /** 한 단계 위 티어의 빈 슬롯 하나가 아래 티어 빈 슬롯의 어떤 조합보다 크도록 가중치를 정합니다. */
  static long[] tierWeights(JewelAllocation jewels) {
    long[] weights = new long[SlotTier.MAX + 1];
    weights[SlotTier.MIN] = 1;
    for (int tier = SlotTier.MIN + 1; tier <= SlotTier.MAX; tier++) {
      weights[tier] = weights[tier - 1] * (jewels.maxFree(tier - 1) + 1L);
    }
    return weights;
  }
}
