package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.GroupSkill;
import hunter.loadout.core.domain.model.SeriesSkill;
import hunter.loadout.core.domain.model.SeriesStep;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.StandardSkill;
import java.util.List;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * 스킬 raw 포인트를 발동 규칙에 따라 유효 레벨로 변환하는 컴포넌트
 *
 * <h3>발동 규칙</h3>
 *
 * <ul>
 *   <li><b>STANDARD</b>: effective = min(raw, max)
 *   <li><b>GROUP</b>: activated ⇔ raw ≥ threshold, activated이면 min(raw, max), 아니면 0
 *   <li><b>SERIES</b>: [0, t1), [t1, t2), ..., [tn, ∞) 구간마다 BoolVar 하나, 정확히 하나만 참. 참인 구간의 레벨이 유효
 *       레벨 (첫 구간은 0)
 * </ul>
 *
 * <p>어떤 규칙에서도 최대 레벨을 넘는 포인트는 유효 레벨을 올리지 않습니다.
 */
public class SkillAggregator {

  /**
   * 유효 레벨 변수를 생성하고 raw 변수와의 관계를 제약으로 등록합니다.
   *
   * @param model 요청 단위 Choco 모델
   * @param skill 스킬 정의
   * @param raw raw 포인트 변수 (하한 0)
   * @return 유효 레벨 변수, 도메인 [0, maxLevel]
   */
  public IntVar effectiveLevel(Model model, Skill skill, IntVar raw) {
    if (skill instanceof StandardSkill standard) {
      return standardLevel(model, standard, raw);
    }
    if (skill instanceof GroupSkill group) {
      return groupLevel(model, group, raw);
    }
    return seriesLevel(model, (SeriesSkill) skill, raw);
  }

  /**
   * 레벨 상한을 적용한 변수를 반환합니다. 상한이 도달 가능한 최대치 이상이면 원래 변수를 그대로 반환합니다.
   *
   * @param levelCap 0 이상의 레벨 상한
   */
  public IntVar capLevel(Model model, String skillId, IntVar effective, int levelCap) {
    if (levelCap >= effective.getUB()) {
      return effective;
    }
    IntVar capped = model.intVar("capped_" + skillId, 0, levelCap, true);
    model.min(capped, effective, model.intVar(levelCap)).post();
    return capped;
  }

  private IntVar standardLevel(Model model, StandardSkill skill, IntVar raw) {
    return cappedAtMax(model, "eff_" + skill.id(), raw, skill.maxLevel());
  }

  private IntVar groupLevel(Model model, GroupSkill skill, IntVar raw) {
    IntVar effective = model.intVar("eff_" + skill.id(), 0, skill.maxLevel(), true);
    IntVar saturated = cappedAtMax(model, "sat_" + skill.id(), raw, skill.maxLevel());
    BoolVar activated = model.arithm(raw, ">=", skill.threshold()).reify();

    model.ifThenElse(
        activated, model.arithm(effective, "=", saturated), model.arithm(effective, "=", 0));
    return effective;
  }

  private IntVar seriesLevel(Model model, SeriesSkill skill, IntVar raw) {
    List<SeriesStep> steps = skill.steps();
    IntVar effective = model.intVar("eff_" + skill.id(), 0, skill.maxLevel(), true);
    BoolVar[] inInterval = new BoolVar[steps.size() + 1];

    // [0, t1): 레벨 0
    inInterval[0] = model.arithm(raw, "<", steps.get(0).threshold()).reify();
    model.ifThen(inInterval[0], model.arithm(effective, "=", 0));

    for (int i = 0; i < steps.size(); i++) {
      SeriesStep step = steps.get(i);
      Constraint lower = model.arithm(raw, ">=", step.threshold());
      Constraint interval =
          (i + 1 < steps.size())
              ? model.and(lower, model.arithm(raw, "<", steps.get(i + 1).threshold()))
              : lower;
      inInterval[i + 1] = interval.reify();
      model.ifThen(inInterval[i + 1], model.arithm(effective, "=", step.level()));
    }

    model.sum(inInterval, "=", 1).post();
    return effective;
  }

  private static IntVar cappedAtMax(Model model, String name, IntVar raw, int maxLevel) {
    IntVar capped = model.intVar(name, 0, maxLevel, true);
    model.min(capped, raw, model.intVar(maxLevel)).post();
    return capped;
  }
}
