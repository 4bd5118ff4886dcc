package hunter.loadout.core.optimizer;

import static org.assertj.core.api.Assertions.assertThat;

import hunter.loadout.core.domain.model.GroupSkill;
import hunter.loadout.core.domain.model.SeriesSkill;
import hunter.loadout.core.domain.model.SeriesStep;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.StandardSkill;
import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.IntVar;

/**
 * 발동 규칙 불변식(Property-Based) 테스트
 *
 * <h3>검증하는 불변식</h3>
 *
 * <ol>
 *   <li>유효 레벨은 항상 [0, maxLevel] 범위
 *   <li>제약 모델의 결과는 규칙의 닫힌 형식과 일치
 *   <li>raw가 증가하면 유효 레벨은 감소하지 않음
 * </ol>
 */
class SkillActivationPropertyTest {

  private final SkillAggregator aggregator = new SkillAggregator();

  private int solve(Skill skill, int rawPoints) {
    Model model = new Model("property");
    IntVar raw = model.intVar("raw", 0, 60);
    IntVar effective = aggregator.effectiveLevel(model, skill, raw);
    model.arithm(raw, "=", rawPoints).post();
    assertThat(model.getSolver().solve()).isTrue();
    return effective.getValue();
  }

  @Property(tries = 200)
  void standard_matches_min_of_raw_and_max(
      @ForAll @IntRange(min = 1, max = 7) int maxLevel,
      @ForAll @IntRange(min = 0, max = 60) int raw) {
    Skill skill = new StandardSkill("std", "Standard", maxLevel);

    assertThat(solve(skill, raw)).isEqualTo(Math.min(raw, maxLevel));
  }

  @Property(tries = 200)
  void group_is_zero_below_threshold_and_standard_above(
      @ForAll @IntRange(min = 1, max = 7) int maxLevel,
      @ForAll @IntRange(min = 1, max = 10) int threshold,
      @ForAll @IntRange(min = 0, max = 60) int raw) {
    Skill skill = new GroupSkill("grp", "Group", maxLevel, threshold);
    int expected = raw < threshold ? 0 : Math.min(raw, maxLevel);

    assertThat(solve(skill, raw)).isEqualTo(expected);
  }

  @Property(tries = 200)
  void series_matches_step_lookup_and_is_monotonic(
      @ForAll @IntRange(min = 1, max = 5) int firstThreshold,
      @ForAll @IntRange(min = 1, max = 5) int gap,
      @ForAll @IntRange(min = 1, max = 3) int firstLevel,
      @ForAll @IntRange(min = 0, max = 2) int increment,
      @ForAll @IntRange(min = 0, max = 59) int raw) {
    int secondLevel = firstLevel + increment;
    SeriesSkill skill =
        new SeriesSkill(
            "ser",
            "Series",
            secondLevel,
            List.of(
                new SeriesStep(firstThreshold, firstLevel),
                new SeriesStep(firstThreshold + gap, secondLevel)));

    int level = solve(skill, raw);

    assertThat(level).isEqualTo(skill.levelAt(raw)).isBetween(0, skill.maxLevel());
    assertThat(solve(skill, raw + 1)).isGreaterThanOrEqualTo(level);
  }
}
