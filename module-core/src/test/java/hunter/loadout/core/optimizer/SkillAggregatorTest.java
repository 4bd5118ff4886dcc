package hunter.loadout.core.optimizer;

import static org.assertj.core.api.Assertions.assertThat;

import hunter.loadout.core.domain.model.GroupSkill;
import hunter.loadout.core.domain.model.SeriesSkill;
import hunter.loadout.core.domain.model.SeriesStep;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.StandardSkill;
import java.util.List;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.IntVar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SkillAggregator 발동 규칙")
class SkillAggregatorTest {

  private final SkillAggregator aggregator = new SkillAggregator();

  /** raw를 고정한 1-변수 모델을 풀어 유효 레벨을 반환합니다. */
  private int effectiveAt(Skill skill, int rawPoints) {
    Model model = new Model("aggregator-test");
    IntVar raw = model.intVar("raw", 0, 50);
    IntVar effective = aggregator.effectiveLevel(model, skill, raw);
    model.arithm(raw, "=", rawPoints).post();

    assertThat(model.getSolver().solve()).isTrue();
    return effective.getValue();
  }

  @Nested
  @DisplayName("STANDARD: min(raw, max)")
  class Standard {

    private final Skill attack = new StandardSkill("attack", "Attack Boost", 3);

    @ParameterizedTest(name = "raw={0} -> {1}")
    @CsvSource({"0, 0", "1, 1", "3, 3", "4, 3", "50, 3"})
    void capsAtMaxLevel(int raw, int expected) {
      assertThat(effectiveAt(attack, raw)).isEqualTo(expected);
    }
  }

  @Nested
  @DisplayName("GROUP: threshold 미만이면 0")
  class Group {

    private final Skill setBonus = new GroupSkill("set-bonus", "Set Bonus", 2, 3);

    @ParameterizedTest(name = "raw={0} -> {1}")
    @CsvSource({"0, 0", "2, 0", "3, 2", "4, 2", "20, 2"})
    void activatesAtThreshold(int raw, int expected) {
      assertThat(effectiveAt(setBonus, raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("threshold가 max보다 작으면 활성화 후 raw를 따라간다")
    void followsRawAfterActivation() {
      Skill lowThreshold = new GroupSkill("low", "Low", 5, 2);

      assertThat(effectiveAt(lowThreshold, 1)).isZero();
      assertThat(effectiveAt(lowThreshold, 2)).isEqualTo(2);
      assertThat(effectiveAt(lowThreshold, 4)).isEqualTo(4);
      assertThat(effectiveAt(lowThreshold, 9)).isEqualTo(5);
    }
  }

  @Nested
  @DisplayName("SERIES: 구간별 레벨")
  class Series {

    private final Skill series =
        new SeriesSkill(
            "series", "Series", 2, List.of(new SeriesStep(2, 1), new SeriesStep(4, 2)));

    @ParameterizedTest(name = "raw={0} -> {1}")
    @CsvSource({"0, 0", "1, 0", "2, 1", "3, 1", "4, 2", "5, 2", "30, 2"})
    void stepsAtThresholds(int raw, int expected) {
      assertThat(effectiveAt(series, raw)).isEqualTo(expected);
    }
  }

  @Nested
  @DisplayName("레벨 상한")
  class LevelCap {

    @Test
    void capLowersEffectiveLevel() {
      Model model = new Model("cap-test");
      IntVar effective = model.intVar("eff", 0, 5);
      IntVar capped = aggregator.capLevel(model, "attack", effective, 2);
      model.arithm(effective, "=", 4).post();

      assertThat(model.getSolver().solve()).isTrue();
      assertThat(capped.getValue()).isEqualTo(2);
    }

    @Test
    void capAboveReachableLevelReturnsSameVariable() {
      Model model = new Model("cap-test");
      IntVar effective = model.intVar("eff", 0, 3);

      IntVar capped = aggregator.capLevel(model, "attack", effective, 3);

      assertThat((Object) capped).isSameAs(effective);
    }
  }
}
