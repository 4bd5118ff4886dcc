package hunter.loadout.infrastructure.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.GroupSkill;
import hunter.loadout.core.domain.model.JewelKind;
import hunter.loadout.core.domain.model.SeriesSkill;
import hunter.loadout.core.domain.model.SkillKind;
import hunter.loadout.error.exception.CatalogLoadException;
import hunter.loadout.infrastructure.executor.DefaultLogicExecutor;
import hunter.loadout.infrastructure.executor.LogicExecutor;
import hunter.loadout.infrastructure.executor.policy.LoggingPolicy;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

@DisplayName("JSON 카탈로그 어댑터")
class JsonCatalogAdapterTest {

  private final LogicExecutor executor =
      new DefaultLogicExecutor(
          ExceptionTranslator.defaultTranslator(), new LoggingPolicy(Duration.ofSeconds(1)));

  private JsonCatalogAdapter adapter(Resource resource) {
    return new JsonCatalogAdapter(
        resource, new ObjectMapper(), new CatalogDocumentMapper(), executor);
  }

  private static Resource json(String content) {
    return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8), "inline catalog");
  }

  @Test
  @DisplayName("문서 레이아웃을 도메인 카탈로그로 변환한다")
  void parsesDocumentLayout() {
    Catalog catalog = adapter(new ClassPathResource("catalog/test-catalog.json")).load();

    assertThat(catalog.skills())
        .extracting(s -> s.kind())
        .containsExactly(SkillKind.STANDARD, SkillKind.GROUP, SkillKind.SERIES);
    assertThat(((GroupSkill) catalog.skills().get(1)).threshold()).isEqualTo(2);
    assertThat(((SeriesSkill) catalog.skills().get(2)).steps()).hasSize(2);

    assertThat(catalog.piecesFor(BodySlot.HEAD)).hasSize(1);
    assertThat(catalog.piecesFor(BodySlot.HEAD).get(0).slots()).containsExactly(3, 1);
    assertThat(catalog.piecesFor(BodySlot.HEAD).get(0).pointsFor("guardian-set")).isEqualTo(1);
    assertThat(catalog.piecesFor(BodySlot.WAIST).get(0).slots()).isEmpty();
    assertThat(catalog.charms()).hasSize(1);
    assertThat(catalog.weapons().get(0).weaponClass()).isEqualTo("great-sword");
    assertThat(catalog.jewels())
        .extracting(j -> j.kind())
        .containsExactly(JewelKind.ARMOR, JewelKind.WEAPON);
  }

  @Nested
  @DisplayName("잘못된 문서는 CatalogLoadException")
  class Failures {

    @Test
    void malformedJson() {
      assertThatThrownBy(() -> adapter(json("{ \"skills\": [ ")).load())
          .isInstanceOf(CatalogLoadException.class)
          .hasMessageContaining("inline catalog");
    }

    @Test
    void danglingSkillReference() {
      String content =
          "{\"skills\": [], \"charms\": [{\"id\": \"c\", \"skills\": {\"ghost\": 1}}]}";

      assertThatThrownBy(() -> adapter(json(content)).load())
          .isInstanceOf(CatalogLoadException.class)
          .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownBodySlot() {
      String content = "{\"pieces\": [{\"id\": \"p\", \"bodySlot\": \"TAIL\"}]}";

      assertThatThrownBy(() -> adapter(json(content)).load())
          .isInstanceOf(CatalogLoadException.class)
          .hasRootCauseMessage("No enum constant hunter.loadout.core.domain.model.BodySlot.TAIL");
    }

    @Test
    void missingResource() {
      assertThatThrownBy(() -> adapter(new ClassPathResource("catalog/absent.json")).load())
          .isInstanceOf(CatalogLoadException.class);
    }
  }
}
