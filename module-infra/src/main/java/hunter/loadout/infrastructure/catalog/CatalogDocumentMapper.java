package hunter.loadout.infrastructure.catalog;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.GroupSkill;
import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.JewelKind;
import hunter.loadout.core.domain.model.SeriesSkill;
import hunter.loadout.core.domain.model.SeriesStep;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.SkillGrant;
import hunter.loadout.core.domain.model.SkillKind;
import hunter.loadout.core.domain.model.StandardSkill;
import hunter.loadout.core.domain.model.Weapon;
import hunter.loadout.infrastructure.catalog.dto.CatalogDocument;
import hunter.loadout.infrastructure.catalog.dto.CatalogDocument.SkillEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link CatalogDocument} → {@link Catalog} 변환기
 *
 * <p>형식 오류(알 수 없는 enum 값, 누락된 필수 필드)는 IllegalArgumentException으로 보고합니다.
 */
public class CatalogDocumentMapper {

  public Catalog toCatalog(CatalogDocument document) {
    List<Skill> skills = orEmpty(document.getSkills()).stream().map(this::toSkill).toList();
    List<EquipmentPiece> pieces =
        orEmpty(document.getPieces()).stream()
            .map(
                p ->
                    new EquipmentPiece(
                        p.getId(),
                        p.getName(),
                        parse(BodySlot.class, p.getBodySlot(), "bodySlot", p.getId()),
                        grants(p.getSkills()),
                        p.getSlots()))
            .toList();
    List<Charm> charms =
        orEmpty(document.getCharms()).stream()
            .map(c -> new Charm(c.getId(), c.getName(), grants(c.getSkills())))
            .toList();
    List<Weapon> weapons =
        orEmpty(document.getWeapons()).stream()
            .map(
                w ->
                    new Weapon(
                        w.getId(),
                        w.getName(),
                        w.getWeaponClass(),
                        grants(w.getSkills()),
                        w.getSlots()))
            .toList();
    List<Jewel> jewels =
        orEmpty(document.getJewels()).stream()
            .map(
                j ->
                    new Jewel(
                        j.getId(),
                        j.getName(),
                        j.getSize(),
                        j.getKind() == null
                            ? JewelKind.ARMOR
                            : parse(JewelKind.class, j.getKind(), "kind", j.getId()),
                        grants(j.getSkills())))
            .toList();
    return new Catalog(skills, pieces, charms, weapons, jewels);
  }

  private Skill toSkill(SkillEntry entry) {
    SkillKind kind = parse(SkillKind.class, entry.getKind(), "kind", entry.getId());
    switch (kind) {
      case GROUP:
        if (entry.getThreshold() == null) {
          throw new IllegalArgumentException("group skill needs a threshold: " + entry.getId());
        }
        return new GroupSkill(
            entry.getId(), entry.getName(), entry.getMaxLevel(), entry.getThreshold());
      case SERIES:
        List<SeriesStep> steps = new ArrayList<>();
        if (entry.getSteps() != null) {
          entry.getSteps().forEach(s -> steps.add(new SeriesStep(s.getThreshold(), s.getLevel())));
        }
        return new SeriesSkill(entry.getId(), entry.getName(), entry.getMaxLevel(), steps);
      default:
        return new StandardSkill(entry.getId(), entry.getName(), entry.getMaxLevel());
    }
  }

  private static List<SkillGrant> grants(Map<String, Integer> skills) {
    if (skills == null) {
      return List.of();
    }
    List<SkillGrant> grants = new ArrayList<>();
    skills.forEach(
        (skillId, points) -> {
          if (points == null) {
            throw new IllegalArgumentException("missing points for skill: " + skillId);
          }
          grants.add(SkillGrant.of(skillId, points));
        });
    return grants;
  }

  private static <T> List<T> orEmpty(List<T> entries) {
    return entries == null ? List.of() : entries;
  }

  private static <E extends Enum<E>> E parse(
      Class<E> type, String value, String field, String owner) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required (" + owner + ")");
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "unknown " + field + " '" + value + "' (" + owner + ")", e);
    }
  }
}
