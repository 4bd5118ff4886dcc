package hunter.loadout.core.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog snapshot of skills, armor pieces, charms, weapons and jewels.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * <h3>참조 무결성 검증</h3>
 *
 * <ul>
 *   <li>skill id 중복 금지, 아이템 id는 모든 아이템 종류에 걸쳐 유일
 *   <li>모든 SkillGrant는 카탈로그에 존재하는 스킬을 참조
 *   <li>방어구 한 부위는 GROUP 스킬 부여를 최대 1개만 가진다
 * </ul>
 *
 * <p>Iteration order of every collection is the order given at construction; the optimizer uses
 * it for deterministic model building and jewel decoding.
 */
public final class Catalog {

  private final List<Skill> skills;
  private final List<EquipmentPiece> pieces;
  private final List<Charm> charms;
  private final List<Weapon> weapons;
  private final List<Jewel> jewels;

  private final Map<String, Skill> skillsById;
  private final Map<BodySlot, List<EquipmentPiece>> piecesBySlot;

  public Catalog(
      List<Skill> skills,
      List<EquipmentPiece> pieces,
      List<Charm> charms,
      List<Weapon> weapons,
      List<Jewel> jewels) {
    this.skills = copy(skills);
    this.pieces = copy(pieces);
    this.charms = copy(charms);
    this.weapons = copy(weapons);
    this.jewels = copy(jewels);

    this.skillsById = indexSkills(this.skills);
    this.piecesBySlot = groupBySlot(this.pieces);
    validateItemIds();
    validateGrants();
  }

  public List<Skill> skills() {
    return skills;
  }

  public List<EquipmentPiece> pieces() {
    return pieces;
  }

  public List<Charm> charms() {
    return charms;
  }

  public List<Weapon> weapons() {
    return weapons;
  }

  public List<Jewel> jewels() {
    return jewels;
  }

  public Optional<Skill> findSkill(String skillId) {
    return Optional.ofNullable(skillsById.get(skillId));
  }

  /** Pieces of a body slot in catalog order (empty list if none). */
  public List<EquipmentPiece> piecesFor(BodySlot bodySlot) {
    return piecesBySlot.getOrDefault(bodySlot, List.of());
  }

  private static <T> List<T> copy(List<T> source) {
    return source == null ? List.of() : List.copyOf(source);
  }

  private static Map<String, Skill> indexSkills(List<Skill> skills) {
    Map<String, Skill> index = new LinkedHashMap<>();
    for (Skill skill : skills) {
      if (index.put(skill.id(), skill) != null) {
        throw new IllegalArgumentException("duplicate skill id: " + skill.id());
      }
    }
    return Collections.unmodifiableMap(index);
  }

  private static Map<BodySlot, List<EquipmentPiece>> groupBySlot(List<EquipmentPiece> pieces) {
    Map<BodySlot, List<EquipmentPiece>> grouped = new EnumMap<>(BodySlot.class);
    for (EquipmentPiece piece : pieces) {
      grouped.computeIfAbsent(piece.bodySlot(), k -> new ArrayList<>()).add(piece);
    }
    grouped.replaceAll((slot, list) -> List.copyOf(list));
    return Collections.unmodifiableMap(grouped);
  }

  private void validateItemIds() {
    Set<String> seen = new HashSet<>();
    List<SkillSource> items = new ArrayList<>(pieces);
    items.addAll(charms);
    items.addAll(weapons);
    items.addAll(jewels);
    for (SkillSource item : items) {
      if (!seen.add(item.id())) {
        throw new IllegalArgumentException("duplicate item id: " + item.id());
      }
    }
  }

  private void validateGrants() {
    List<SkillSource> sources = new ArrayList<>(pieces);
    sources.addAll(charms);
    sources.addAll(weapons);
    sources.addAll(jewels);
    for (SkillSource source : sources) {
      for (SkillGrant grant : source.skills()) {
        if (!skillsById.containsKey(grant.skillId())) {
          throw new IllegalArgumentException(
              "item " + source.id() + " references unknown skill: " + grant.skillId());
        }
      }
    }
    for (EquipmentPiece piece : pieces) {
      long groupGrants =
          piece.skills().stream()
              .filter(grant -> skillsById.get(grant.skillId()).kind() == SkillKind.GROUP)
              .count();
      if (groupGrants > 1) {
        throw new IllegalArgumentException(
            "piece " + piece.id() + " grants more than one group skill: " + groupGrants);
      }
    }
  }
}
