package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.JewelKind;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.SkillGrant;
import hunter.loadout.core.domain.model.Weapon;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** 테스트용 소형 카탈로그 빌더. 비어 있는 부위에는 스킬/슬롯 없는 기본 방어구, 무기가 없으면 기본 무기를 채웁니다. */
final class CatalogFixture {

  private final List<Skill> skills = new ArrayList<>();
  private final List<EquipmentPiece> pieces = new ArrayList<>();
  private final List<Charm> charms = new ArrayList<>();
  private final List<Weapon> weapons = new ArrayList<>();
  private final List<Jewel> jewels = new ArrayList<>();

  static CatalogFixture create() {
    return new CatalogFixture();
  }

  CatalogFixture skill(Skill skill) {
    skills.add(skill);
    return this;
  }

  CatalogFixture piece(String id, BodySlot bodySlot, List<Integer> slots, SkillGrant... grants) {
    pieces.add(new EquipmentPiece(id, id, bodySlot, List.of(grants), slots));
    return this;
  }

  CatalogFixture charm(String id, SkillGrant... grants) {
    charms.add(new Charm(id, id, List.of(grants)));
    return this;
  }

  CatalogFixture weapon(String id, String weaponClass, List<Integer> slots, SkillGrant... grants) {
    weapons.add(new Weapon(id, id, weaponClass, List.of(grants), slots));
    return this;
  }

  CatalogFixture jewel(String id, int size, JewelKind kind, SkillGrant... grants) {
    jewels.add(new Jewel(id, id, size, kind, List.of(grants)));
    return this;
  }

  Catalog build() {
    List<EquipmentPiece> allPieces = new ArrayList<>(pieces);
    Set<BodySlot> covered = EnumSet.noneOf(BodySlot.class);
    pieces.forEach(piece -> covered.add(piece.bodySlot()));
    for (BodySlot bodySlot : BodySlot.values()) {
      if (!covered.contains(bodySlot)) {
        String id = "bare-" + bodySlot.name().toLowerCase();
        allPieces.add(new EquipmentPiece(id, id, bodySlot, List.of(), List.of()));
      }
    }
    List<Weapon> allWeapons = new ArrayList<>(weapons);
    if (allWeapons.isEmpty()) {
      allWeapons.add(new Weapon("bare-sword", "bare-sword", "sword", List.of(), List.of()));
    }
    return new Catalog(skills, allPieces, charms, allWeapons, jewels);
  }

  static SkillGrant grant(String skillId, int points) {
    return SkillGrant.of(skillId, points);
  }
}
