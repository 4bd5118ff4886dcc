package hunter.loadout.core.domain.model;

import java.util.List;

/**
 * Jewel. Unlimited supply; usage is bounded only by slot capacity.
 *
 * @param id unique jewel identifier
 * @param name display name
 * @param size jewel size (1..3)
 * @param kind slot pool the jewel may occupy
 * @param skills skill grants per unit placed
 */
public record Jewel(String id, String name, int size, JewelKind kind, List<SkillGrant> skills)
    implements SkillSource {

  public Jewel {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("jewel id cannot be null or blank");
    }
    SlotTier.requireValid(size, "jewel " + id);
    name = (name == null || name.isBlank()) ? id : name;
    kind = kind == null ? JewelKind.ARMOR : kind;
    skills = SlottedItem.copyGrants(skills);
  }

  public SlotPool pool() {
    return kind.pool();
  }
}
