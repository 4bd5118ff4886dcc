package hunter.loadout.core.domain.model;

import java.util.List;

/**
 * Charm. No slots, no body-slot category, mutually exclusive with every other charm.
 *
 * @param id unique item identifier
 * @param name display name
 * @param skills skill grants
 */
public record Charm(String id, String name, List<SkillGrant> skills) implements SkillSource {

  public Charm {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("charm id cannot be null or blank");
    }
    name = (name == null || name.isBlank()) ? id : name;
    skills = SlottedItem.copyGrants(skills);
  }
}
