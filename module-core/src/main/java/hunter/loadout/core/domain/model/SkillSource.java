package hunter.loadout.core.domain.model;

import java.util.List;

/** Anything that contributes skill points when selected or used. */
public interface SkillSource {

  String id();

  List<SkillGrant> skills();

  default int pointsFor(String skillId) {
    int total = 0;
    for (SkillGrant grant : skills()) {
      if (grant.skillId().equals(skillId)) {
        total += grant.points();
      }
    }
    return total;
  }
}
