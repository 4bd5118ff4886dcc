package hunter.loadout.core.domain.result;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Weapon;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded optimization result.
 *
 * @param pieces one piece per body slot
 * @param charm selected charm, or null when none is equipped
 * @param weapon selected weapon
 * @param jewels jewels with their concrete slots
 * @param requestedLevels effective (in-game) level per requested skill, in request order. A level
 *     cap only bounds what the primary score rewards, not the reported level
 * @param bonusLevels effective level of every other active skill
 * @param freeSlots free slot count per tier (3, 2, 1), over all pools
 * @param score achieved objective terms
 * @param status OPTIMAL or FEASIBLE
 */
public record Loadout(
    Map<BodySlot, EquipmentPiece> pieces,
    Charm charm,
    Weapon weapon,
    List<SocketedJewel> jewels,
    Map<String, Integer> requestedLevels,
    Map<String, Integer> bonusLevels,
    Map<Integer, Integer> freeSlots,
    ObjectiveScore score,
    SolveStatus status) {

  public Loadout {
    Map<BodySlot, EquipmentPiece> bySlot = new EnumMap<>(BodySlot.class);
    bySlot.putAll(pieces);
    pieces = Collections.unmodifiableMap(bySlot);
    jewels = List.copyOf(jewels);
    requestedLevels = Collections.unmodifiableMap(new LinkedHashMap<>(requestedLevels));
    bonusLevels = Collections.unmodifiableMap(new LinkedHashMap<>(bonusLevels));
    freeSlots = Collections.unmodifiableMap(new LinkedHashMap<>(freeSlots));
  }

  public Optional<Charm> findCharm() {
    return Optional.ofNullable(charm);
  }

  public int requestedLevel(String skillId) {
    return requestedLevels.getOrDefault(skillId, 0);
  }

  public int freeSlots(int tier) {
    return freeSlots.getOrDefault(tier, 0);
  }

  public boolean isOptimal() {
    return status == SolveStatus.OPTIMAL;
  }
}
