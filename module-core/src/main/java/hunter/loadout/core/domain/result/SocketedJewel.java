package hunter.loadout.core.domain.result;

/**
 * A jewel placed into a concrete slot.
 *
 * @param ownerId id of the armor piece or weapon carrying the slot
 * @param slotIndex 0-based index into the owner's slot list
 * @param slotTier size of that slot
 * @param jewelId placed jewel
 */
public record SocketedJewel(String ownerId, int slotIndex, int slotTier, String jewelId) {}
