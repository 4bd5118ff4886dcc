package hunter.loadout.controller.dto;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Weapon;
import hunter.loadout.core.domain.result.Loadout;
import hunter.loadout.core.domain.result.ObjectiveScore;
import hunter.loadout.core.domain.result.SocketedJewel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 최적화 결과 응답
 *
 * @param status OPTIMAL | FEASIBLE
 * @param pieces 부위별 방어구
 * @param charm 호석 (없으면 null)
 * @param weapon 무기
 * @param jewels 슬롯별 장식주 배치
 * @param requestedLevels 요청 스킬 레벨 (요청 순서)
 * @param bonusLevels 요청 외 활성 스킬 레벨
 * @param freeSlots 크기별 빈 슬롯 수
 * @param score 목적 함수 항목별 값
 */
public record LoadoutResponse(
    String status,
    Map<BodySlot, ItemView> pieces,
    ItemView charm,
    WeaponView weapon,
    List<SocketedJewel> jewels,
    Map<String, Integer> requestedLevels,
    Map<String, Integer> bonusLevels,
    Map<Integer, Integer> freeSlots,
    ObjectiveScore score) {

  public record ItemView(String id, String name) {

    static ItemView of(EquipmentPiece piece) {
      return new ItemView(piece.id(), piece.name());
    }

    static ItemView of(Charm charm) {
      return new ItemView(charm.id(), charm.name());
    }
  }

  public record WeaponView(String id, String name, String weaponClass) {

    static WeaponView of(Weapon weapon) {
      return new WeaponView(weapon.id(), weapon.name(), weapon.weaponClass());
    }
  }

  public static LoadoutResponse from(Loadout loadout) {
    Map<BodySlot, ItemView> pieces = new LinkedHashMap<>();
    loadout.pieces().forEach((slot, piece) -> pieces.put(slot, ItemView.of(piece)));
    return new LoadoutResponse(
        loadout.status().name(),
        pieces,
        loadout.findCharm().map(ItemView::of).orElse(null),
        WeaponView.of(loadout.weapon()),
        loadout.jewels(),
        loadout.requestedLevels(),
        loadout.bonusLevels(),
        loadout.freeSlots(),
        loadout.score());
  }
}
