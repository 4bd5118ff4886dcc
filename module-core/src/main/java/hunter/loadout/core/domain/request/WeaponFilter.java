package hunter.loadout.core.domain.request;

import hunter.loadout.core.domain.model.Weapon;

/**
 * 무기 후보 필터. 지정된 조건을 모두 만족하는 무기만 선택 후보가 됩니다.
 *
 * @param weaponId 특정 무기 ID (null = 제한 없음)
 * @param weaponClass 무기 종류 (null = 제한 없음)
 */
public record WeaponFilter(String weaponId, String weaponClass) {

  private static final WeaponFilter ANY = new WeaponFilter(null, null);

  public WeaponFilter {
    weaponId = blankToNull(weaponId);
    weaponClass = blankToNull(weaponClass);
  }

  public static WeaponFilter any() {
    return ANY;
  }

  public static WeaponFilter byId(String weaponId) {
    return new WeaponFilter(weaponId, null);
  }

  public static WeaponFilter byClass(String weaponClass) {
    return new WeaponFilter(null, weaponClass);
  }

  public boolean matches(Weapon weapon) {
    if (weaponId != null && !weaponId.equals(weapon.id())) {
      return false;
    }
    return weaponClass == null || weaponClass.equalsIgnoreCase(weapon.weaponClass());
  }

  private static String blankToNull(String value) {
    return (value == null || value.isBlank()) ? null : value;
  }
}
