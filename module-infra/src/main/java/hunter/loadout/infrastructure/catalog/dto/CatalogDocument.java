package hunter.loadout.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 카탈로그 스냅샷 JSON 문서
 *
 * <pre>{@code
 * {
 *   "skills":  [{"id": "attack", "name": "공격", "maxLevel": 5, "kind": "STANDARD"},
 *               {"id": "set", "name": "세트", "maxLevel": 1, "kind": "GROUP", "threshold": 2},
 *               {"id": "ser", "name": "시리즈", "maxLevel": 2, "kind": "SERIES",
 *                "steps": [{"threshold": 2, "level": 1}, {"threshold": 4, "level": 2}]}],
 *   "pieces":  [{"id": "h1", "bodySlot": "HEAD", "skills": {"attack": 1}, "slots": [3, 1]}],
 *   "charms":  [{"id": "c1", "name": "...", "skills": {"attack": 2}}],
 *   "weapons": [{"id": "w1", "weaponClass": "great-sword", "skills": {}, "slots": [2]}],
 *   "jewels":  [{"id": "j1", "name": "...", "size": 1, "kind": "ARMOR", "skills": {"attack": 1}}]
 * }
 * }</pre>
 *
 * <p>구조 파싱만 담당하며, 값 검증은 도메인 엔티티 생성자와 {@code Catalog}가 수행합니다.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogDocument {
  private List<SkillEntry> skills = new ArrayList<>();
  private List<PieceEntry> pieces = new ArrayList<>();
  private List<CharmEntry> charms = new ArrayList<>();
  private List<WeaponEntry> weapons = new ArrayList<>();
  private List<JewelEntry> jewels = new ArrayList<>();

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SkillEntry {
    private String id;
    private String name;
    private int maxLevel;
    private String kind; // STANDARD | GROUP | SERIES
    private Integer threshold; // GROUP 전용
    private List<StepEntry> steps; // SERIES 전용
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class StepEntry {
    private int threshold;
    private int level;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PieceEntry {
    private String id;
    private String name;
    private String bodySlot;
    private Map<String, Integer> skills = new LinkedHashMap<>();
    private List<Integer> slots = new ArrayList<>();
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CharmEntry {
    private String id;
    private String name;
    private Map<String, Integer> skills = new LinkedHashMap<>();
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class WeaponEntry {
    private String id;
    private String name;
    private String weaponClass;
    private Map<String, Integer> skills = new LinkedHashMap<>();
    private List<Integer> slots = new ArrayList<>();
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class JewelEntry {
    private String id;
    private String name;
    private int size;
    private String kind; // ARMOR | WEAPON (기본 ARMOR)
    private Map<String, Integer> skills = new LinkedHashMap<>();
  }
}
