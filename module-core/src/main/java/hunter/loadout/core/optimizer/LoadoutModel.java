package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Weapon;
import hunter.loadout.core.domain.request.OptimizationRequest;
import java.util.Map;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * 요청 단위 제약 모델과 디코딩에 필요한 변수 핸들.
 *
 * <p>요청마다 새로 만들어지며 요청 사이에 공유되지 않습니다.
 *
 * @param model Choco 모델
 * @param catalog 모델을 만든 카탈로그
 * @param request 모델을 만든 요청
 * @param pieces 방어구 선택 변수 (카탈로그 순서)
 * @param charms 호석 선택 변수
 * @param weapons 필터를 통과한 무기 선택 변수
 * @param effectiveLevels 모든 스킬의 유효 레벨 (카탈로그 순서)
 * @param cappedLevels 요청 스킬의 상한 적용 레벨 (요청 순서, 1순위 목적 항 전용)
 * @param jewels 장식주 배치 변수
 */
record LoadoutModel(
    Model model,
    Catalog catalog,
    OptimizationRequest request,
    Map<EquipmentPiece, BoolVar> pieces,
    Map<Charm, BoolVar> charms,
    Map<Weapon, BoolVar> weapons,
    Map<String, IntVar> effectiveLevels,
    Map<String, IntVar> cappedLevels,
    JewelAllocation jewels) {}
