package hunter.loadout.controller;

import hunter.loadout.application.service.LoadoutApplicationService;
import hunter.loadout.controller.dto.LoadoutResponse;
import hunter.loadout.controller.dto.OptimizeLoadoutRequest;
import hunter.loadout.core.domain.result.Loadout;
import hunter.loadout.global.response.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 장비 조합 최적화 API
 *
 * <ul>
 *   <li>POST /api/v1/loadouts/optimize - 요청 스킬 기준 최적 조합 계산
 * </ul>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/loadouts")
public class LoadoutController {

  private final LoadoutApplicationService loadoutService;

  @PostMapping("/optimize")
  public ResponseEntity<ApiResponse<LoadoutResponse>> optimize(
      @Valid @RequestBody OptimizeLoadoutRequest request) {
    log.debug("[Loadout] optimize requested: {}", request);
    Loadout loadout = loadoutService.optimize(request.toDomain());
    return ResponseEntity.ok(ApiResponse.success(LoadoutResponse.from(loadout)));
  }
}
