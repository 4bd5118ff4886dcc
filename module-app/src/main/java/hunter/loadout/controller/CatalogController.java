package hunter.loadout.controller;

import hunter.loadout.application.service.CatalogQueryService;
import hunter.loadout.controller.dto.CatalogSummaryResponse;
import hunter.loadout.global.response.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 카탈로그 조회 API */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/catalog")
public class CatalogController {

  private final CatalogQueryService catalogQueryService;

  @GetMapping("/summary")
  public ResponseEntity<ApiResponse<CatalogSummaryResponse>> summary() {
    return ResponseEntity.ok(ApiResponse.success(catalogQueryService.summarize()));
  }
}
