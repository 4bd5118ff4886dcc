package hunter.loadout.application.service;

import hunter.loadout.controller.dto.CatalogSummaryResponse;
import hunter.loadout.core.domain.model.Catalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** 로딩된 카탈로그 스냅샷 조회 */
@Service
@RequiredArgsConstructor
public class CatalogQueryService {

  private final Catalog catalog;

  public CatalogSummaryResponse summarize() {
    return CatalogSummaryResponse.from(catalog);
  }
}
