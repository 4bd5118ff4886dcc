package hunter.loadout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.optimizer.LoadoutOptimizer;
import hunter.loadout.core.port.out.CatalogPort;
import hunter.loadout.infrastructure.catalog.CatalogDocumentMapper;
import hunter.loadout.infrastructure.catalog.JsonCatalogAdapter;
import hunter.loadout.infrastructure.executor.LogicExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * 최적화 엔진과 카탈로그 빈 구성
 *
 * <p>카탈로그는 기동 시 한 번 로딩되며, 로딩 실패는 기동 실패로 이어집니다.
 */
@Configuration
public class OptimizerConfig {

  @Bean
  public LoadoutOptimizer loadoutOptimizer() {
    return new LoadoutOptimizer();
  }

  @Bean
  public CatalogDocumentMapper catalogDocumentMapper() {
    return new CatalogDocumentMapper();
  }

  @Bean
  public CatalogPort catalogPort(
      ResourceLoader resourceLoader,
      CatalogProperties properties,
      ObjectMapper objectMapper,
      CatalogDocumentMapper catalogDocumentMapper,
      LogicExecutor logicExecutor) {
    return new JsonCatalogAdapter(
        resourceLoader.getResource(properties.getLocation()),
        objectMapper,
        catalogDocumentMapper,
        logicExecutor);
  }

  @Bean
  public Catalog catalog(CatalogPort catalogPort) {
    return catalogPort.load();
  }
}
