package hunter.loadout.infrastructure.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.port.out.CatalogPort;
import hunter.loadout.infrastructure.catalog.dto.CatalogDocument;
import hunter.loadout.infrastructure.executor.LogicExecutor;
import hunter.loadout.infrastructure.executor.TaskContext;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * JSON 문서 기반 {@link CatalogPort} 구현체
 *
 * <p>Spring {@link Resource}(classpath: 또는 file:)에서 카탈로그 문서를 읽어 도메인 {@link Catalog}로 변환합니다. I/O,
 * 파싱, 참조 무결성 오류는 모두 {@link hunter.loadout.error.exception.CatalogLoadException}으로 보고됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonCatalogAdapter implements CatalogPort {

  private final Resource resource;
  private final ObjectMapper objectMapper;
  private final CatalogDocumentMapper mapper;
  private final LogicExecutor executor;

  @Override
  public Catalog load() {
    String location = resource.getDescription();
    return executor.executeWithTranslation(
        this::readCatalog,
        ExceptionTranslator.forCatalog(location),
        TaskContext.of("Catalog", "load", location));
  }

  private Catalog readCatalog() throws IOException {
    CatalogDocument document;
    try (InputStream in = resource.getInputStream()) {
      document = objectMapper.readValue(in, CatalogDocument.class);
    }
    Catalog catalog = mapper.toCatalog(document);
    log.info(
        "[Catalog] loaded: skills={}, pieces={}, charms={}, weapons={}, jewels={}",
        catalog.skills().size(),
        catalog.pieces().size(),
        catalog.charms().size(),
        catalog.weapons().size(),
        catalog.jewels().size());
    return catalog;
  }
}
