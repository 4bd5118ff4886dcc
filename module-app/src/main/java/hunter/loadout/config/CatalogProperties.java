package hunter.loadout.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** 카탈로그 스냅샷 위치 (classpath: 또는 file:) */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

  private String location = "classpath:catalog/catalog.json";
}
