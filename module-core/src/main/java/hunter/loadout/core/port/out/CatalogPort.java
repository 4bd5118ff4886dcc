package hunter.loadout.core.port.out;

import hunter.loadout.core.domain.model.Catalog;

/**
 * Port for loading the catalog snapshot.
 *
 * <p>Implemented by module-infra adapters (e.g., JSON document reader).
 *
 * <p>The optimizer only reads the returned {@link Catalog}; fetching, caching and refreshing the
 * data stay outside the core.
 */
public interface CatalogPort {

  /**
   * Load the catalog snapshot.
   *
   * @return immutable catalog
   * @throws hunter.loadout.error.exception.CatalogLoadException if the source is unreadable or
   *     malformed
   */
  Catalog load();
}
