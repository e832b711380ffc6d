package ca.gc.cra.stowage.application.port;

import ca.gc.cra.stowage.domain.catalog.Catalog;
import java.io.IOException;

/**
 * Supplies the fully materialized item catalog before a fill run starts.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CatalogSource {
  /**
   * Loads every catalog entry in source order.
   *
   * @return catalog; never {@code null}
   * @throws IOException if the backing data cannot be read or is malformed
   */
  Catalog load() throws IOException;
}
