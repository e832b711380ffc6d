package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.application.port.CatalogSource;
import ca.gc.cra.stowage.application.port.RequestLineSource;
import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads both inputs and runs the fill pipeline over them.
 * <p><strong>Why:</strong> Keeps I/O failures ahead of processing: the core only starts once the catalog and all
 * request lines are fully materialized.</p>
 * <p><strong>Role:</strong> Application-layer use case wired by the composition root and driven by the CLI.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution.</p>
 * <p><strong>Observability:</strong> Logs input sizes and run duration at INFO.</p>
 *
 * @since 0.1.0
 */
public final class FillUseCase {
  private static final Logger log = LoggerFactory.getLogger(FillUseCase.class);

  private final CatalogSource catalogSource;
  private final RequestLineSource requestSource;
  private final FillRequestProcessor processor;

  /**
   * Creates a use case with explicit dependencies.
   *
   * @param catalogSource source of the item catalog; must not be {@code null}
   * @param requestSource source of classified request lines; must not be {@code null}
   * @param processor fill pipeline; must not be {@code null}
   */
  public FillUseCase(
      CatalogSource catalogSource, RequestLineSource requestSource, FillRequestProcessor processor) {
    this.catalogSource = Objects.requireNonNull(catalogSource, "catalogSource");
    this.requestSource = Objects.requireNonNull(requestSource, "requestSource");
    this.processor = Objects.requireNonNull(processor, "processor");
  }

  /**
   * Reads the inputs and fills every declared inventory.
   *
   * @return catalog plus per-inventory results in marker order
   * @throws IOException if either input cannot be read or parsed
   */
  public FillReport run() throws IOException {
    long start = System.nanoTime();
    Catalog catalog = catalogSource.load();
    List<ClassifiedLine> lines = requestSource.load();
    log.info("Loaded {} catalog items and {} request lines", catalog.size(), lines.size());

    List<LoggedInventory> results = processor.process(lines, catalog);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    log.info("Filled {} inventories in {} ms", results.size(), elapsedMillis);
    return new FillReport(catalog, results);
  }

  /**
   * Outcome of a fill run.
   *
   * @param catalog catalog used for resolution
   * @param inventories per-inventory audit logs and final state, in marker order
   */
  public record FillReport(Catalog catalog, List<LoggedInventory> inventories) {
    public FillReport {
      Objects.requireNonNull(catalog, "catalog");
      inventories = List.copyOf(Objects.requireNonNull(inventories, "inventories"));
    }
  }
}
