package ca.gc.cra.stowage.config;

import ca.gc.cra.stowage.application.pipeline.FillRequestProcessor;
import ca.gc.cra.stowage.application.pipeline.FillUseCase;
import ca.gc.cra.stowage.application.pipeline.InventoryAllocator;
import ca.gc.cra.stowage.application.pipeline.RequestSegmenter;
import ca.gc.cra.stowage.application.pipeline.StackResolver;
import ca.gc.cra.stowage.application.port.CatalogSource;
import ca.gc.cra.stowage.application.port.MetricsPort;
import ca.gc.cra.stowage.infrastructure.report.TextReportRenderer;
import ca.gc.cra.stowage.infrastructure.text.CatalogFileReader;
import ca.gc.cra.stowage.infrastructure.text.RequestFileReader;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires Stowage use cases to concrete adapters.
 * <p><strong>Why:</strong> Translates configuration into runnable pipelines in one place so CLIs and tests share
 * the same graph.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create text-file readers for the catalog and the inventory requests.</li>
 *   <li>Build the fill processor with the configured size and unresolved-item policies.</li>
 *   <li>Expose the report renderer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods allocate new graphs on each call.</p>
 *
 * @since 0.1.0
 * @see FillUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;

  /**
   * Creates a composition root reporting to the supplied metrics port.
   *
   * @param metrics metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the fill use case for a configuration.
   *
   * @param config fill configuration; must not be {@code null}
   * @return use case reading both input files and filling every inventory
   */
  public FillUseCase fillUseCase(FillConfig config) {
    Objects.requireNonNull(config, "config");
    FillRequestProcessor processor = new FillRequestProcessor(
        new RequestSegmenter(),
        new InventoryAllocator(),
        new StackResolver(config.stackSizePolicy()),
        config.unresolvedPolicy(),
        metrics);
    return new FillUseCase(
        catalogSource(config.itemsFile()), new RequestFileReader(config.inventoriesFile()), processor);
  }

  /**
   * Creates a catalog source for the given file.
   *
   * @param itemsFile item catalog file; must not be {@code null}
   * @return text catalog reader
   */
  public CatalogSource catalogSource(Path itemsFile) {
    return new CatalogFileReader(itemsFile);
  }

  /**
   * Returns the renderer used for report output.
   *
   * @return text report renderer
   */
  public TextReportRenderer reportRenderer() {
    return new TextReportRenderer();
  }
}
