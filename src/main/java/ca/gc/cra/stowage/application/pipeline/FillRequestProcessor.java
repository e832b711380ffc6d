package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.application.port.MetricsPort;
import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.inventory.Inventory;
import ca.gc.cra.stowage.domain.inventory.ItemStack;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fills every inventory declared in a classified request stream.
 * <p><strong>Why:</strong> Ties segmentation, allocation, resolution, capacity enforcement, and auditing into the
 * single deterministic pass that the report is built from.</p>
 * <p><strong>Role:</strong> Application-layer orchestrator invoked by {@link FillUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run {@link RequestSegmenter} and {@link InventoryAllocator} over the same input.</li>
 *   <li>Drop the preamble segment, then pair segments with inventories element-wise, truncating to the shorter
 *   list.</li>
 *   <li>Resolve and store stacks one at a time so each audit entry reflects the occupancy at decision time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each call owns the inventories it creates.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code inventory} (1-based) while a segment is processed; emits
 * {@code fill.inventory.created}, {@code fill.stack.unresolved}, and {@code fill.inventory.occupancy}.</p>
 *
 * @since 0.1.0
 */
public final class FillRequestProcessor {
  private static final Logger log = LoggerFactory.getLogger(FillRequestProcessor.class);
  static final String MDC_INVENTORY = "inventory";

  private final RequestSegmenter segmenter;
  private final InventoryAllocator allocator;
  private final StackResolver resolver;
  private final UnresolvedPolicy unresolvedPolicy;
  private final MetricsPort metrics;

  /**
   * Creates a processor with explicit collaborators.
   *
   * @param segmenter request segmenter; must not be {@code null}
   * @param allocator inventory allocator; must not be {@code null}
   * @param resolver stack resolver; must not be {@code null}
   * @param unresolvedPolicy treatment of unknown item identifiers; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public FillRequestProcessor(
      RequestSegmenter segmenter,
      InventoryAllocator allocator,
      StackResolver resolver,
      UnresolvedPolicy unresolvedPolicy,
      MetricsPort metrics) {
    this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.unresolvedPolicy = Objects.requireNonNull(unresolvedPolicy, "unresolvedPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Processes all inventory requests.
   *
   * @param lines classified request lines in input order; must not be {@code null}
   * @param catalog item catalog; must not be {@code null}
   * @return one entry per inventory marker, in marker order
   */
  public List<LoggedInventory> process(List<ClassifiedLine> lines, Catalog catalog) {
    Objects.requireNonNull(lines, "lines");
    Objects.requireNonNull(catalog, "catalog");

    List<List<ClassifiedLine>> segments = segmenter.split(lines);
    List<Inventory> inventories = allocator.allocate(lines);
    List<List<ClassifiedLine>> requestGroups = segments.subList(1, segments.size());
    int pairs = Math.min(inventories.size(), requestGroups.size());
    if (log.isDebugEnabled()) {
      log.debug("Discarding preamble of {} lines; pairing {} inventories with {} request groups",
          segments.get(0).size(), inventories.size(), requestGroups.size());
    }

    List<LoggedInventory> results = new ArrayList<>(pairs);
    for (int i = 0; i < pairs; i++) {
      MDC.put(MDC_INVENTORY, Integer.toString(i + 1));
      try {
        results.add(fill(inventories.get(i), requestGroups.get(i), catalog));
      } finally {
        MDC.remove(MDC_INVENTORY);
      }
    }
    return List.copyOf(results);
  }

  private LoggedInventory fill(Inventory inventory, List<ClassifiedLine> segment, Catalog catalog) {
    metrics.increment("fill.inventory.created");
    AuditLogger audit = new AuditLogger(inventory, metrics);
    for (ClassifiedLine.StackRequest request : StackResolver.requests(segment)) {
      Optional<ItemStack> stack = resolver.resolve(catalog, request);
      if (stack.isPresent()) {
        audit.store(stack.get());
        continue;
      }
      metrics.increment("fill.stack.unresolved");
      log.debug("No catalog item with id {}; request for {} skipped", request.itemId(), request.quantity());
      if (unresolvedPolicy == UnresolvedPolicy.REPORT) {
        audit.unresolved(request);
      }
    }
    metrics.observe("fill.inventory.occupancy", inventory.occupied());
    log.debug("Inventory filled to {} of {}", inventory.occupied(), inventory.maxSize());
    return new LoggedInventory(audit.entries(), inventory);
  }
}
