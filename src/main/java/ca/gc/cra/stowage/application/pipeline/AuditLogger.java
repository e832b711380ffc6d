package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.application.port.MetricsPort;
import ca.gc.cra.stowage.domain.inventory.Inventory;
import ca.gc.cra.stowage.domain.inventory.ItemStack;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Records one audit entry per capacity decision for a single inventory.
 * <p><strong>Why:</strong> Operators need to see, line by line, which stacks were stored and which were discarded.</p>
 * <p><strong>Role:</strong> Pipeline stage paired with exactly one {@link Inventory}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Invoke {@link Inventory#addItems(ItemStack)} and report its verdict without second-guessing it.</li>
 *   <li>Append entries in call order so the log mirrors request order.</li>
 *   <li>Count outcomes through {@link MetricsPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per inventory.</p>
 *
 * @since 0.1.0
 */
public final class AuditLogger {
  private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
  static final String STORED = "Stored";
  static final String DISCARDED = "Discarded";
  static final String UNKNOWN = "Unknown";

  private final Inventory inventory;
  private final MetricsPort metrics;
  private final List<String> entries = new ArrayList<>();

  /**
   * Creates a logger bound to one inventory.
   *
   * @param inventory inventory receiving stacks; must not be {@code null}
   * @param metrics metrics sink for decision counters; must not be {@code null}
   */
  public AuditLogger(Inventory inventory, MetricsPort metrics) {
    this.inventory = Objects.requireNonNull(inventory, "inventory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Offers the stack to the inventory and logs the outcome.
   *
   * @param stack resolved stack; must not be {@code null}
   * @return {@code true} if the inventory stored the stack
   */
  public boolean store(ItemStack stack) {
    Objects.requireNonNull(stack, "stack");
    boolean stored = inventory.addItems(stack);
    entries.add(format(stored ? STORED : DISCARDED, stack.size(), stack.item().name()));
    metrics.increment(stored ? "fill.stack.stored" : "fill.stack.discarded");
    if (log.isDebugEnabled()) {
      log.debug("{} {} x{} (size {}) occupancy {}/{}",
          stored ? STORED : DISCARDED,
          stack.item().name(),
          stack.quantity(),
          stack.size(),
          inventory.occupied(),
          inventory.maxSize());
    }
    return stored;
  }

  /**
   * Logs a request whose identifier did not resolve. The inventory is not consulted.
   * <p>No item means no size policy applies, so the number column holds the requested quantity rather than a
   * stack size.</p>
   *
   * @param request unresolved request; must not be {@code null}
   */
  public void unresolved(ClassifiedLine.StackRequest request) {
    Objects.requireNonNull(request, "request");
    entries.add(format(UNKNOWN, request.quantity(), "item #" + request.itemId()));
  }

  /**
   * Returns the entries recorded so far.
   *
   * @return immutable snapshot of the audit entries
   */
  public List<String> entries() {
    return List.copyOf(entries);
  }

  /**
   * Formats a single fixed-width audit line.
   *
   * @param label outcome label, left-aligned in nine columns
   * @param size stack size, or the requested quantity for {@code Unknown} entries; right-aligned in two columns
   * @param name item display name
   * @return formatted entry such as {@code "Stored    ( 3) Torch"}
   */
  static String format(String label, long size, String name) {
    return String.format(Locale.ROOT, "%-9s (%2d) %s", label, size, name);
  }
}
