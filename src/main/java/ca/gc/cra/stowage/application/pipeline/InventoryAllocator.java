package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.domain.inventory.Inventory;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates one empty {@link Inventory} per inventory marker, in marker order.
 *
 * <p>Capacities are copied verbatim; a negative or zero capacity is left for the inventory itself to handle.</p>
 *
 * @since 0.1.0
 */
public final class InventoryAllocator {

  /**
   * Scans {@code lines} once and instantiates an inventory for every marker.
   *
   * @param lines classified lines in input order; must not be {@code null}
   * @return mutable list of fresh inventories, one per marker
   */
  public List<Inventory> allocate(List<ClassifiedLine> lines) {
    Objects.requireNonNull(lines, "lines");
    List<Inventory> inventories = new ArrayList<>();
    for (ClassifiedLine line : lines) {
      if (line instanceof ClassifiedLine.InventoryMarker marker) {
        inventories.add(new Inventory(marker.capacity()));
      }
    }
    return inventories;
  }
}
