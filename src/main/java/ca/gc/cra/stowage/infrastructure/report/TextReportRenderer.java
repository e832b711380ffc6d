package ca.gc.cra.stowage.infrastructure.report;

import ca.gc.cra.stowage.application.pipeline.LoggedInventory;
import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.catalog.Item;
import ca.gc.cra.stowage.domain.inventory.Inventory;
import ca.gc.cra.stowage.domain.inventory.ItemStack;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders a fill run as plain text.
 * <p><strong>Layout:</strong> a {@code Processing Log:} section with every audit entry (inventories in marker order,
 * entries in resolution order), an {@code Item List:} section, and a {@code Storage Summary:} section with each
 * inventory's occupancy and stored stacks. Sections are separated by a blank line.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TextReportRenderer {

  /**
   * Renders the full report.
   *
   * @param catalog catalog used for the run; must not be {@code null}
   * @param inventories per-inventory results in marker order; must not be {@code null}
   * @return report lines without terminators
   */
  public List<String> render(Catalog catalog, List<LoggedInventory> inventories) {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(inventories, "inventories");
    List<String> lines = new ArrayList<>();
    lines.add("Processing Log:");
    for (LoggedInventory logged : inventories) {
      lines.addAll(logged.entries());
    }
    lines.add("");

    lines.addAll(renderCatalog(catalog));
    lines.add("");

    lines.add("Storage Summary:");
    for (LoggedInventory logged : inventories) {
      lines.addAll(renderInventory(logged.inventory()));
    }
    return lines;
  }

  /**
   * Renders the {@code Item List:} section.
   *
   * @param catalog catalog to list; must not be {@code null}
   * @return section lines
   */
  public List<String> renderCatalog(Catalog catalog) {
    Objects.requireNonNull(catalog, "catalog");
    List<String> lines = new ArrayList<>(catalog.size() + 1);
    lines.add("Item List:");
    for (Item item : catalog) {
      lines.add(String.format(Locale.ROOT, "  %2d %s", item.id(), item.name()));
    }
    return lines;
  }

  /**
   * Renders the summary block of one inventory.
   *
   * @param inventory inventory to describe; must not be {@code null}
   * @return header line followed by one line per stored stack
   */
  public List<String> renderInventory(Inventory inventory) {
    Objects.requireNonNull(inventory, "inventory");
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, " -Used %2d of %2d", inventory.occupied(), inventory.maxSize()));
    for (ItemStack stack : inventory.stacks()) {
      lines.add(String.format(Locale.ROOT, "  (%2d) %s", stack.quantity(), stack.item().name()));
    }
    return lines;
  }
}
