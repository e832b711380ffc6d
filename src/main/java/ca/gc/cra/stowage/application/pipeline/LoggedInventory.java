package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.domain.inventory.Inventory;
import java.util.List;
import java.util.Objects;

/**
 * Final state of one inventory together with the audit entries produced while filling it.
 *
 * @param entries audit entries in resolution order
 * @param inventory filled inventory
 * @since 0.1.0
 */
public record LoggedInventory(List<String> entries, Inventory inventory) {
  public LoggedInventory {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    Objects.requireNonNull(inventory, "inventory");
  }
}
