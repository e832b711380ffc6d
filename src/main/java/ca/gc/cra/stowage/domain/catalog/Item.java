package ca.gc.cra.stowage.domain.catalog;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable catalog entry describing a storable item.
 * <p><strong>Why:</strong> Stack requests name items by identifier; the display name is what operators read in
 * audit logs and summaries.</p>
 * <p><strong>Role:</strong> Domain value owned by {@link Catalog} and shared by reference with every
 * {@link ca.gc.cra.stowage.domain.inventory.ItemStack} that refers to it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param id item identifier used by stack requests
 * @param name display name; trimmed and never blank
 * @since 0.1.0
 */
public record Item(int id, String name) {
  /**
   * Normalizes the display name.
   *
   * @throws NullPointerException if {@code name} is {@code null}
   * @throws IllegalArgumentException if {@code name} is blank
   */
  public Item {
    name = Objects.requireNonNull(name, "name").trim();
    if (name.isEmpty()) {
      throw new IllegalArgumentException("item " + id + " name must not be blank");
    }
  }
}
