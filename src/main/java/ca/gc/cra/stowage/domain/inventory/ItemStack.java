package ca.gc.cra.stowage.domain.inventory;

import ca.gc.cra.stowage.domain.catalog.Item;
import java.util.Objects;

/**
 * <strong>What:</strong> Indivisible request to store a quantity of one catalog item.
 * <p><strong>Role:</strong> Domain value produced by stack resolution and consumed once by
 * {@link Inventory#addItems(ItemStack)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the {@link Item} is the catalog's shared instance.</p>
 *
 * @param item catalog item referenced by this stack
 * @param quantity item count; a merged stack may exceed the range of a single request
 * @param size capacity units occupied by the whole stack
 * @since 0.1.0
 */
public record ItemStack(Item item, long quantity, long size) {

  public ItemStack {
    Objects.requireNonNull(item, "item");
    if (size < 0) {
      throw new IllegalArgumentException("stack size must not be negative (was " + size + ")");
    }
  }

  /**
   * Creates a stack whose size is computed by the supplied policy.
   *
   * @param item catalog item; must not be {@code null}
   * @param quantity requested count
   * @param policy sizing rule; must not be {@code null}
   * @return new stack
   */
  public static ItemStack of(Item item, int quantity, StackSizePolicy policy) {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(policy, "policy");
    return new ItemStack(item, quantity, policy.sizeOf(item, quantity));
  }

  /**
   * Returns a stack combining this stack's contents with another stack of the same item.
   *
   * @param other stack referencing an item with the same identifier
   * @return merged stack
   * @throws IllegalArgumentException if the stacks hold different items
   * @throws ArithmeticException if the merged quantity or size overflows {@code long}
   */
  public ItemStack merge(ItemStack other) {
    Objects.requireNonNull(other, "other");
    if (!holdsSameItem(other)) {
      throw new IllegalArgumentException(
          "cannot merge item " + other.item().id() + " into stack of item " + item.id());
    }
    return new ItemStack(
        item, Math.addExact(quantity, other.quantity()), Math.addExact(size, other.size()));
  }

  /**
   * Indicates whether both stacks refer to the same item identifier.
   *
   * @param other stack to compare
   * @return {@code true} when the item identifiers match
   */
  public boolean holdsSameItem(ItemStack other) {
    return other != null && item.id() == other.item().id();
  }
}
