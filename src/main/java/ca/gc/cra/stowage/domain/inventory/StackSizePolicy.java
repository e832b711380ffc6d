package ca.gc.cra.stowage.domain.inventory;

import ca.gc.cra.stowage.domain.catalog.Item;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Maps an item and a requested quantity to the capacity units a stack occupies.
 * <p><strong>Why:</strong> Inventories enforce capacity in abstract units; the unit function is supplied
 * separately so the capacity check never changes when the sizing rule does.</p>
 * <p><strong>Role:</strong> Domain strategy injected into stack resolution.</p>
 * <p><strong>Thread-safety:</strong> Implementations provided here are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface StackSizePolicy {

  /** One capacity unit per counted item. */
  StackSizePolicy QUANTITY = (item, quantity) -> quantity;

  /**
   * Computes the size of a stack.
   *
   * @param item catalog item being stacked; never {@code null}
   * @param quantity requested count
   * @return size in capacity units
   */
  long sizeOf(Item item, int quantity);

  /**
   * Creates a policy that multiplies the quantity by a per-item weight.
   *
   * @param weights weight keyed by item identifier; must not be {@code null}
   * @param defaultWeight weight applied to items without an explicit entry; must not be negative
   * @return weighted sizing policy
   * @throws IllegalArgumentException if any weight is negative
   */
  static StackSizePolicy weighted(Map<Integer, Integer> weights, int defaultWeight) {
    Map<Integer, Integer> copy = Map.copyOf(Objects.requireNonNull(weights, "weights"));
    if (defaultWeight < 0) {
      throw new IllegalArgumentException("defaultWeight must not be negative (was " + defaultWeight + ")");
    }
    copy.forEach((id, weight) -> {
      if (weight < 0) {
        throw new IllegalArgumentException("weight for item " + id + " must not be negative (was " + weight + ")");
      }
    });
    return (item, quantity) -> (long) quantity * copy.getOrDefault(item.id(), defaultWeight);
  }
}
