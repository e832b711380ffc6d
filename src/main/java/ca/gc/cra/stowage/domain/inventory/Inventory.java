package ca.gc.cra.stowage.domain.inventory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Capacity-bounded container that accepts or rejects whole {@link ItemStack}s.
 * <p><strong>Why:</strong> Each inventory marker in the request file opens one container with a declared capacity;
 * every later stack is either stored entirely or discarded.</p>
 * <p><strong>Role:</strong> Domain aggregate hosting the capacity enforcement decision.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept a stack only when the running occupancy plus the stack size stays within capacity.</li>
 *   <li>Leave occupancy and contents untouched when a stack is rejected.</li>
 *   <li>Keep one stored stack per distinct item, merging repeat deposits.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the thread processing its request segment.</p>
 * <p><strong>Performance:</strong> Constant-time capacity check; merging scans the stored stacks.</p>
 *
 * @implNote Capacity is never validated. Zero admits only size-zero stacks and a negative capacity rejects
 * everything, because the check is carried out in {@code long} arithmetic against the raw value.
 * @since 0.1.0
 */
public final class Inventory {
  private final int maxSize;
  private final List<ItemStack> stacks = new ArrayList<>();
  private long occupied;

  /**
   * Creates an empty inventory.
   *
   * @param maxSize declared capacity in stack-size units; fixed for the lifetime of the inventory
   */
  public Inventory(int maxSize) {
    this.maxSize = maxSize;
  }

  /**
   * Attempts to store the whole stack.
   *
   * @param stack stack to store; must not be {@code null}
   * @return {@code true} if the stack was stored, {@code false} if it was discarded
   */
  public boolean addItems(ItemStack stack) {
    Objects.requireNonNull(stack, "stack");
    if (!fits(stack)) {
      return false;
    }
    occupied += stack.size();
    for (int i = 0; i < stacks.size(); i++) {
      ItemStack existing = stacks.get(i);
      if (existing.holdsSameItem(stack)) {
        stacks.set(i, existing.merge(stack));
        return true;
      }
    }
    stacks.add(stack);
    return true;
  }

  /**
   * Indicates whether the stack would be accepted right now.
   *
   * @param stack candidate stack; must not be {@code null}
   * @return {@code true} when {@code occupied + size <= maxSize}
   */
  public boolean fits(ItemStack stack) {
    Objects.requireNonNull(stack, "stack");
    return occupied + stack.size() <= maxSize;
  }

  public int maxSize() {
    return maxSize;
  }

  /**
   * Returns the sum of sizes of all stacks accepted so far.
   *
   * @return running occupancy; never decreases
   */
  public long occupied() {
    return occupied;
  }

  /**
   * Returns the stored stacks in first-stored order.
   *
   * @return unmodifiable view of the stored stacks
   */
  public List<ItemStack> stacks() {
    return Collections.unmodifiableList(stacks);
  }

  @Override
  public String toString() {
    return "Inventory{maxSize=" + maxSize + ", occupied=" + occupied + ", stacks=" + stacks.size() + '}';
  }
}
