package ca.gc.cra.stowage.domain.line;

import java.util.Objects;

/**
 * <strong>What:</strong> One record of the inventory request file after classification.
 * <p><strong>Why:</strong> The pipeline only cares whether a line opens an inventory, requests a stack, or is
 * irrelevant; a closed set of record types makes every consumer handle exactly those cases.</p>
 * <p><strong>Role:</strong> Domain value produced by the line classifier and consumed by the request segmenter,
 * inventory allocator, and stack resolver.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface ClassifiedLine
    permits ClassifiedLine.InventoryMarker, ClassifiedLine.StackRequest, ClassifiedLine.Other {

  /**
   * Starts a new inventory.
   *
   * @param capacity declared maximum size; passed through unvalidated
   */
  record InventoryMarker(int capacity) implements ClassifiedLine {}

  /**
   * Requests that a quantity of one item be stored in the current inventory.
   *
   * @param itemId catalog identifier of the requested item
   * @param quantity requested count; never negative
   */
  record StackRequest(int itemId, int quantity) implements ClassifiedLine {
    public StackRequest {
      if (quantity < 0) {
        throw new IllegalArgumentException("quantity must not be negative (was " + quantity + ")");
      }
    }
  }

  /**
   * Any line that neither opens an inventory nor requests a stack.
   *
   * @param text original line content
   */
  record Other(String text) implements ClassifiedLine {
    public Other {
      text = Objects.requireNonNullElse(text, "");
    }
  }
}
