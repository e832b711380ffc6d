package ca.gc.cra.stowage.domain.inventory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.stowage.domain.catalog.Item;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StackSizePolicyTest {
  private static final Item TORCH = new Item(1, "Torch");
  private static final Item ANVIL = new Item(7, "Anvil");

  @Test
  void quantityPolicyCountsItems() {
    assertEquals(3, StackSizePolicy.QUANTITY.sizeOf(TORCH, 3));
    assertEquals(0, StackSizePolicy.QUANTITY.sizeOf(TORCH, 0));
  }

  @Test
  void weightedPolicyUsesPerItemWeightThenDefault() {
    StackSizePolicy policy = StackSizePolicy.weighted(Map.of(7, 10), 2);

    assertEquals(30, policy.sizeOf(ANVIL, 3));
    assertEquals(6, policy.sizeOf(TORCH, 3));
  }

  @Test
  void weightedPolicyDoesNotOverflowInt() {
    StackSizePolicy policy = StackSizePolicy.weighted(Map.of(), 4);

    assertEquals(4L * Integer.MAX_VALUE, policy.sizeOf(TORCH, Integer.MAX_VALUE));
  }

  @Test
  void negativeWeightsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> StackSizePolicy.weighted(Map.of(), -1));
    assertThrows(IllegalArgumentException.class, () -> StackSizePolicy.weighted(Map.of(1, -2), 1));
  }

  @Test
  void stackKeepsCatalogItemReference() {
    ItemStack stack = ItemStack.of(TORCH, 4, StackSizePolicy.weighted(Map.of(1, 2), 1));

    assertSame(TORCH, stack.item());
    assertEquals(4, stack.quantity());
    assertEquals(8, stack.size());
  }

  @Test
  void mergingDifferentItemsFails() {
    ItemStack torches = new ItemStack(TORCH, 1, 1);
    ItemStack anvils = new ItemStack(ANVIL, 1, 1);

    assertThrows(IllegalArgumentException.class, () -> torches.merge(anvils));
  }
}
