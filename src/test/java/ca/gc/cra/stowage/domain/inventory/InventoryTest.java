package ca.gc.cra.stowage.domain.inventory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stowage.domain.catalog.Item;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InventoryTest {
  private static final Item TORCH = new Item(1, "Torch");
  private static final Item ROPE = new Item(2, "Rope");

  @Test
  void acceptsStackThatFitsExactly() {
    Inventory inventory = new Inventory(5);

    assertTrue(inventory.addItems(new ItemStack(TORCH, 5, 5)));
    assertEquals(5, inventory.occupied());
  }

  @Test
  void rejectedStackLeavesInventoryUnchanged() {
    Inventory inventory = new Inventory(5);
    inventory.addItems(new ItemStack(TORCH, 3, 3));

    assertFalse(inventory.addItems(new ItemStack(ROPE, 3, 3)));
    assertEquals(3, inventory.occupied());
    assertEquals(1, inventory.stacks().size());
    assertSame(TORCH, inventory.stacks().get(0).item());
  }

  @Test
  void laterSmallerStackStillFitsAfterRejection() {
    Inventory inventory = new Inventory(5);
    inventory.addItems(new ItemStack(TORCH, 3, 3));
    inventory.addItems(new ItemStack(ROPE, 4, 4));

    assertTrue(inventory.addItems(new ItemStack(ROPE, 2, 2)));
    assertEquals(5, inventory.occupied());
  }

  @Test
  void zeroCapacityAcceptsOnlyEmptyStacks() {
    Inventory inventory = new Inventory(0);

    assertTrue(inventory.addItems(new ItemStack(TORCH, 0, 0)));
    assertFalse(inventory.addItems(new ItemStack(TORCH, 1, 1)));
    assertEquals(0, inventory.occupied());
  }

  @Test
  void negativeCapacityRejectsEverything() {
    Inventory inventory = new Inventory(-3);

    assertFalse(inventory.addItems(new ItemStack(TORCH, 0, 0)));
    assertFalse(inventory.addItems(new ItemStack(TORCH, 1, 1)));
    assertEquals(0, inventory.occupied());
    assertTrue(inventory.stacks().isEmpty());
  }

  @Test
  void hugeStackDoesNotOverflowCapacityCheck() {
    Inventory inventory = new Inventory(Integer.MAX_VALUE);
    inventory.addItems(new ItemStack(TORCH, 1, Integer.MAX_VALUE));

    assertFalse(inventory.addItems(new ItemStack(ROPE, 1, Integer.MAX_VALUE)));
    assertEquals(Integer.MAX_VALUE, inventory.occupied());
  }

  @Test
  void repeatedItemMergesIntoExistingStack() {
    Inventory inventory = new Inventory(10);
    inventory.addItems(new ItemStack(TORCH, 2, 2));
    inventory.addItems(new ItemStack(ROPE, 1, 1));
    inventory.addItems(new ItemStack(TORCH, 4, 4));

    assertEquals(7, inventory.occupied());
    assertEquals(2, inventory.stacks().size());
    assertEquals(6, inventory.stacks().get(0).quantity());
    assertEquals(6, inventory.stacks().get(0).size());
  }

  @Test
  void mergedQuantityGrowsPastIntRangeWithoutWrapping() {
    StackSizePolicy weightless = StackSizePolicy.weighted(Map.of(1, 0), 1);
    Inventory inventory = new Inventory(0);

    assertTrue(inventory.addItems(ItemStack.of(TORCH, Integer.MAX_VALUE, weightless)));
    assertTrue(inventory.addItems(ItemStack.of(TORCH, Integer.MAX_VALUE, weightless)));

    assertEquals(1, inventory.stacks().size());
    assertEquals(2L * Integer.MAX_VALUE, inventory.stacks().get(0).quantity());
    assertEquals(0, inventory.occupied());
  }
}
