package ca.gc.cra.stowage.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stowage.domain.inventory.ItemStack;
import ca.gc.cra.stowage.domain.inventory.StackSizePolicy;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.Other;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.StackRequest;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StackResolverTest {

  @Test
  void resolvesKnownIdsInOrderAndDropsTheRest() {
    StackResolver resolver = new StackResolver(StackSizePolicy.QUANTITY);

    List<ItemStack> stacks = resolver.resolve(FillFixtures.CATALOG, List.of(
        new StackRequest(2, 4), new Other("note"), new StackRequest(99, 1), new StackRequest(1, 3)));

    assertEquals(2, stacks.size());
    assertSame(FillFixtures.ROPE, stacks.get(0).item());
    assertEquals(4, stacks.get(0).size());
    assertSame(FillFixtures.TORCH, stacks.get(1).item());
  }

  @Test
  void unknownIdResolvesToEmpty() {
    StackResolver resolver = new StackResolver(StackSizePolicy.QUANTITY);

    assertTrue(resolver.resolve(FillFixtures.CATALOG, new StackRequest(99, 1)).isEmpty());
  }

  @Test
  void sizeComesFromInjectedPolicy() {
    StackResolver resolver = new StackResolver(StackSizePolicy.weighted(Map.of(2, 3), 1));

    ItemStack rope = resolver.resolve(FillFixtures.CATALOG, new StackRequest(2, 4)).orElseThrow();

    assertEquals(4, rope.quantity());
    assertEquals(12, rope.size());
  }
}
