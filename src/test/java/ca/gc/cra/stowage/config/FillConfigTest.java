package ca.gc.cra.stowage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stowage.application.pipeline.UnresolvedPolicy;
import ca.gc.cra.stowage.domain.catalog.Item;
import ca.gc.cra.stowage.domain.inventory.StackSizePolicy;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FillConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    FillConfig config = FillConfig.fromMap(Map.of("items", "items.txt", "inventories", "inv.txt"));

    assertEquals(Path.of("items.txt"), config.itemsFile());
    assertEquals(Path.of("inv.txt"), config.inventoriesFile());
    assertTrue(config.outputFile().isEmpty());
    assertEquals(SizePolicyMode.QUANTITY, config.sizePolicy());
    assertEquals(UnresolvedPolicy.DROP, config.unresolvedPolicy());
    assertSame(StackSizePolicy.QUANTITY, config.stackSizePolicy());
    assertEquals(config, FillConfig.defaults(Path.of("items.txt"), Path.of("inv.txt")));
  }

  @Test
  void weightedConfigBuildsWeightedPolicy() {
    Map<String, String> args = new LinkedHashMap<>();
    args.put("items", "items.txt");
    args.put("inventories", "inv.txt");
    args.put("out", "report.txt");
    args.put("sizePolicy", "WEIGHTED");
    args.put("weights.2", "3");
    args.put("defaultWeight", "2");
    args.put("unresolved", "report");

    FillConfig config = FillConfig.fromMap(args);

    assertEquals(Path.of("report.txt"), config.outputFile().orElseThrow());
    assertEquals(Map.of(2, 3), config.weights());
    assertEquals(UnresolvedPolicy.REPORT, config.unresolvedPolicy());
    StackSizePolicy policy = config.stackSizePolicy();
    assertEquals(12, policy.sizeOf(new Item(2, "Rope"), 4));
    assertEquals(8, policy.sizeOf(new Item(1, "Torch"), 4));
  }

  @Test
  void missingInputsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> FillConfig.fromMap(Map.of("items", "items.txt", "inventories", "")));

    assertEquals("inventories is required", ex.getMessage());
  }

  @Test
  void invalidWeightsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> FillConfig.fromMap(
        Map.of("items", "a", "inventories", "b", "weights.x", "1")));
    assertThrows(IllegalArgumentException.class, () -> FillConfig.fromMap(
        Map.of("items", "a", "inventories", "b", "weights.1", "-1")));
    assertThrows(IllegalArgumentException.class, () -> FillConfig.fromMap(
        Map.of("items", "a", "inventories", "b", "defaultWeight", "heavy")));
  }

  @Test
  void unknownUnresolvedPolicyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FillConfig.fromMap(
        Map.of("items", "a", "inventories", "b", "unresolved", "IGNORE")));
  }
}
