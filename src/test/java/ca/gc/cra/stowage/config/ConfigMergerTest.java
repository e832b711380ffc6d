package ca.gc.cra.stowage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "fill",
        Optional.of(Map.of("items", "yaml-items.txt", "unresolved", "REPORT")),
        Map.of("items", "cli-items.txt"),
        DefaultsForMode.asFlatMap("fill"),
        warnings::add);

    assertEquals("cli-items.txt", effective.get("items"));
    assertEquals("REPORT", effective.get("unresolved"));
    assertEquals("QUANTITY", effective.get("sizePolicy"));
    assertEquals(List.of("CLI overrides YAML for key: items"), warnings);
  }

  @Test
  void weightsRequireWeightedPolicy() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "fill", Optional.empty(), Map.of("weights.3", "2"), DefaultsForMode.asFlatMap("fill"), null));

    assertTrue(ex.getMessage().contains("sizePolicy=WEIGHTED"));
  }

  @Test
  void weightsAcceptedWithWeightedPolicy() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "fill",
        Optional.of(Map.of("sizePolicy", "weighted")),
        Map.of("weights.3", "2"),
        DefaultsForMode.asFlatMap("fill"),
        null);

    assertEquals("2", effective.get("weights.3"));
  }

  @Test
  void unknownSizePolicyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "fill", Optional.empty(), Map.of("sizePolicy", "VOLUME"), DefaultsForMode.asFlatMap("fill"), null));
  }
}
