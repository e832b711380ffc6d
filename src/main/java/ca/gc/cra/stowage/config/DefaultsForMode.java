package ca.gc.cra.stowage.config;

import ca.gc.cra.stowage.application.pipeline.UnresolvedPolicy;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each Stowage CLI command.
 *
 * <p>Input file keys default to blank so the merged configuration fails fast when neither the command line nor
 * YAML names them.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target CLI command ({@code fill} or {@code catalog})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if {@code mode} is not a known command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "fill" -> buildFillDefaults();
      case "catalog" -> buildCatalogDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildFillDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("items", "");
    map.put("inventories", "");
    map.put("out", "");
    map.put("sizePolicy", SizePolicyMode.QUANTITY.name());
    map.put("defaultWeight", Integer.toString(FillConfig.DEFAULT_WEIGHT));
    map.put("unresolved", UnresolvedPolicy.DROP.name());
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildCatalogDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("items", "");
    map.put("out", "");
    map.put("allowOverwrite", "false");
    return map;
  }
}
