package ca.gc.cra.stowage.config;

import ca.gc.cra.stowage.application.pipeline.UnresolvedPolicy;
import ca.gc.cra.stowage.domain.inventory.StackSizePolicy;
import ca.gc.cra.stowage.validation.Numbers;
import ca.gc.cra.stowage.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Captures configuration for the fill command.
 * <p><strong>Why:</strong> Consolidates CLI arguments, YAML sections, and defaults into one immutable value so a run
 * can be reproduced from its effective configuration.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the item catalog, the inventory request file, and the optional report file.</li>
 *   <li>Describe the stack size policy and its per-item weights.</li>
 *   <li>Select how unknown item identifiers are treated.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param itemsFile item catalog file
 * @param inventoriesFile inventory request file
 * @param outputFile optional report file; empty prints the report to stdout
 * @param sizePolicy stack sizing mode; {@code null} defaults to {@link SizePolicyMode#QUANTITY}
 * @param weights per-item weights used when {@code sizePolicy} is {@link SizePolicyMode#WEIGHTED}
 * @param defaultWeight weight for items without an entry in {@code weights}
 * @param unresolvedPolicy treatment of unknown item identifiers; {@code null} defaults to
 *     {@link UnresolvedPolicy#DROP}
 * @since 0.1.0
 */
public record FillConfig(
    Path itemsFile,
    Path inventoriesFile,
    Optional<Path> outputFile,
    SizePolicyMode sizePolicy,
    Map<Integer, Integer> weights,
    int defaultWeight,
    UnresolvedPolicy unresolvedPolicy) {

  /** Prefix of the per-item weight keys, e.g. {@code weights.3=2}. */
  public static final String WEIGHT_KEY_PREFIX = "weights.";
  static final int DEFAULT_WEIGHT = 1;

  /**
   * Normalizes fill configuration values and enforces invariants.
   *
   * @throws NullPointerException if an input file is {@code null}
   * @throws IllegalArgumentException if a weight is negative
   */
  public FillConfig {
    itemsFile = Objects.requireNonNull(itemsFile, "itemsFile").normalize();
    inventoriesFile = Objects.requireNonNull(inventoriesFile, "inventoriesFile").normalize();
    outputFile = outputFile == null ? Optional.empty() : outputFile.map(Path::normalize);
    sizePolicy = Objects.requireNonNullElse(sizePolicy, SizePolicyMode.QUANTITY);
    weights = weights == null ? Map.of() : Map.copyOf(weights);
    unresolvedPolicy = Objects.requireNonNullElse(unresolvedPolicy, UnresolvedPolicy.DROP);
    Numbers.requireRange("defaultWeight", defaultWeight, 0, Integer.MAX_VALUE);
    weights.forEach((id, weight) ->
        Numbers.requireRange(WEIGHT_KEY_PREFIX + id, weight, 0, Integer.MAX_VALUE));
  }

  /**
   * Returns a configuration for the given inputs with default policies.
   *
   * @param itemsFile item catalog file
   * @param inventoriesFile inventory request file
   * @return configuration printing to stdout with quantity sizing and unknown items dropped
   */
  public static FillConfig defaults(Path itemsFile, Path inventoriesFile) {
    return new FillConfig(
        itemsFile,
        inventoriesFile,
        Optional.empty(),
        SizePolicyMode.QUANTITY,
        Map.of(),
        DEFAULT_WEIGHT,
        UnresolvedPolicy.DROP);
  }

  /**
   * Builds a configuration from flattened {@code key=value} pairs.
   *
   * @param args effective configuration map; must contain {@code items} and {@code inventories}
   * @return parsed configuration
   * @throws IllegalArgumentException if a required key is missing or a value is invalid
   */
  public static FillConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Path items = requirePath(args, "items");
    Path inventories = requirePath(args, "inventories");
    Optional<Path> out = optionalPath(args, "out");
    SizePolicyMode sizePolicy = SizePolicyMode.fromString(args.get("sizePolicy"), SizePolicyMode.QUANTITY);
    String rawDefaultWeight = args.get("defaultWeight");
    int defaultWeight = rawDefaultWeight == null || rawDefaultWeight.isBlank()
        ? DEFAULT_WEIGHT
        : Numbers.parseIntInRange("defaultWeight", rawDefaultWeight, 0, Integer.MAX_VALUE);
    UnresolvedPolicy unresolved = UnresolvedPolicy.fromString(args.get("unresolved"), UnresolvedPolicy.DROP);
    return new FillConfig(items, inventories, out, sizePolicy, parseWeights(args), defaultWeight, unresolved);
  }

  /**
   * Builds the stack size policy described by this configuration.
   *
   * @return {@link StackSizePolicy#QUANTITY} or a weighted policy
   */
  public StackSizePolicy stackSizePolicy() {
    return switch (sizePolicy) {
      case QUANTITY -> StackSizePolicy.QUANTITY;
      case WEIGHTED -> StackSizePolicy.weighted(weights, defaultWeight);
    };
  }

  /**
   * Extracts {@code weights.<id>} entries.
   *
   * @param args flattened configuration
   * @return weights keyed by item identifier, in key order
   * @throws IllegalArgumentException if an identifier or weight is not a valid integer
   */
  static Map<Integer, Integer> parseWeights(Map<String, String> args) {
    Map<Integer, Integer> weights = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : args.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(WEIGHT_KEY_PREFIX)) {
        continue;
      }
      String rawId = key.substring(WEIGHT_KEY_PREFIX.length());
      int id;
      try {
        id = Integer.parseInt(rawId.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("weight key must name an integer item id (was '" + key + "')", ex);
      }
      weights.put(id, Numbers.parseIntInRange(key, entry.getValue(), 0, Integer.MAX_VALUE));
    }
    return weights;
  }

  static Path requirePath(Map<String, String> args, String key) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return toPath(key, Strings.requireNonBlank(key, raw));
  }

  static Optional<Path> optionalPath(Map<String, String> args, String key) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(toPath(key, Strings.requireNonBlank(key, raw)));
  }

  private static Path toPath(String key, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }
}
