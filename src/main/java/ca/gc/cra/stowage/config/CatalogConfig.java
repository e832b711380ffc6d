package ca.gc.cra.stowage.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for the catalog command, which lists the parsed item catalog.
 *
 * @param itemsFile item catalog file
 * @param outputFile optional listing file; empty prints to stdout
 * @since 0.1.0
 */
public record CatalogConfig(Path itemsFile, Optional<Path> outputFile) {

  public CatalogConfig {
    itemsFile = Objects.requireNonNull(itemsFile, "itemsFile").normalize();
    outputFile = outputFile == null ? Optional.empty() : outputFile.map(Path::normalize);
  }

  /**
   * Builds a configuration from flattened {@code key=value} pairs.
   *
   * @param args effective configuration map; must contain {@code items}
   * @return parsed configuration
   * @throws IllegalArgumentException if {@code items} is missing or invalid
   */
  public static CatalogConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    return new CatalogConfig(FillConfig.requirePath(args, "items"), FillConfig.optionalPath(args, "out"));
  }
}
