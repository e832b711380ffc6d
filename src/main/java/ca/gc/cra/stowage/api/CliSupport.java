package ca.gc.cra.stowage.api;

import ca.gc.cra.stowage.config.ConfigMerger;
import ca.gc.cra.stowage.config.DefaultsForMode;
import ca.gc.cra.stowage.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for the fill and catalog CLIs so configuration resolution and report output stay aligned.
 */
final class CliSupport {
  private CliSupport() {
    // Utility class
  }

  /**
   * Resolves the effective configuration for a command: parses {@code key=value} arguments, binds positional
   * shorthand, loads the optional {@code config=PATH} YAML file, and merges over the command defaults.
   *
   * @param mode command name
   * @param input parsed CLI input
   * @param log logger receiving override warnings
   * @param positionalKeys keys bare tokens bind to, in order
   * @return mutable effective configuration
   * @throws IllegalArgumentException if arguments or YAML are invalid, or the YAML file does not exist
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(
      String mode, CliInput input, Logger log, String... positionalKeys) throws IOException {
    Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    ConfigCliUtils.bindPositionals(kv, input.positionalArgs(), positionalKeys);

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} YAML keys from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }

    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
    return new LinkedHashMap<>(effective);
  }

  /**
   * Writes report lines to {@code out} when present, otherwise to stdout.
   *
   * @param lines report lines
   * @param out optional destination file, already validated
   * @param log logger receiving the destination
   * @throws IOException if the file cannot be written
   */
  static void emit(List<String> lines, Optional<Path> out, Logger log) throws IOException {
    if (out.isPresent()) {
      Files.write(out.get(), lines, StandardCharsets.UTF_8);
      log.info("Report written to {}", out.get());
      return;
    }
    CliPrinter.printLines(lines);
  }
}
