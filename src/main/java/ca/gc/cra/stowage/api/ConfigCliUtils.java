package ca.gc.cra.stowage.api;

import java.util.List;
import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Binds bare positional tokens to keys in order, unless the key was also given as {@code key=value}.
   *
   * @param args parsed key/value arguments; updated in place
   * @param positionals bare tokens in command-line order
   * @param keys keys the positions map to
   * @throws IllegalArgumentException if there are more tokens than keys, or a key is given both ways
   */
  static void bindPositionals(Map<String, String> args, List<String> positionals, String... keys) {
    if (positionals.size() > keys.length) {
      throw new IllegalArgumentException(
          "expected at most " + keys.length + " positional arguments (was " + positionals.size() + ")");
    }
    for (int i = 0; i < positionals.size(); i++) {
      if (args.containsKey(keys[i])) {
        throw new IllegalArgumentException(keys[i] + " given both positionally and as " + keys[i] + "=");
      }
      args.put(keys[i], positionals.get(i));
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
