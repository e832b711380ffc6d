package ca.gc.cra.stowage.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags, {@code key=value} pairs, and bare positional tokens.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final List<String> positionalArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, List<String> positionalArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.positionalArgs = List.copyOf(positionalArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(kv, positional, flags);
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (arg.contains("=")) {
        kv.add(arg);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(kv, positional, flags);
  }

  /**
   * Returns the {@code key=value} style arguments.
   *
   * @return copy of arguments intended for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns bare tokens without {@code '='}, such as a command name or input file shorthand.
   *
   * @return positional tokens in command-line order
   */
  public List<String> positionalArgs() {
    return positionalArgs;
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when {@code --verbose} (or equivalent) was present
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all normalized flags supplied on the command line.
   *
   * @return set of normalized (lowercase) flags
   */
  public Set<String> flags() {
    return flags;
  }
}
