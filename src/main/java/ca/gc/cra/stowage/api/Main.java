package ca.gc.cra.stowage.api;

import ca.gc.cra.stowage.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stowage CLI dispatcher that routes to subcommands.
 *
 * <p>{@code stowage ITEMS INVENTORIES} without a command name is shorthand for {@code stowage fill}.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: stowage <fill|catalog> [options]";
  private static final String HELP_TEXT = """
      Stowage inventory filler

      Usage:
        stowage <command> [options]
        stowage ITEMS INVENTORIES [options]

      Commands:
        fill        Fill inventories from a catalog and request file (fill --help for details)
        catalog     Print the parsed item catalog (catalog --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first positional token names the subcommand
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    List<String> positionals = input.positionalArgs();
    if (positionals.isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = positionals.get(0).toLowerCase(Locale.ROOT);
    return switch (command) {
      case "fill" -> FillCli.run(withoutFirst(args, positionals.get(0)));
      case "catalog" -> CatalogCli.run(withoutFirst(args, positionals.get(0)));
      default -> {
        if (positionals.size() == 2) {
          log.debug("No command given; treating {} and {} as fill inputs", positionals.get(0), positionals.get(1));
          yield FillCli.run(args);
        }
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    List<String> remaining = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(token)) {
        removed = true;
        continue;
      }
      remaining.add(arg);
    }
    return remaining.toArray(String[]::new);
  }
}
