package ca.gc.cra.stowage.api;

import ca.gc.cra.stowage.application.port.MetricsPort;
import ca.gc.cra.stowage.config.CatalogConfig;
import ca.gc.cra.stowage.config.CompositionRoot;
import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.infrastructure.text.InputFormatException;
import ca.gc.cra.stowage.logging.LoggingConfigurator;
import ca.gc.cra.stowage.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the parsed item catalog, useful for checking a catalog file before a fill.
 *
 * @since 0.1.0
 */
public final class CatalogCli {
  private static final Logger log = LoggerFactory.getLogger(CatalogCli.class);
  private static final String SUMMARY_USAGE =
      "usage: catalog items=PATH [out=PATH] [config=PATH] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Stowage catalog

      Usage:
        catalog items=./items.txt [options]

      Required:
        items=PATH               Item catalog, one "<id> <name>" per line

      Optional:
        out=PATH                 Write the item list to a file instead of stdout
        config=PATH              YAML file with common: and catalog: sections
        --allow-overwrite        Replace an existing out file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private CatalogCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CatalogConfig config;
    Optional<Path> out;
    try {
      Map<String, String> effective = CliSupport.effectiveConfig("catalog", input, log, "items");
      boolean allowOverwrite =
          input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");
      config = CatalogConfig.fromMap(effective);
      Paths.validateReadableFile("items", config.itemsFile());
      out = config.outputFile().map(path -> Paths.validateWritableFile("out", path, allowOverwrite));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid catalog arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP);
    try {
      Catalog catalog = root.catalogSource(config.itemsFile()).load();
      log.info("Loaded {} catalog items from {}", catalog.size(), config.itemsFile());
      CliSupport.emit(root.reportRenderer().renderCatalog(catalog), out, log);
      return ExitCode.SUCCESS;
    } catch (InputFormatException ex) {
      log.error("Malformed input: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Catalog I/O failure reading {}", config.itemsFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in catalog", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
