package ca.gc.cra.stowage.api;

import ca.gc.cra.stowage.application.pipeline.FillUseCase;
import ca.gc.cra.stowage.application.pipeline.FillUseCase.FillReport;
import ca.gc.cra.stowage.config.CompositionRoot;
import ca.gc.cra.stowage.config.FillConfig;
import ca.gc.cra.stowage.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.stowage.infrastructure.text.InputFormatException;
import ca.gc.cra.stowage.logging.LoggingConfigurator;
import ca.gc.cra.stowage.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for filling inventories from an item catalog and an inventory request file.
 *
 * @since 0.1.0
 */
public final class FillCli {
  private static final Logger log = LoggerFactory.getLogger(FillCli.class);
  private static final String SUMMARY_USAGE =
      "usage: fill items=PATH inventories=PATH [out=PATH] [sizePolicy=QUANTITY|WEIGHTED] "
          + "[weights.ID=N] [defaultWeight=N] [unresolved=DROP|REPORT] [config=PATH] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Stowage fill

      Usage:
        fill items=./items.txt inventories=./inventories.txt [options]
        fill ./items.txt ./inventories.txt [options]

      Required:
        items=PATH               Item catalog, one "<id> <name>" per line
        inventories=PATH         Requests: "# <capacity>" opens an inventory, "- <id> <qty>" requests a stack

      Optional:
        out=PATH                 Write the report to a file instead of stdout
        sizePolicy=QUANTITY|WEIGHTED
                                 Stack size unit (default QUANTITY: one unit per item)
        weights.ID=N             Per-item weight when sizePolicy=WEIGHTED
        defaultWeight=N          Weight for items without weights.ID (default 1)
        unresolved=DROP|REPORT   Drop unknown item ids silently (default) or log them as Unknown
        config=PATH              YAML file with common: and fill: sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        --dry-run                Validate inputs and print the plan without filling
        --allow-overwrite        Replace an existing out file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private FillCli() {}

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
   * Executes the fill command and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for fill CLI");
    }

    Map<String, String> effective;
    try {
      effective = CliSupport.effectiveConfig("fill", input, log, "items", "inventories");
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fill arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    FillConfig config;
    Optional<Path> out;
    try {
      TelemetryConfigurator.configureMetrics(effective);
      config = FillConfig.fromMap(effective);
      Paths.validateReadableFile("items", config.itemsFile());
      Paths.validateReadableFile("inventories", config.inventoriesFile());
      out = config.outputFile().map(path -> Paths.validateWritableFile("out", path, allowOverwrite));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fill arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(metrics);
      FillUseCase useCase = root.fillUseCase(config);
      log.info("Filling inventories from {} using catalog {} (sizePolicy={}, unresolved={})",
          config.inventoriesFile(), config.itemsFile(), config.sizePolicy(), config.unresolvedPolicy());
      FillReport report = useCase.run();
      List<String> lines = root.reportRenderer().render(report.catalog(), report.inventories());
      CliSupport.emit(lines, out, log);
      return ExitCode.SUCCESS;
    } catch (InputFormatException ex) {
      log.error("Malformed input: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Fill I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in fill", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(FillConfig config, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Fill dry-run: no inventories will be filled.",
        " Item catalog     : " + config.itemsFile(),
        " Requests         : " + config.inventoriesFile(),
        " Report           : " + config.outputFile().map(Path::toString).orElse("<stdout>"),
        " Size policy      : " + config.sizePolicy(),
        " Weights          : " + (config.weights().isEmpty() ? "<none>" : config.weights()),
        " Default weight   : " + config.defaultWeight(),
        " Unknown items    : " + config.unresolvedPolicy(),
        " Allow overwrite  : " + allowOverwrite,
        " Re-run without --dry-run to fill inventories.");
  }
}
