package ca.gc.cra.stowage.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class FillCliTest {
  static final List<String> TORCH_AND_ROPE_REPORT = List.of(
      "Processing Log:",
      "Stored    ( 3) Torch",
      "Discarded ( 3) Rope",
      "Stored    ( 3) Torch",
      "",
      "Item List:",
      "   1 Torch",
      "   2 Rope",
      "",
      "Storage Summary:",
      " -Used  3 of  5",
      "  ( 3) Torch",
      " -Used  3 of 10",
      "  ( 3) Torch");

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private String previousExporter;

  @BeforeEach
  void setUp() throws IOException {
    previousExporter = System.getProperty("otel.metrics.exporter");
    logger = (Logger) LoggerFactory.getLogger(FillCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    Files.writeString(tempDir.resolve("items.txt"), "1 Torch\n2 Rope\n");
    Files.writeString(tempDir.resolve("inventories.txt"), "# 5\n- 1 3\n- 2 3\n# 10\n- 1 3\n");
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void fillPrintsReportToStdout() {
    ExitCode code = FillCli.run(new String[] {
        "items=" + tempDir.resolve("items.txt"),
        "inventories=" + tempDir.resolve("inventories.txt")});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(TORCH_AND_ROPE_REPORT, lines(buffer));
  }

  @Test
  void positionalShorthandMatchesNamedArguments() {
    ExitCode code = FillCli.run(new String[] {
        tempDir.resolve("items.txt").toString(), tempDir.resolve("inventories.txt").toString()});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(TORCH_AND_ROPE_REPORT, lines(buffer));
  }

  @Test
  void reportIsWrittenToOutFileAndNotOverwrittenWithoutFlag() throws IOException {
    Path out = tempDir.resolve("report.txt");
    String[] args = {
        "items=" + tempDir.resolve("items.txt"),
        "inventories=" + tempDir.resolve("inventories.txt"),
        "out=" + out};

    assertEquals(ExitCode.SUCCESS, FillCli.run(args));
    assertEquals(TORCH_AND_ROPE_REPORT, Files.readAllLines(out, StandardCharsets.UTF_8));
    assertEquals("", buffer.toString());

    assertEquals(ExitCode.INVALID_ARGS, FillCli.run(args));
    String[] overwrite = {args[0], args[1], args[2], "--allow-overwrite"};
    assertEquals(ExitCode.SUCCESS, FillCli.run(overwrite));
  }

  @Test
  void yamlConfigSuppliesWeightedPolicy() throws IOException {
    Path yaml = tempDir.resolve("stowage.yaml");
    Files.writeString(yaml, "fill:\n"
        + "  items: " + tempDir.resolve("items.txt") + "\n"
        + "  sizePolicy: WEIGHTED\n"
        + "  weights:\n"
        + "    2: 0\n");

    ExitCode code = FillCli.run(new String[] {
        "config=" + yaml, "inventories=" + tempDir.resolve("inventories.txt")});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> report = lines(buffer);
    assertEquals("Stored    ( 3) Torch", report.get(1));
    assertEquals("Stored    ( 0) Rope", report.get(2));
  }

  @Test
  void missingInventoriesReturnsUsage() {
    ExitCode code = FillCli.run(new String[] {"items=" + tempDir.resolve("items.txt")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: fill"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("inventories is required")));
  }

  @Test
  void malformedCatalogIsConfigError() throws IOException {
    Files.writeString(tempDir.resolve("items.txt"), "1 Torch\nnot an item\n");

    ExitCode code = FillCli.run(new String[] {
        "items=" + tempDir.resolve("items.txt"),
        "inventories=" + tempDir.resolve("inventories.txt")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("items.txt:2")));
  }

  @Test
  void dryRunPrintsPlanWithoutReport() {
    Path out = tempDir.resolve("report.txt");

    ExitCode code = FillCli.run(new String[] {
        "items=" + tempDir.resolve("items.txt"),
        "inventories=" + tempDir.resolve("inventories.txt"),
        "out=" + out,
        "unresolved=REPORT",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Fill dry-run"));
    assertTrue(text.contains("Unknown items    : REPORT"));
    assertFalse(Files.exists(out));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, FillCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Stowage fill"));
  }

  static List<String> lines(StringWriter buffer) {
    return buffer.toString().lines().toList();
  }
}
