package ca.gc.cra.stowage.infrastructure.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.InventoryMarker;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.Other;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.StackRequest;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RequestFileReaderTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RequestFileReader.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void keepsEveryLineInOrder() throws IOException {
    Path file = tempDir.resolve("inventories.txt");
    Files.writeString(file, "# 5\n- 1 3\n\n- 2 3\n# 10\n- 1 3\n");

    List<ClassifiedLine> lines = new RequestFileReader(file).load();

    assertEquals(List.of(
        new InventoryMarker(5),
        new StackRequest(1, 3),
        new Other(""),
        new StackRequest(2, 3),
        new InventoryMarker(10),
        new StackRequest(1, 3)), lines);
  }

  @Test
  void unrecognisedLinesAreWarnedWithLineNumber() throws IOException {
    Path file = tempDir.resolve("inventories.txt");
    Files.writeString(file, "# 5\nbring snacks\n\n");

    new RequestFileReader(file).load();

    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).getFormattedMessage().contains("inventories.txt:2"));
    assertTrue(warnings.get(0).getFormattedMessage().contains("bring snacks"));
  }
}
