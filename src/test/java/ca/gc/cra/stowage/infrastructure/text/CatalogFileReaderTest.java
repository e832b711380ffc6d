package ca.gc.cra.stowage.infrastructure.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.line.ClassifiedLine.Other;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CatalogFileReaderTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CatalogFileReader.class);
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
  void readsItemsInFileOrderSkippingBlankLines() throws IOException {
    Path file = tempDir.resolve("items.txt");
    Files.writeString(file, "1 Torch\n\n2 Climbing Rope\n  3   Pick  \n");

    Catalog catalog = new CatalogFileReader(file).load();

    assertEquals(3, catalog.size());
    assertEquals("Climbing Rope", catalog.find(2).orElseThrow().name());
    assertEquals("Pick", catalog.find(3).orElseThrow().name());
    assertEquals(1, catalog.items().get(0).id());
  }

  @Test
  void duplicateIdWarnsAndFirstEntryWins() throws IOException {
    Path file = tempDir.resolve("items.txt");
    Files.writeString(file, "4 Lantern\n4 Candle\n");

    Catalog catalog = new CatalogFileReader(file).load();

    assertEquals("Lantern", catalog.find(4).orElseThrow().name());
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("duplicates item id 4")));
  }

  @Test
  void malformedLineReportsFileAndLineNumber() throws IOException {
    Path file = tempDir.resolve("items.txt");
    Files.writeString(file, "1 Torch\nRope\n");

    InputFormatException ex =
        assertThrows(InputFormatException.class, () -> new CatalogFileReader(file).load());

    assertEquals(2, ex.lineNumber());
    assertEquals(file, ex.file());
    assertTrue(ex.getMessage().contains("items.txt:2"));
  }

  @Test
  void signedIdentifiersAreRejectedLikeInStackRequests() throws IOException {
    Path file = tempDir.resolve("items.txt");
    Files.writeString(file, "1 Torch\n-2 Rope\n");

    InputFormatException ex =
        assertThrows(InputFormatException.class, () -> new CatalogFileReader(file).load());

    assertEquals(2, ex.lineNumber());
    assertInstanceOf(Other.class, LineClassifier.classify("- -2 1"));
  }

  @Test
  void missingFileIsAnIoFailure() {
    assertThrows(NoSuchFileException.class,
        () -> new CatalogFileReader(tempDir.resolve("missing.txt")).load());
  }
}
