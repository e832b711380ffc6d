package ca.gc.cra.stowage.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CatalogCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsItemList() throws IOException {
    Path items = Files.writeString(tempDir.resolve("items.txt"), "1 Torch\n12 Climbing Rope\n");

    ExitCode code = CatalogCli.run(new String[] {"items=" + items});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Item List:", "   1 Torch", "  12 Climbing Rope"), FillCliTest.lines(buffer));
  }

  @Test
  void missingCatalogIsInvalidArgs() {
    ExitCode code = CatalogCli.run(new String[] {"items=" + tempDir.resolve("missing.txt")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: catalog"));
  }

  @Test
  void tooManyPositionalsIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, CatalogCli.run(new String[] {"a.txt", "b.txt"}));
  }
}
