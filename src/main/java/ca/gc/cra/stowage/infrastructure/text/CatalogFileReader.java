package ca.gc.cra.stowage.infrastructure.text;

import ca.gc.cra.stowage.application.port.CatalogSource;
import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.catalog.Item;
import ca.gc.cra.stowage.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads the item catalog from a UTF-8 text file.
 * <p><strong>Format:</strong> one {@code <id> <name>} entry per line, where the id is unsigned as in stack requests; the name is the trimmed remainder of the line
 * and may contain spaces. Blank lines are skipped.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link CatalogSource}.</p>
 * <p><strong>Observability:</strong> Warns about duplicate identifiers, which resolve to the first entry.</p>
 *
 * @since 0.1.0
 */
public final class CatalogFileReader implements CatalogSource {
  private static final Logger log = LoggerFactory.getLogger(CatalogFileReader.class);
  private static final Pattern ITEM = Pattern.compile("^(\\d+)\\s+(\\S.*)$");
  private static final int MAX_ECHO_BYTES = 80;

  private final Path file;

  /**
   * Creates a reader for the given catalog file.
   *
   * @param file catalog path; must not be {@code null}
   */
  public CatalogFileReader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  /**
   * Parses every entry of the catalog file.
   *
   * @return catalog in file order
   * @throws InputFormatException if a non-blank line is not a valid entry
   * @throws IOException if the file cannot be read
   */
  @Override
  public Catalog load() throws IOException {
    List<Item> items = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String raw;
      int lineNumber = 0;
      while ((raw = reader.readLine()) != null) {
        lineNumber++;
        String line = raw.strip();
        if (line.isEmpty()) {
          continue;
        }
        Item item = parse(line, lineNumber);
        for (Item existing : items) {
          if (existing.id() == item.id()) {
            log.warn("{}:{} duplicates item id {}; lookups keep '{}'",
                file, lineNumber, item.id(), existing.name());
            break;
          }
        }
        items.add(item);
      }
    }
    log.debug("Read {} catalog items from {}", items.size(), file);
    return new Catalog(items);
  }

  private Item parse(String line, int lineNumber) throws InputFormatException {
    Matcher matcher = ITEM.matcher(line);
    if (!matcher.matches()) {
      throw new InputFormatException(file, lineNumber,
          "expected '<id> <name>' but found '" + Logs.truncate(line, MAX_ECHO_BYTES) + "'");
    }
    try {
      return new Item(Integer.parseInt(matcher.group(1)), matcher.group(2));
    } catch (NumberFormatException ex) {
      InputFormatException failure = new InputFormatException(file, lineNumber,
          "item id out of range: " + matcher.group(1));
      failure.initCause(ex);
      throw failure;
    }
  }
}
