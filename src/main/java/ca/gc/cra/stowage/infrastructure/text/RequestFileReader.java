package ca.gc.cra.stowage.infrastructure.text;

import ca.gc.cra.stowage.application.port.RequestLineSource;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import ca.gc.cra.stowage.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an inventory request file and classifies each line with {@link LineClassifier}.
 *
 * <p>Every line is kept, blank ones included, so segment boundaries follow the file exactly. Non-blank lines that
 * are neither markers nor stack requests are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class RequestFileReader implements RequestLineSource {
  private static final Logger log = LoggerFactory.getLogger(RequestFileReader.class);
  private static final int MAX_ECHO_BYTES = 80;

  private final Path file;

  /**
   * Creates a reader for the given request file.
   *
   * @param file request file path; must not be {@code null}
   */
  public RequestFileReader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public List<ClassifiedLine> load() throws IOException {
    List<ClassifiedLine> lines = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String raw;
      int lineNumber = 0;
      while ((raw = reader.readLine()) != null) {
        lineNumber++;
        ClassifiedLine line = LineClassifier.classify(raw);
        if (line instanceof ClassifiedLine.Other other && !other.text().isBlank()) {
          log.warn("{}:{} ignored unrecognised line '{}'",
              file, lineNumber, Logs.truncate(other.text().strip(), MAX_ECHO_BYTES));
        }
        lines.add(line);
      }
    }
    log.debug("Classified {} request lines from {}", lines.size(), file);
    return lines;
  }
}
