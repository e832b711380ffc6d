package ca.gc.cra.stowage.application.port;

import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.io.IOException;
import java.util.List;

/**
 * Supplies the classified inventory request lines, in file order, before a fill run starts.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RequestLineSource {
  /**
   * Loads and classifies every request line.
   *
   * @return ordered classified lines; never {@code null}
   * @throws IOException if the backing data cannot be read
   */
  List<ClassifiedLine> load() throws IOException;
}
