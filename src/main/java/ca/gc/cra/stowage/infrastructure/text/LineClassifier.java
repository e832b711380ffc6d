package ca.gc.cra.stowage.infrastructure.text;

import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import ca.gc.cra.stowage.logging.Logs;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies a single inventory request line.
 * <p><strong>Role:</strong> Infrastructure parser feeding {@link RequestFileReader}.</p>
 * <p><strong>Format:</strong>
 * <ul>
 *   <li>{@code # <capacity>} opens an inventory; the capacity is a signed integer.</li>
 *   <li>{@code - <itemId> <quantity>} requests a stack.</li>
 *   <li>Anything else, including numbers that overflow {@code int}, becomes {@link ClassifiedLine.Other}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; patterns are precompiled and shareable.</p>
 *
 * @since 0.1.0
 */
public final class LineClassifier {
  private static final Logger log = LoggerFactory.getLogger(LineClassifier.class);
  private static final int MAX_ECHO_BYTES = 80;
  private static final Pattern MARKER = Pattern.compile("^#\\s*([+-]?\\d+)$");
  private static final Pattern STACK = Pattern.compile("^-\\s*(\\d+)\\s+(\\d+)$");

  private LineClassifier() {}

  /**
   * Classifies one raw line.
   *
   * @param raw line text without terminator; {@code null} is treated as blank
   * @return classified record; never {@code null}
   */
  public static ClassifiedLine classify(String raw) {
    if (raw == null) {
      return new ClassifiedLine.Other("");
    }
    String line = raw.strip();
    try {
      Matcher marker = MARKER.matcher(line);
      if (marker.matches()) {
        return new ClassifiedLine.InventoryMarker(Integer.parseInt(marker.group(1)));
      }
      Matcher stack = STACK.matcher(line);
      if (stack.matches()) {
        return new ClassifiedLine.StackRequest(
            Integer.parseInt(stack.group(1)), Integer.parseInt(stack.group(2)));
      }
    } catch (NumberFormatException ex) {
      log.debug("Numeric field out of range in '{}'", Logs.truncate(raw, MAX_ECHO_BYTES), ex);
    }
    return new ClassifiedLine.Other(raw);
  }
}
