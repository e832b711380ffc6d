package ca.gc.cra.stowage.infrastructure.text;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals that an input file was readable but did not follow its line format.
 *
 * @since 0.1.0
 */
public final class InputFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient Path file;
  private final int lineNumber;

  /**
   * Creates an exception pinpointing the offending line.
   *
   * @param file file being parsed
   * @param lineNumber 1-based line number
   * @param message description of the problem
   */
  public InputFormatException(Path file, int lineNumber, String message) {
    super(file + ":" + lineNumber + ": " + message);
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public Path file() {
    return file;
  }

  public int lineNumber() {
    return lineNumber;
  }
}
