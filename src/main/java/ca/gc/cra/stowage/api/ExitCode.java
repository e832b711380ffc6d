package ca.gc.cra.stowage.api;

/**
 * <strong>What:</strong> Process exit codes returned by the Stowage command-line tools.
 * <p><strong>Why:</strong> Scripts that run fills in batch need to tell bad arguments apart from unreadable or
 * malformed input files.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Report produced (or dry-run plan printed). */
  SUCCESS(0),
  /** Command-line arguments, YAML configuration, or paths were invalid. */
  INVALID_ARGS(2),
  /** An input or output file could not be read or written. */
  IO_ERROR(3),
  /** An input file was readable but malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
