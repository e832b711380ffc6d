package ca.gc.cra.stowage.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for Stowage CLI and configuration flows.
 * <p><strong>Why:</strong> Input files must exist before parsing starts, and an existing report file is only
 * replaced when the operator passes {@code --allow-overwrite}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths and reject null bytes or control characters.</li>
 *   <li>Verify input files are regular and readable.</li>
 *   <li>Guard report files against accidental overwrite.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} for output targets so a symlink is never
 * silently replaced.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names a readable regular file.
   *
   * @param name logical parameter name used in diagnostics
   * @param path candidate input file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a report may be written to {@code path}.
   *
   * @param name logical parameter name used in diagnostics
   * @param path candidate output file; must not be {@code null}
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the parent directory is missing or unwritable, the target is a
   *     directory, or the target exists and overwrite was not allowed
   */
  public static Path validateWritableFile(String name, Path path, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " file is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
