package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits the classified request stream at every inventory marker.
 * <p><strong>Role:</strong> First pipeline stage; pure function of its input.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Cut immediately before and after each {@link ClassifiedLine.InventoryMarker}; markers are boundaries and
 *   never appear in a segment.</li>
 *   <li>Always return {@code markers + 1} segments. The first one is the preamble, even when it is empty.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class RequestSegmenter {

  /**
   * Splits {@code lines} into contiguous segments separated by markers.
   *
   * @param lines classified lines in input order; must not be {@code null}
   * @return unmodifiable list of unmodifiable segments; never empty
   */
  public List<List<ClassifiedLine>> split(List<ClassifiedLine> lines) {
    Objects.requireNonNull(lines, "lines");
    List<List<ClassifiedLine>> segments = new ArrayList<>();
    List<ClassifiedLine> current = new ArrayList<>();
    for (ClassifiedLine line : lines) {
      if (line instanceof ClassifiedLine.InventoryMarker) {
        segments.add(List.copyOf(current));
        current = new ArrayList<>();
      } else {
        current.add(line);
      }
    }
    segments.add(List.copyOf(current));
    return List.copyOf(segments);
  }
}
