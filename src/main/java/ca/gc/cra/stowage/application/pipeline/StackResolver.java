package ca.gc.cra.stowage.application.pipeline;

import ca.gc.cra.stowage.domain.catalog.Catalog;
import ca.gc.cra.stowage.domain.inventory.ItemStack;
import ca.gc.cra.stowage.domain.inventory.StackSizePolicy;
import ca.gc.cra.stowage.domain.line.ClassifiedLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns stack requests into {@link ItemStack}s backed by catalog items.
 * <p><strong>Role:</strong> Pipeline stage between segmentation and capacity enforcement.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep only {@link ClassifiedLine.StackRequest} records, in their original relative order.</li>
 *   <li>Resolve identifiers with first-match catalog lookup and size stacks with the configured policy.</li>
 *   <li>Drop requests whose identifier is unknown without raising an error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class StackResolver {
  private final StackSizePolicy sizePolicy;

  /**
   * Creates a resolver.
   *
   * @param sizePolicy sizing rule applied to every resolved stack; must not be {@code null}
   */
  public StackResolver(StackSizePolicy sizePolicy) {
    this.sizePolicy = Objects.requireNonNull(sizePolicy, "sizePolicy");
  }

  /**
   * Resolves every stack request of a segment, dropping unknown identifiers.
   *
   * @param catalog item catalog; must not be {@code null}
   * @param segment lines belonging to one inventory; must not be {@code null}
   * @return resolved stacks in request order
   */
  public List<ItemStack> resolve(Catalog catalog, List<ClassifiedLine> segment) {
    List<ItemStack> stacks = new ArrayList<>();
    for (ClassifiedLine.StackRequest request : requests(segment)) {
      resolve(catalog, request).ifPresent(stacks::add);
    }
    return stacks;
  }

  /**
   * Resolves a single request.
   *
   * @param catalog item catalog; must not be {@code null}
   * @param request stack request; must not be {@code null}
   * @return stack for the first catalog item with the requested identifier, or empty when none exists
   */
  public Optional<ItemStack> resolve(Catalog catalog, ClassifiedLine.StackRequest request) {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(request, "request");
    return catalog.find(request.itemId())
        .map(item -> ItemStack.of(item, request.quantity(), sizePolicy));
  }

  /**
   * Extracts the stack requests of a segment, ignoring every other record kind.
   *
   * @param segment lines belonging to one inventory; must not be {@code null}
   * @return stack requests in segment order
   */
  public static List<ClassifiedLine.StackRequest> requests(List<ClassifiedLine> segment) {
    Objects.requireNonNull(segment, "segment");
    List<ClassifiedLine.StackRequest> requests = new ArrayList<>();
    for (ClassifiedLine line : segment) {
      if (line instanceof ClassifiedLine.StackRequest request) {
        requests.add(request);
      }
    }
    return requests;
  }
}
