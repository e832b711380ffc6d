package ca.gc.cra.stowage.domain.catalog;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered, read-only registry of known {@link Item}s.
 * <p><strong>Why:</strong> Stack requests carry only an identifier; the catalog resolves it to the shared item
 * instance.</p>
 * <p><strong>Role:</strong> Domain aggregate built once from the item file and consulted by the stack resolver.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Lookups scan the backing list; catalogs are small operator-maintained files.</p>
 *
 * @implNote Identifier uniqueness is not enforced. Lookups return the first item with a matching identifier, so a
 * key-uniqueness container must not replace the backing list.
 * @since 0.1.0
 */
public final class Catalog implements Iterable<Item> {
  private static final Catalog EMPTY = new Catalog(List.of());

  private final List<Item> items;

  /**
   * Creates a catalog preserving the supplied order.
   *
   * @param items catalog entries in file order; must not be {@code null} or contain {@code null}
   */
  public Catalog(List<Item> items) {
    this.items = List.copyOf(Objects.requireNonNull(items, "items"));
  }

  /**
   * Returns a catalog without entries.
   *
   * @return shared empty catalog
   */
  public static Catalog empty() {
    return EMPTY;
  }

  /**
   * Finds the first item whose identifier equals {@code id}.
   *
   * @param id identifier to look up
   * @return matching item, or empty when the identifier is unknown
   */
  public Optional<Item> find(int id) {
    for (Item item : items) {
      if (item.id() == id) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the items in catalog order.
   *
   * @return unmodifiable list of items
   */
  public List<Item> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  @Override
  public Iterator<Item> iterator() {
    return items.iterator();
  }

  @Override
  public String toString() {
    return "Catalog{items=" + items.size() + '}';
  }
}
