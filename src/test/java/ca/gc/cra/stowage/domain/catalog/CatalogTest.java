package ca.gc.cra.stowage.domain.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CatalogTest {

  @Test
  void findReturnsFirstItemWithMatchingId() {
    Item first = new Item(4, "Lantern");
    Item duplicate = new Item(4, "Spare Lantern");
    Catalog catalog = new Catalog(List.of(new Item(1, "Torch"), first, duplicate));

    assertSame(first, catalog.find(4).orElseThrow());
  }

  @Test
  void findMissingIdIsEmpty() {
    Catalog catalog = new Catalog(List.of(new Item(1, "Torch")));

    assertTrue(catalog.find(99).isEmpty());
    assertTrue(Catalog.empty().find(1).isEmpty());
  }

  @Test
  void catalogIsDetachedFromSourceList() {
    List<Item> source = new ArrayList<>(List.of(new Item(1, "Torch")));
    Catalog catalog = new Catalog(source);
    source.add(new Item(2, "Rope"));

    assertEquals(1, catalog.size());
    assertThrows(UnsupportedOperationException.class, () -> catalog.items().add(new Item(3, "Pick")));
  }

  @Test
  void itemNameIsTrimmedAndMustNotBeBlank() {
    assertEquals("Torch", new Item(1, "  Torch ").name());
    assertThrows(IllegalArgumentException.class, () -> new Item(2, "   "));
    assertThrows(NullPointerException.class, () -> new Item(3, null));
  }
}
