package ca.gc.cra.stowage.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("items.txt", Strings.requireNonBlank("items", "  items.txt "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("items", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("items", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("items", null));
  }

  @Test
  void requirePrintableAsciiEnforcesCharsetAndLength() {
    assertEquals("team=stowage", Strings.requirePrintableAscii("attrs", "team=stowage", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
  }
}
