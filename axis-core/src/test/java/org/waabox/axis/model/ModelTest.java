package org.waabox.axis.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for the small value types of the model package.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ModelTest {

  @Test
  void whenCheckingKinds_shouldTrackStatusOnlyForNotes() {
    assertTrue(ItemKind.NOTE.tracksStatus());
    assertFalse(ItemKind.DOCUMENT.tracksStatus());
    assertFalse(ItemKind.SHEET.tracksStatus());
  }

  @Test
  void whenParsingKind_givenWireValue_shouldResolve() {
    assertEquals(ItemKind.SHEET, ItemKind.fromValue("sheet"));
    assertThrows(IllegalArgumentException.class,
        () -> ItemKind.fromValue("keep"));
  }

  @Test
  void whenParsingDirection_givenMixedCase_shouldResolve() {
    assertEquals(CycleDirection.BACK, CycleDirection.fromValue(" Back "));
    assertEquals(CycleDirection.FORWARD, CycleDirection.fromValue("forward"));
    assertThrows(IllegalArgumentException.class,
        () -> CycleDirection.fromValue("sideways"));
  }

  @Test
  void whenParsingMode_givenExactNames_shouldResolve() {
    assertEquals(Optional.of(Mode.MANUAL), Mode.parse("MANUAL"));
    assertTrue(Mode.parse("manual").isEmpty());
    assertTrue(Mode.parse(null).isEmpty());
  }

  @Test
  void whenCreatingItem_givenEmptyId_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> RegistryItem.of("", ItemKind.NOTE, "t", "s"));
  }

  @Test
  void whenDecoratingItem_shouldKeepOriginalUntouched() {
    final RegistryItem item = RegistryItem.of("a", ItemKind.NOTE, "t", "s");

    final RegistryItem decorated = item.withStatus(ItemStatus.ACTIVE);

    assertNull(item.status());
    assertEquals(ItemStatus.ACTIVE, decorated.status());
    assertEquals("a", decorated.id());
  }

  @Test
  void whenCreatingDetail_givenNullText_shouldUseBlanks() {
    final ItemDetail detail = new ItemDetail("a", ItemKind.DOCUMENT, null,
        null);

    assertEquals("", detail.title());
    assertEquals("", detail.content());
  }
}
