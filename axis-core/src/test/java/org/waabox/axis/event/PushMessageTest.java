package org.waabox.axis.event;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PushMessage}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PushMessageTest {

  @Test
  void whenRendering_givenSnapshot_shouldOmitEventLine() {
    final PushMessage message = new PushMessage(EventKind.SNAPSHOT, "[]");

    assertEquals("data: []\n\n", message.toWireFormat());
  }

  @Test
  void whenRendering_givenTick_shouldPrefixEventLine() {
    final PushMessage message = new PushMessage(EventKind.TICK,
        "{\"seconds_remaining\":5}");

    assertEquals("event: tick\ndata: {\"seconds_remaining\":5}\n\n",
        message.toWireFormat());
  }

  @Test
  void whenRendering_givenAutomation_shouldUseAutomationName() {
    assertEquals("event: automation\ndata: {}\n\n",
        new PushMessage(EventKind.AUTOMATION, "{}").toWireFormat());
  }
}
