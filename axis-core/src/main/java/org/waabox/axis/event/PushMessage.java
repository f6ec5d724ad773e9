package org.waabox.axis.event;

import java.util.Objects;

/**
 * One serialized event, ready to be written to a push channel.
 *
 * <p>The payload is serialized once by the {@link EventHub} and the same
 * instance is queued to every subscriber.
 *
 * @param kind the event kind, never null
 * @param data the JSON payload, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PushMessage(EventKind kind, String data) {

  /** Validates the fields. */
  public PushMessage {
    Objects.requireNonNull(kind, "kind cannot be null");
    Objects.requireNonNull(data, "data cannot be null");
  }

  /**
   * Renders the message in the server-sent events frame format: an optional
   * {@code event: <kind>} line, a {@code data: <json>} line and a blank line.
   *
   * @return the frame, never null
   */
  public String toWireFormat() {
    final StringBuilder frame = new StringBuilder();
    if (kind.hasEventLine()) {
      frame.append("event: ").append(kind.wireName()).append('\n');
    }
    frame.append("data: ").append(data).append("\n\n");
    return frame.toString();
  }
}
