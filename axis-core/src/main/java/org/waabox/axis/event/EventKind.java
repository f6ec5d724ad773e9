package org.waabox.axis.event;

/**
 * The kinds of events pushed to dashboard subscribers.
 *
 * <p>Each kind has a wire name used in the {@code event:} line of the push
 * channel. {@link #SNAPSHOT} is the default kind and is sent without an
 * {@code event:} line.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventKind {

  /** The full decorated item list. */
  SNAPSHOT("snapshot"),

  /** The auto-refresh countdown, {@code {"seconds_remaining": n}}. */
  TICK("tick"),

  /** One item's status changed, {@code {"id", "status", "title"}}. */
  STATUS_CHANGED("status"),

  /** An automation task was started or failed to start. */
  AUTOMATION("automation");

  /** The wire name. */
  private final String wireName;

  EventKind(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the name used in the {@code event:} line.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Whether messages of this kind carry an explicit {@code event:} line.
   *
   * @return false only for {@link #SNAPSHOT}
   */
  public boolean hasEventLine() {
    return this != SNAPSHOT;
  }
}
