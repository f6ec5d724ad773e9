package org.waabox.axis.model;

import java.util.Optional;

/**
 * The operating mode of the dashboard.
 *
 * <p>In {@link #AUTO} the poller refreshes the registry on a countdown. In
 * {@link #MANUAL} the countdown stops and the operator may delete items and
 * dispatch automation tasks.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Mode {

  /** Automatic refresh on a countdown. */
  AUTO,

  /** Operator-driven; mutating actions are allowed. */
  MANUAL;

  /**
   * Parses a mode from its exact name.
   *
   * @param value the mode name, may be null
   *
   * @return the mode, or empty if the value is null or not a mode name
   */
  public static Optional<Mode> parse(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (final Mode mode : values()) {
      if (mode.name().equals(value)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
