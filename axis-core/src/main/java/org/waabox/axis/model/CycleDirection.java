package org.waabox.axis.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The direction in which a status is cycled through {@link ItemStatus}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CycleDirection {

  /** Moves to the next status in the lifecycle. */
  FORWARD(1),

  /** Moves to the previous status in the lifecycle. */
  BACK(-1);

  /** The index offset applied by this direction. */
  private final int offset;

  CycleDirection(final int theOffset) {
    offset = theOffset;
  }

  /**
   * Returns the index offset applied by this direction.
   *
   * @return +1 or -1
   */
  public int offset() {
    return offset;
  }

  /**
   * Parses a direction from {@code forward} or {@code back}, ignoring case.
   *
   * @param value the direction name, never null
   *
   * @return the direction, never null
   *
   * @throws IllegalArgumentException if the value is not a direction
   */
  public static CycleDirection fromValue(final String value) {
    Objects.requireNonNull(value, "value cannot be null");
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "forward" -> FORWARD;
      case "back" -> BACK;
      default -> throw new IllegalArgumentException(
          "Unknown cycle direction: " + value);
    };
  }
}
