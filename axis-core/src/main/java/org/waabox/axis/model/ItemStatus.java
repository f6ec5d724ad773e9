package org.waabox.axis.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The seven-state ordered lifecycle applied to note items.
 *
 * <p>The declaration order is the cycle order:
 * {@code Pending, Execute, Active, Blocked, Review, Complete, Error}. Cycling
 * forward from {@link #ERROR} wraps to {@link #PENDING} and cycling back from
 * {@link #PENDING} wraps to {@link #ERROR}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ItemStatus {

  /** Not yet triaged. Default for every new note. */
  PENDING("Pending"),

  /** Selected for execution. */
  EXECUTE("Execute"),

  /** Work in progress. */
  ACTIVE("Active"),

  /** Waiting on something external. */
  BLOCKED("Blocked"),

  /** Done, awaiting review. */
  REVIEW("Review"),

  /** Finished. */
  COMPLETE("Complete"),

  /** Failed. */
  ERROR("Error");

  /** Cached copy of {@link #values()} in cycle order. */
  private static final ItemStatus[] ORDER = values();

  /** The wire name of the status. */
  private final String value;

  ItemStatus(final String theValue) {
    value = theValue;
  }

  /**
   * Returns the wire name, for example {@code "Pending"}.
   *
   * @return the wire name, never null
   */
  public String value() {
    return value;
  }

  /**
   * Returns the status reached by moving one step in the given direction.
   *
   * @param direction the direction, never null
   *
   * @return the neighbouring status, never null
   */
  public ItemStatus next(final CycleDirection direction) {
    Objects.requireNonNull(direction, "direction cannot be null");
    final int size = ORDER.length;
    return ORDER[Math.floorMod(ordinal() + direction.offset(), size)];
  }

  /**
   * Cycles a raw status value.
   *
   * <p>A null, empty or unrecognized value is treated as {@link #PENDING}
   * (index 0) before the offset is applied, so
   * {@code cycle("bogus", FORWARD)} is {@link #EXECUTE}.
   *
   * @param current   the current raw value, may be null
   * @param direction the direction, never null
   *
   * @return the resulting status, never null
   */
  public static ItemStatus cycle(final String current,
      final CycleDirection direction) {
    return normalize(current).next(direction);
  }

  /**
   * Looks up a status by its exact wire name.
   *
   * @param value the wire name, may be null
   *
   * @return the status, or empty if the value is not one of the seven
   */
  public static Optional<ItemStatus> fromValue(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (final ItemStatus status : ORDER) {
      if (status.value.equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }

  /**
   * Maps a raw value to a status, falling back to {@link #PENDING} for
   * anything unrecognized (including legacy tokens such as {@code Keep}).
   *
   * @param value the raw value, may be null
   *
   * @return the status, never null
   */
  public static ItemStatus normalize(final String value) {
    return fromValue(value).orElse(PENDING);
  }
}
