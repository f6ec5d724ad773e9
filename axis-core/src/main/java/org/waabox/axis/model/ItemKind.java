package org.waabox.axis.model;

import java.util.Objects;

/**
 * The closed set of registry item kinds.
 *
 * <p>Only {@link #NOTE} items take part in the status lifecycle. Code that
 * branches on the kind uses exhaustive {@code switch} expressions so a new
 * kind fails to compile until every site decides how to treat it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ItemKind {

  /** A note; the only kind that carries a lifecycle status. */
  NOTE("note"),

  /** A text document. */
  DOCUMENT("document"),

  /** A spreadsheet. */
  SHEET("sheet");

  /** The wire name of the kind. */
  private final String value;

  /**
   * Creates a new kind.
   *
   * @param theValue the wire name, never null
   */
  ItemKind(final String theValue) {
    value = theValue;
  }

  /**
   * Returns the wire name, as used in JSON payloads.
   *
   * @return the wire name, never null
   */
  public String value() {
    return value;
  }

  /**
   * Whether items of this kind carry a lifecycle status.
   *
   * @return true only for notes
   */
  public boolean tracksStatus() {
    return switch (this) {
      case NOTE -> true;
      case DOCUMENT, SHEET -> false;
    };
  }

  /**
   * Resolves a kind from its wire name.
   *
   * @param value the wire name, never null
   *
   * @return the matching kind, never null
   *
   * @throws IllegalArgumentException if no kind has the given name
   */
  public static ItemKind fromValue(final String value) {
    Objects.requireNonNull(value, "value cannot be null");
    for (final ItemKind kind : values()) {
      if (kind.value.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown item kind: " + value);
  }
}
