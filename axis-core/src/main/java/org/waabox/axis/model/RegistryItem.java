package org.waabox.axis.model;

import java.util.Objects;

/**
 * One externally-sourced item shown on the dashboard.
 *
 * <p>Items are immutable. The provider produces them without a status; the
 * snapshot cache attaches one with {@link #withStatus(ItemStatus)} when the
 * list is served to a caller.
 *
 * @param id      the provider identifier, never null or empty
 * @param kind    the item kind, never null
 * @param title   the display title, never null
 * @param snippet a short description, never null
 * @param status  the lifecycle status, null for non-note items or before
 *                decoration
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RegistryItem(
    String id,
    ItemKind kind,
    String title,
    String snippet,
    ItemStatus status
) {

  /** Validates the required fields. */
  public RegistryItem {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");
    Objects.requireNonNull(title, "title cannot be null");
    Objects.requireNonNull(snippet, "snippet cannot be null");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
  }

  /**
   * Creates an undecorated item.
   *
   * @param id      the identifier, never null or empty
   * @param kind    the kind, never null
   * @param title   the title, never null
   * @param snippet the snippet, never null
   *
   * @return the item, never null
   */
  public static RegistryItem of(final String id, final ItemKind kind,
      final String title, final String snippet) {
    return new RegistryItem(id, kind, title, snippet, null);
  }

  /**
   * Returns a copy of this item carrying the given status.
   *
   * @param newStatus the status, may be null to clear it
   *
   * @return the decorated copy, never null
   */
  public RegistryItem withStatus(final ItemStatus newStatus) {
    return new RegistryItem(id, kind, title, snippet, newStatus);
  }
}
