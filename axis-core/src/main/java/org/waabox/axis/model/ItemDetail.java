package org.waabox.axis.model;

import java.util.Objects;

/**
 * The full payload of a single item as returned by the provider.
 *
 * @param id      the identifier, never null
 * @param kind    the item kind, never null
 * @param title   the title, may be blank
 * @param content the plain-text body, may be blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ItemDetail(
    String id,
    ItemKind kind,
    String title,
    String content
) {

  /** Validates the required fields and replaces null text with blanks. */
  public ItemDetail {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");
    title = title == null ? "" : title;
    content = content == null ? "" : content;
  }
}
