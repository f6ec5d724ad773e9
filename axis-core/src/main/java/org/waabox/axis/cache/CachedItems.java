package org.waabox.axis.cache;

import java.util.List;
import java.util.Objects;

import org.waabox.axis.model.RegistryItem;

/**
 * A copy of the cached item list, as returned by
 * {@link SnapshotCache#read()}.
 *
 * @param items the undecorated items in display order, never null
 * @param fresh whether the snapshot had not yet expired when read
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CachedItems(List<RegistryItem> items, boolean fresh) {

  /** Validates and copies the items. */
  public CachedItems {
    Objects.requireNonNull(items, "items cannot be null");
    items = List.copyOf(items);
  }
}
