package org.waabox.axis.cache;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.waabox.axis.model.RegistryItem;

/**
 * The cached item list together with the instant it stops being fresh.
 *
 * <p>Only a successful refresh or a single-item upsert replaces a snapshot;
 * a failed refresh leaves the previous one, and its expiry, untouched.
 *
 * @param items     the undecorated items in display order, never null
 * @param expiresAt the expiry instant, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
record CacheSnapshot(List<RegistryItem> items, Instant expiresAt) {

  /** The snapshot a cache starts with: empty and already expired. */
  static final CacheSnapshot EMPTY = new CacheSnapshot(List.of(),
      Instant.EPOCH);

  /** Validates and copies the items. */
  CacheSnapshot {
    Objects.requireNonNull(items, "items cannot be null");
    Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
    items = List.copyOf(items);
  }

  /**
   * Whether this snapshot is still fresh at the given instant.
   *
   * @param now the current instant, never null
   *
   * @return true if {@code now} is before the expiry
   */
  boolean isFreshAt(final Instant now) {
    return now.isBefore(expiresAt);
  }
}
