package org.waabox.axis.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.event.EventHub;
import org.waabox.axis.metrics.DashboardMetrics;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.provider.ItemProvider;
import org.waabox.axis.provider.ProviderException;
import org.waabox.axis.status.Reconciliation;
import org.waabox.axis.status.StatusStore;

/**
 * A TTL-bounded cache of the full item list fetched from the
 * {@link ItemProvider}.
 *
 * <p>The snapshot reference is guarded by a {@link ReentrantReadWriteLock}
 * that is held only to read or swap it. The provider call, the status
 * reconciliation and every broadcast happen outside the lock, so a slow
 * upstream never blocks readers of the current snapshot.
 *
 * <p>Refreshes are serialized by a separate {@link ReentrantLock}, so the
 * status table is always reconciled against the list that ends up cached.
 * Readers never take that lock.
 *
 * <p>A failed refresh leaves the previous snapshot untouched. Readers get
 * stale data rather than an error.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SnapshotCache {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SnapshotCache.class);

  /** Guards {@link #snapshot}. */
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  /** Serializes {@link #refresh()}. */
  private final ReentrantLock refreshLock = new ReentrantLock();

  /** The current snapshot, guarded by {@link #lock}. */
  private CacheSnapshot snapshot = CacheSnapshot.EMPTY;

  /** The upstream item source, never null. */
  private final ItemProvider provider;

  /** The status table, never null. */
  private final StatusStore statusStore;

  /** The hub used for status and snapshot broadcasts, never null. */
  private final EventHub hub;

  /** How long a refreshed snapshot stays fresh, never null. */
  private final Duration ttl;

  /** The time source, never null. */
  private final Clock clock;

  /** The metrics reporter, never null. */
  private final DashboardMetrics metrics;

  /**
   * Creates a new, empty and expired cache.
   *
   * @param theProvider    the item source, never null
   * @param theStatusStore the status table, never null
   * @param theHub         the event hub, never null
   * @param theTtl         the freshness window, must be positive
   * @param theClock       the time source, never null
   * @param theMetrics     the metrics reporter, never null
   */
  public SnapshotCache(final ItemProvider theProvider,
      final StatusStore theStatusStore, final EventHub theHub,
      final Duration theTtl, final Clock theClock,
      final DashboardMetrics theMetrics) {
    Objects.requireNonNull(theProvider, "provider cannot be null");
    Objects.requireNonNull(theStatusStore, "statusStore cannot be null");
    Objects.requireNonNull(theHub, "hub cannot be null");
    Objects.requireNonNull(theTtl, "ttl cannot be null");
    Objects.requireNonNull(theClock, "clock cannot be null");
    Objects.requireNonNull(theMetrics, "metrics cannot be null");
    if (theTtl.isZero() || theTtl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive, got: "
          + theTtl);
    }
    provider = theProvider;
    statusStore = theStatusStore;
    hub = theHub;
    ttl = theTtl;
    clock = theClock;
    metrics = theMetrics;
  }

  /**
   * Returns a copy of the cached items and whether they are still fresh.
   *
   * @return the cached items, never null
   */
  public CachedItems read() {
    final CacheSnapshot current = current();
    return new CachedItems(current.items(),
        current.isFreshAt(clock.instant()));
  }

  /**
   * Fetches the full item list from the provider and swaps it in.
   *
   * <p>On success the status table is reconciled with the new list. When
   * that defaulted or removed any record, the table is flushed to the
   * durable store and a status change is published for every defaulted
   * note.
   *
   * @throws ProviderException if the provider fails; the previous snapshot
   *                           is kept
   */
  public void refresh() {
    refreshLock.lock();
    try {
      final Instant started = clock.instant();

      final List<RegistryItem> fetched;
      try {
        fetched = List.copyOf(provider.listAll());
      } catch (final ProviderException e) {
        log.warn("Registry refresh failed, keeping the cached snapshot: {}",
            e.getMessage());
        metrics.refreshFailed(e);
        throw e;
      }

      final Reconciliation reconciliation = statusStore.reconcile(fetched);

      final CacheSnapshot refreshed = new CacheSnapshot(fetched,
          clock.instant().plus(ttl));
      lock.writeLock().lock();
      try {
        snapshot = refreshed;
      } finally {
        lock.writeLock().unlock();
      }

      if (reconciliation.changed()) {
        statusStore.flush(reconciliation.removed());
        for (final RegistryItem item : reconciliation.defaulted()) {
          hub.publishStatusChanged(item.id(), ItemStatus.PENDING, item.title());
        }
      }

      final Duration elapsed = Duration.between(started, clock.instant());
      metrics.refreshCompleted(fetched.size(), elapsed);
      log.info("Registry refreshed with {} items in {} ms ({} defaulted, "
          + "{} removed)", fetched.size(), elapsed.toMillis(),
          reconciliation.defaulted().size(), reconciliation.removed().size());
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Refreshes the cache, masking a provider failure.
   *
   * @return true if the refresh succeeded
   */
  public boolean refreshQuietly() {
    try {
      refresh();
      return true;
    } catch (final ProviderException e) {
      log.debug("Serving cached registry after a failed refresh", e);
      return false;
    }
  }

  /**
   * Returns the cached items, refreshing first when the snapshot is stale
   * or empty. Falls back to whatever is cached when that refresh fails.
   *
   * @return the undecorated items, never null
   */
  public List<RegistryItem> readOrRefresh() {
    final CachedItems cached = read();
    if (cached.fresh() && !cached.items().isEmpty()) {
      return cached.items();
    }
    refreshQuietly();
    return read().items();
  }

  /**
   * Attaches the current status to every note and clears it on every other
   * item. A note without a record shows {@code Pending}; no record is
   * created.
   *
   * @param items the items to decorate, never null
   *
   * @return the decorated copies in the same order, never null
   */
  public List<RegistryItem> decorate(final List<RegistryItem> items) {
    Objects.requireNonNull(items, "items cannot be null");
    final List<RegistryItem> decorated = new ArrayList<>(items.size());
    for (final RegistryItem item : items) {
      if (item.kind().tracksStatus()) {
        decorated.add(item.withStatus(
            statusStore.peek(item.id()).orElse(ItemStatus.PENDING)));
      } else {
        decorated.add(item.withStatus(null));
      }
    }
    return decorated;
  }

  /**
   * Inserts or replaces one item in the cached list and extends the
   * snapshot's expiry.
   *
   * <p>A note without a status record gets {@code Pending}, persisted and
   * announced with a status change, as a refresh would do for it.
   *
   * @param item the item, never null
   *
   * @return true if the item was not in the cached list before
   */
  public boolean upsertSingle(final RegistryItem item) {
    Objects.requireNonNull(item, "item cannot be null");
    final RegistryItem plain = item.withStatus(null);

    boolean added = true;
    lock.writeLock().lock();
    try {
      final List<RegistryItem> items = new ArrayList<>(snapshot.items());
      for (int i = 0; i < items.size(); i++) {
        if (items.get(i).id().equals(plain.id())) {
          items.set(i, plain);
          added = false;
          break;
        }
      }
      if (added) {
        items.add(plain);
      }
      snapshot = new CacheSnapshot(items, clock.instant().plus(ttl));
    } finally {
      lock.writeLock().unlock();
    }

    if (plain.kind().tracksStatus() && statusStore.createIfAbsent(plain.id())) {
      hub.publishStatusChanged(plain.id(), ItemStatus.PENDING, plain.title());
    }
    return added;
  }

  /**
   * Looks up a cached item.
   *
   * @param id the item id, never null
   *
   * @return the undecorated item, or empty if it is not cached
   */
  public Optional<RegistryItem> find(final String id) {
    Objects.requireNonNull(id, "id cannot be null");
    for (final RegistryItem item : current().items()) {
      if (item.id().equals(id)) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }

  /**
   * Looks up the title of a cached item.
   *
   * @param id the item id, never null
   *
   * @return the title, or empty if the item is not cached
   */
  public Optional<String> titleOf(final String id) {
    return find(id).map(RegistryItem::title);
  }

  /**
   * Publishes the decorated cached list as a snapshot event. An empty cache
   * is refreshed first; a stale one is sent as is.
   *
   * @return the number of subscribers that accepted the event
   */
  public int broadcastSnapshot() {
    List<RegistryItem> items = read().items();
    if (items.isEmpty()) {
      refreshQuietly();
      items = read().items();
    }
    return hub.publishSnapshot(decorate(items));
  }

  /**
   * Returns the current snapshot reference.
   *
   * @return the snapshot, never null
   */
  private CacheSnapshot current() {
    lock.readLock().lock();
    try {
      return snapshot;
    } finally {
      lock.readLock().unlock();
    }
  }
}
