package org.waabox.axis.status;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.ValidationException;
import org.waabox.axis.model.CycleDirection;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.persistence.PersistedState;
import org.waabox.axis.persistence.PersistenceGateway;

/**
 * The authoritative table of item statuses, together with the operating
 * mode.
 *
 * <p>Mode and statuses share one read/write lock because they are read and
 * written together. The lock is held only for the in-memory mutation: every
 * durable write goes through the {@link PersistenceGateway} after the lock
 * has been released, using values copied while it was held. Callers never
 * hold another Axis lock while calling into this class.
 *
 * <p>Every mutating operation completes its durable write before it
 * returns.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StatusStore {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(StatusStore.class);

  /** Guards {@link #mode} and {@link #statuses}. */
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  /** The statuses by item id, guarded by {@link #lock}. */
  private final Map<String, ItemStatus> statuses = new HashMap<>();

  /** The operating mode, guarded by {@link #lock}. */
  private Mode mode = Mode.AUTO;

  /** The durable mirror, never null. */
  private final PersistenceGateway persistence;

  /**
   * Creates an empty store in {@link Mode#AUTO}.
   *
   * @param thePersistence the durable mirror, never null
   */
  public StatusStore(final PersistenceGateway thePersistence) {
    Objects.requireNonNull(thePersistence, "persistence cannot be null");
    persistence = thePersistence;
  }

  /**
   * Replaces the in-memory state with the one loaded at startup. Nothing is
   * written back to the store.
   *
   * @param state the restored state, never null
   */
  public void restore(final PersistedState state) {
    Objects.requireNonNull(state, "state cannot be null");
    lock.writeLock().lock();
    try {
      mode = state.mode();
      statuses.clear();
      statuses.putAll(state.statuses());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns the current operating mode.
   *
   * @return the mode, never null
   */
  public Mode mode() {
    lock.readLock().lock();
    try {
      return mode;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Switches the operating mode and persists it.
   *
   * @param newMode the new mode, never null
   */
  public void setMode(final Mode newMode) {
    Objects.requireNonNull(newMode, "mode cannot be null");
    lock.writeLock().lock();
    try {
      mode = newMode;
    } finally {
      lock.writeLock().unlock();
    }
    persistence.writeMode(newMode);
    log.info("Mode switched to {}", newMode);
  }

  /**
   * Returns the status of an item, creating a {@code Pending} record first
   * when none exists. A created record is persisted before returning.
   *
   * @param id the item id, never null
   *
   * @return the status, never null
   */
  public ItemStatus get(final String id) {
    final Optional<ItemStatus> existing = peek(id);
    if (existing.isPresent()) {
      return existing.get();
    }
    createIfAbsent(id);
    return peek(id).orElse(ItemStatus.PENDING);
  }

  /**
   * Returns the recorded status of an item without creating a record.
   *
   * @param id the item id, never null
   *
   * @return the status, or empty if the item has no record
   */
  public Optional<ItemStatus> peek(final String id) {
    Objects.requireNonNull(id, "id cannot be null");
    lock.readLock().lock();
    try {
      return Optional.ofNullable(statuses.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Creates a {@code Pending} record for the item if it has none, and
   * persists it.
   *
   * @param id the item id, never null
   *
   * @return true if a record was created
   */
  public boolean createIfAbsent(final String id) {
    Objects.requireNonNull(id, "id cannot be null");
    final boolean created;
    lock.writeLock().lock();
    try {
      created = statuses.putIfAbsent(id, ItemStatus.PENDING) == null;
    } finally {
      lock.writeLock().unlock();
    }
    if (created) {
      persistence.writeStatus(id, ItemStatus.PENDING);
    }
    return created;
  }

  /**
   * Overwrites the status of an item from its raw wire value.
   *
   * @param id     the item id, never null or empty
   * @param status the raw status, must be one of the seven lifecycle values
   *
   * @return the status that was stored, never null
   *
   * @throws ValidationException if the id is empty or the status is not
   *                             recognized; nothing is changed
   */
  public ItemStatus set(final String id, final String status) {
    final ItemStatus parsed = ItemStatus.fromValue(status).orElseThrow(
        () -> new ValidationException("invalid status: " + status));
    set(id, parsed);
    return parsed;
  }

  /**
   * Overwrites the status of an item unconditionally and persists it.
   *
   * @param id     the item id, never null or empty
   * @param status the status, never null
   *
   * @throws ValidationException if the id is empty
   */
  public void set(final String id, final ItemStatus status) {
    if (id == null || id.isEmpty()) {
      throw new ValidationException("missing id");
    }
    Objects.requireNonNull(status, "status cannot be null");
    lock.writeLock().lock();
    try {
      statuses.put(id, status);
    } finally {
      lock.writeLock().unlock();
    }
    persistence.writeStatus(id, status);
  }

  /**
   * Computes the status one step away from the item's current one. An item
   * without a record cycles as if it were {@code Pending}.
   *
   * <p>Nothing is changed; callers apply the result with
   * {@link #set(String, ItemStatus)}.
   *
   * @param id        the item id, never null
   * @param direction the direction, never null
   *
   * @return the next status, never null
   */
  public ItemStatus cycle(final String id, final CycleDirection direction) {
    final String current = peek(id).map(ItemStatus::value).orElse(null);
    return ItemStatus.cycle(current, direction);
  }

  /**
   * Aligns the table with a freshly fetched item list.
   *
   * <p>Every live note without a record gets {@code Pending}. Every record
   * whose id is not a live note is deleted; this is the only place records
   * are deleted. Nothing is persisted here; callers follow up with
   * {@link #flush(Collection)} when the result {@link
   * Reconciliation#changed() changed} anything.
   *
   * @param liveItems the fetched items, never null
   *
   * @return what was defaulted and removed, never null
   */
  public Reconciliation reconcile(final Collection<RegistryItem> liveItems) {
    Objects.requireNonNull(liveItems, "liveItems cannot be null");

    final Set<String> liveNoteIds = new HashSet<>();
    for (final RegistryItem item : liveItems) {
      if (item.kind().tracksStatus()) {
        liveNoteIds.add(item.id());
      }
    }

    final List<RegistryItem> defaulted = new ArrayList<>();
    final Set<String> removed = new HashSet<>();

    lock.writeLock().lock();
    try {
      for (final RegistryItem item : liveItems) {
        if (item.kind().tracksStatus()
            && statuses.putIfAbsent(item.id(), ItemStatus.PENDING) == null) {
          defaulted.add(item);
        }
      }
      final Iterator<String> ids = statuses.keySet().iterator();
      while (ids.hasNext()) {
        final String id = ids.next();
        if (!liveNoteIds.contains(id)) {
          ids.remove();
          removed.add(id);
        }
      }
    } finally {
      lock.writeLock().unlock();
    }

    for (final String id : removed) {
      log.info("Removed stale status for '{}'", id);
    }
    return new Reconciliation(defaulted, removed);
  }

  /**
   * Writes the mode and every status to the durable store, then deletes
   * the given ids from it.
   *
   * @param removedIds ids whose durable records must be deleted, never null
   */
  public void flush(final Collection<String> removedIds) {
    Objects.requireNonNull(removedIds, "removedIds cannot be null");
    final Mode currentMode;
    final Map<String, ItemStatus> copy;
    lock.readLock().lock();
    try {
      currentMode = mode;
      copy = new HashMap<>(statuses);
    } finally {
      lock.readLock().unlock();
    }

    persistence.writeMode(currentMode);
    copy.forEach(persistence::writeStatus);
    for (final String id : removedIds) {
      persistence.removeStatus(id);
    }
  }

  /**
   * Returns a copy of the status table.
   *
   * @return the statuses by item id, never null
   */
  public Map<String, ItemStatus> statuses() {
    lock.readLock().lock();
    try {
      return new HashMap<>(statuses);
    } finally {
      lock.readLock().unlock();
    }
  }
}
