package org.waabox.axis.persistence;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.waabox.axis.model.Mode;

/**
 * A volatile {@link StateStore} that keeps everything in memory.
 *
 * <p>It is the default store when none is configured, which is suitable
 * for development and tests. Nothing survives a restart.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryStateStore implements StateStore {

  /** The stored mode, null until first saved. */
  private final AtomicReference<Mode> mode = new AtomicReference<>();

  /** The stored statuses. */
  private final Map<String, String> statuses = new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public Optional<Mode> loadMode() {
    return Optional.ofNullable(mode.get());
  }

  /** {@inheritDoc} */
  @Override
  public void saveMode(final Mode theMode) {
    Objects.requireNonNull(theMode, "mode cannot be null");
    mode.set(theMode);
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> loadStatuses() {
    return new HashMap<>(statuses);
  }

  /** {@inheritDoc} */
  @Override
  public void saveStatus(final String id, final String status) {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    statuses.put(id, status);
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStatus(final String id) {
    Objects.requireNonNull(id, "id cannot be null");
    statuses.remove(id);
  }
}
