package org.waabox.axis.persistence;

import java.util.Map;
import java.util.Optional;

import org.waabox.axis.model.Mode;

/**
 * A durable key/value store for the operating mode and per-item statuses.
 *
 * <p>Implementations define where the state lives (local filesystem,
 * database, memory). Every write is independent; there is no multi-key
 * transaction. Status values are stored as their raw wire names so the
 * store never needs to know the lifecycle.
 *
 * <p>Failures are reported as {@link PersistenceException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StateStore {

  /**
   * Loads the stored operating mode.
   *
   * @return the mode, or empty if none was ever stored
   */
  Optional<Mode> loadMode();

  /**
   * Stores the operating mode, replacing any previous value.
   *
   * @param mode the mode, never null
   */
  void saveMode(Mode mode);

  /**
   * Loads every stored status.
   *
   * @return a mutable copy mapping item id to raw status, never null
   */
  Map<String, String> loadStatuses();

  /**
   * Stores one status, replacing any previous value for the id.
   *
   * @param id     the item id, never null
   * @param status the raw status value, never null
   */
  void saveStatus(String id, String status);

  /**
   * Removes the status stored for the id. Removing an absent id is a no-op.
   *
   * @param id the item id, never null
   */
  void deleteStatus(String id);
}
