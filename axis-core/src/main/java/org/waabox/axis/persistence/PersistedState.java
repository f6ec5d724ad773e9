package org.waabox.axis.persistence;

import java.util.Map;
import java.util.Objects;

import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;

/**
 * The durable mirror of the live mode and status table, as loaded at
 * startup.
 *
 * @param mode     the operating mode, never null
 * @param statuses the statuses by item id, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PersistedState(Mode mode, Map<String, ItemStatus> statuses) {

  /** Validates and copies the statuses. */
  public PersistedState {
    Objects.requireNonNull(mode, "mode cannot be null");
    Objects.requireNonNull(statuses, "statuses cannot be null");
    statuses = Map.copyOf(statuses);
  }

  /**
   * Returns the state used when nothing was ever persisted: {@code AUTO}
   * with no statuses.
   *
   * @return the default state, never null
   */
  public static PersistedState defaults() {
    return new PersistedState(Mode.AUTO, Map.of());
  }
}
