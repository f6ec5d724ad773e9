package org.waabox.axis.status;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.waabox.axis.model.RegistryItem;

/**
 * The outcome of {@link StatusStore#reconcile(java.util.Collection)}.
 *
 * @param defaulted the note items that had no record and were set to
 *                  {@code Pending}, in provider order, never null
 * @param removed   the ids whose records were deleted because they are no
 *                  longer live, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Reconciliation(List<RegistryItem> defaulted,
    Set<String> removed) {

  /** Copies both collections. */
  public Reconciliation {
    Objects.requireNonNull(defaulted, "defaulted cannot be null");
    Objects.requireNonNull(removed, "removed cannot be null");
    defaulted = List.copyOf(defaulted);
    removed = Set.copyOf(removed);
  }

  /**
   * Whether the reconciliation changed the status table.
   *
   * @return true if any record was created or deleted
   */
  public boolean changed() {
    return !defaulted.isEmpty() || !removed.isEmpty();
  }
}
