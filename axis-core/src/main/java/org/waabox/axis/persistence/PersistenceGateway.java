package org.waabox.axis.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.metrics.DashboardMetrics;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;

/**
 * The only writer to the durable {@link StateStore}.
 *
 * <p>Writes are synchronous and best effort: a failure is logged, reported
 * to the metrics and otherwise ignored, so a broken disk never fails the
 * request that triggered the write. The in-memory state stays authoritative
 * and the next successful write catches the store up.
 *
 * <p>At startup {@link #loadInitialState()} first migrates the legacy
 * single-file format, if the file is present, and then reads the store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PersistenceGateway {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PersistenceGateway.class);

  /** The suffix appended to the legacy file once it has been migrated. */
  static final String BACKUP_SUFFIX = ".bak";

  /** The durable store, never null. */
  private final StateStore store;

  /** The legacy state file, null when migration is disabled. */
  private final Path legacyStateFile;

  /** The metrics reporter, never null. */
  private final DashboardMetrics metrics;

  /**
   * Creates a new gateway.
   *
   * @param theStore           the durable store, never null
   * @param theLegacyStateFile the legacy file to migrate, may be null
   * @param theMetrics         the metrics reporter, never null
   */
  public PersistenceGateway(final StateStore theStore,
      final Path theLegacyStateFile, final DashboardMetrics theMetrics) {
    Objects.requireNonNull(theStore, "store cannot be null");
    Objects.requireNonNull(theMetrics, "metrics cannot be null");
    store = theStore;
    legacyStateFile = theLegacyStateFile;
    metrics = theMetrics;
  }

  /**
   * Restores the persisted mode and statuses.
   *
   * <p>Runs the legacy migration first when the legacy file exists. Only
   * missing data yields the defaults ({@code AUTO}, no statuses); a store
   * that cannot be read fails the load instead. Stored values outside the
   * lifecycle are mapped to {@link ItemStatus#PENDING}.
   *
   * @return the initial state, never null
   *
   * @throws PersistenceException if the mode or the statuses cannot be read
   */
  public PersistedState loadInitialState() {
    final long start = System.nanoTime();

    if (legacyStateFile != null && Files.exists(legacyStateFile)) {
      log.info("Found legacy state file {}, migrating", legacyStateFile);
      migrateLegacy();
    }

    final Mode mode;
    try {
      mode = store.loadMode().orElse(Mode.AUTO);
    } catch (final RuntimeException e) {
      log.error("Failed to load mode", e);
      throw new PersistenceException("failed to load mode", e);
    }

    final Map<String, ItemStatus> statuses = new HashMap<>();
    try {
      store.loadStatuses().forEach((id, raw) ->
          statuses.put(id, ItemStatus.normalize(raw)));
    } catch (final RuntimeException e) {
      log.error("Failed to load statuses", e);
      throw new PersistenceException("failed to load statuses", e);
    }

    log.info("State restored: mode {}, {} statuses in {} ms", mode,
        statuses.size(), (System.nanoTime() - start) / 1_000_000);
    return new PersistedState(mode, statuses);
  }

  /**
   * Migrates the legacy state file into the store.
   *
   * <p>Unknown status tokens, including the legacy {@code Keep} and
   * {@code Delete}, become {@link ItemStatus#PENDING}. Afterwards the file
   * is renamed with the {@value #BACKUP_SUFFIX} suffix so the migration
   * cannot run again. A file that cannot be read or parsed is left in place
   * for inspection.
   *
   * @return true if the state was migrated, false otherwise
   */
  public boolean migrateLegacy() {
    if (legacyStateFile == null || !Files.exists(legacyStateFile)) {
      return false;
    }

    final LegacyState legacy;
    try {
      legacy = LegacyState.parse(
          Files.readString(legacyStateFile, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      log.error("Failed to read legacy state file {}", legacyStateFile, e);
      return false;
    } catch (final IllegalArgumentException e) {
      log.error("Corrupt legacy state file {}, migration abandoned",
          legacyStateFile, e);
      return false;
    }

    if (legacy.mode() != null && !legacy.mode().isEmpty()) {
      final Optional<Mode> mode = Mode.parse(legacy.mode());
      if (mode.isPresent()) {
        writeMode(mode.get());
      } else {
        log.warn("Ignoring unknown legacy mode '{}'", legacy.mode());
      }
    }

    legacy.statuses().forEach((id, token) ->
        writeStatus(id, ItemStatus.normalize(token)));

    final Path backup = legacyStateFile.resolveSibling(
        legacyStateFile.getFileName() + BACKUP_SUFFIX);
    try {
      Files.move(legacyStateFile, backup,
          StandardCopyOption.REPLACE_EXISTING);
      log.info("Legacy state migrated ({} statuses), backed up to {}",
          legacy.statuses().size(), backup);
    } catch (final IOException e) {
      log.error("Failed to back up legacy state file {}", legacyStateFile,
          e);
    }
    return true;
  }

  /**
   * Writes the operating mode.
   *
   * @param mode the mode, never null
   *
   * @return true if the write succeeded
   */
  public boolean writeMode(final Mode mode) {
    Objects.requireNonNull(mode, "mode cannot be null");
    try {
      store.saveMode(mode);
      return true;
    } catch (final RuntimeException e) {
      log.error("Failed to persist mode {}", mode, e);
      metrics.persistenceFailed("mode", e);
      return false;
    }
  }

  /**
   * Writes the status of one item.
   *
   * @param id     the item id, never null
   * @param status the status, never null
   *
   * @return true if the write succeeded
   */
  public boolean writeStatus(final String id, final ItemStatus status) {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    try {
      store.saveStatus(id, status.value());
      return true;
    } catch (final RuntimeException e) {
      log.error("Failed to persist status of '{}'", id, e);
      metrics.persistenceFailed(id, e);
      return false;
    }
  }

  /**
   * Removes the status of one item.
   *
   * @param id the item id, never null
   *
   * @return true if the removal succeeded
   */
  public boolean removeStatus(final String id) {
    Objects.requireNonNull(id, "id cannot be null");
    try {
      store.deleteStatus(id);
      return true;
    } catch (final RuntimeException e) {
      log.error("Failed to remove persisted status of '{}'", id, e);
      metrics.persistenceFailed(id, e);
      return false;
    }
  }
}
