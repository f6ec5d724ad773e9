package org.waabox.axis.store.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.model.Mode;
import org.waabox.axis.persistence.PersistenceException;
import org.waabox.axis.persistence.StateStore;

/**
 * A {@link StateStore} implementation backed by two JDBC tables.
 *
 * <p>The mode lives in a single-row table and every status in its own row,
 * so each write touches one key. Upserts use SQL {@code MERGE INTO ... KEY}
 * as supported by H2.
 *
 * <p>The tables are created on construction if they do not already exist.
 *
 * <p>Thread safety: this class is thread-safe; every call borrows its own
 * connection from the data source.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcStateStore implements StateStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcStateStore.class);

  /** The key of the only row of the mode table. */
  private static final int MODE_ROW = 1;

  /** The configuration for this store, never null. */
  private final JdbcStateStoreConfig config;

  /**
   * Creates a new store and ensures its tables exist.
   *
   * @param theConfig the configuration, never null
   *
   * @throws PersistenceException if the tables cannot be created
   */
  public JdbcStateStore(final JdbcStateStoreConfig theConfig) {
    Objects.requireNonNull(theConfig, "config cannot be null");
    config = theConfig;
    createTablesIfNotExist();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Mode> loadMode() {
    final String sql = "SELECT current_mode FROM " + config.modeTable()
        + " WHERE id = ?";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setInt(1, MODE_ROW);
      try (final ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        final String value = rs.getString("current_mode");
        final Optional<Mode> mode = Mode.parse(value);
        if (mode.isEmpty()) {
          log.warn("Ignoring unknown stored mode '{}'", value);
        }
        return mode;
      }

    } catch (final SQLException e) {
      throw new PersistenceException(
          "Failed to read mode from '" + config.modeTable() + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void saveMode(final Mode mode) {
    Objects.requireNonNull(mode, "mode cannot be null");

    final String sql = "MERGE INTO " + config.modeTable()
        + " (id, current_mode, updated_at) KEY (id) VALUES (?, ?, ?)";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setInt(1, MODE_ROW);
      ps.setString(2, mode.name());
      ps.setTimestamp(3, Timestamp.from(Instant.now()));
      ps.executeUpdate();

      log.debug("Saved mode {}", mode);

    } catch (final SQLException e) {
      throw new PersistenceException(
          "Failed to save mode to '" + config.modeTable() + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> loadStatuses() {
    final String sql = "SELECT item_id, status FROM " + config.statusTable();

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql);
         final ResultSet rs = ps.executeQuery()) {

      final Map<String, String> statuses = new HashMap<>();
      while (rs.next()) {
        statuses.put(rs.getString("item_id"), rs.getString("status"));
      }
      return statuses;

    } catch (final SQLException e) {
      throw new PersistenceException(
          "Failed to read statuses from '" + config.statusTable() + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void saveStatus(final String id, final String status) {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(status, "status cannot be null");

    final String sql = "MERGE INTO " + config.statusTable()
        + " (item_id, status, updated_at) KEY (item_id) VALUES (?, ?, ?)";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setString(1, id);
      ps.setString(2, status);
      ps.setTimestamp(3, Timestamp.from(Instant.now()));
      ps.executeUpdate();

      log.debug("Saved status '{}' for '{}'", status, id);

    } catch (final SQLException e) {
      throw new PersistenceException(
          "Failed to save status for '" + id + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStatus(final String id) {
    Objects.requireNonNull(id, "id cannot be null");

    final String sql = "DELETE FROM " + config.statusTable()
        + " WHERE item_id = ?";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setString(1, id);
      ps.executeUpdate();

    } catch (final SQLException e) {
      throw new PersistenceException(
          "Failed to delete status for '" + id + "'", e);
    }
  }

  /**
   * Creates the mode and status tables if they do not already exist.
   *
   * <p>Uses {@code CREATE TABLE IF NOT EXISTS} for idempotent DDL.
   */
  private void createTablesIfNotExist() {
    final String modeDdl = "CREATE TABLE IF NOT EXISTS " + config.modeTable()
        + " ("
        + "id INT NOT NULL, "
        + "current_mode VARCHAR(16) NOT NULL, "
        + "updated_at TIMESTAMP NOT NULL, "
        + "PRIMARY KEY (id)"
        + ")";
    final String statusDdl = "CREATE TABLE IF NOT EXISTS "
        + config.statusTable()
        + " ("
        + "item_id VARCHAR(512) NOT NULL, "
        + "status VARCHAR(32) NOT NULL, "
        + "updated_at TIMESTAMP NOT NULL, "
        + "PRIMARY KEY (item_id)"
        + ")";

    try (final Connection conn = config.dataSource().getConnection();
         final PreparedStatement modePs = conn.prepareStatement(modeDdl);
         final PreparedStatement statusPs = conn.prepareStatement(statusDdl)) {

      modePs.execute();
      statusPs.execute();
      log.debug("Ensured state tables '{}' and '{}' exist",
          config.modeTable(), config.statusTable());

    } catch (final SQLException e) {
      throw new PersistenceException("Failed to create state tables with"
          + " prefix '" + config.tablePrefix() + "'", e);
    }
  }
}
