package org.waabox.axis.store.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.axis.metrics.NoopDashboardMetrics;
import org.waabox.axis.model.ItemKind;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.persistence.PersistedState;
import org.waabox.axis.persistence.PersistenceGateway;
import org.waabox.axis.status.Reconciliation;
import org.waabox.axis.status.StatusStore;

/** Unit tests for {@link JdbcStateStore}.
 *
 * <p>Uses an H2 in-memory database, one per test.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcStateStoreTest {

  /** The H2 in-memory data source. */
  private DataSource dataSource;

  @BeforeEach
  void setUp() {
    final JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:testdb_" + System.nanoTime()
        + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    dataSource = ds;
  }

  @Test
  void whenCreating_shouldCreateBothTables() throws Exception {
    new JdbcStateStore(JdbcStateStoreConfig.create(dataSource));

    try (final Connection conn = dataSource.getConnection()) {
      final ResultSet mode = conn.getMetaData().getTables(
          null, null, "AXIS_MODE", null);
      assertTrue(mode.next(), "Table axis_mode should exist");
      final ResultSet status = conn.getMetaData().getTables(
          null, null, "AXIS_STATUS", null);
      assertTrue(status.next(), "Table axis_status should exist");
    }
  }

  @Test
  void whenCreatingTwice_givenSameDatabase_shouldKeepData() {
    final JdbcStateStoreConfig config = JdbcStateStoreConfig.create(
        dataSource, "dash");
    new JdbcStateStore(config).saveStatus("a", "Active");

    final JdbcStateStore reopened = new JdbcStateStore(config);

    assertEquals(Map.of("a", "Active"), reopened.loadStatuses());
  }

  @Test
  void whenLoadingMode_givenNothingSaved_shouldReturnEmpty() {
    final JdbcStateStore store = new JdbcStateStore(
        JdbcStateStoreConfig.create(dataSource));

    assertTrue(store.loadMode().isEmpty());
  }

  @Test
  void whenSavingMode_givenTwoWrites_shouldKeepTheLast() {
    final JdbcStateStore store = new JdbcStateStore(
        JdbcStateStoreConfig.create(dataSource));

    store.saveMode(Mode.MANUAL);
    store.saveMode(Mode.AUTO);

    assertEquals(Optional.of(Mode.AUTO), store.loadMode());
  }

  @Test
  void whenSavingStatus_givenExistingId_shouldOverwrite() {
    final JdbcStateStore store = new JdbcStateStore(
        JdbcStateStoreConfig.create(dataSource));

    store.saveStatus("a", "Pending");
    store.saveStatus("b", "Review");
    store.saveStatus("a", "Complete");

    assertEquals(Map.of("a", "Complete", "b", "Review"),
        store.loadStatuses());
  }

  @Test
  void whenDeletingStatus_givenStoredId_shouldRemoveRow() {
    final JdbcStateStore store = new JdbcStateStore(
        JdbcStateStoreConfig.create(dataSource));
    store.saveStatus("a", "Pending");
    store.saveStatus("c", "Error");

    store.deleteStatus("c");
    store.deleteStatus("missing");

    assertEquals(Map.of("a", "Pending"), store.loadStatuses());
  }

  @Test
  void whenCreatingConfig_givenUnsafePrefix_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStateStoreConfig.create(dataSource, "axis; DROP TABLE x"));
  }

  @Test
  void whenReconciling_givenVanishedNote_shouldDeleteItsRow() {
    final JdbcStateStore store = new JdbcStateStore(
        JdbcStateStoreConfig.create(dataSource));
    store.saveStatus("a", "Active");
    store.saveStatus("c", "Blocked");

    final PersistenceGateway gateway = new PersistenceGateway(store, null,
        new NoopDashboardMetrics());
    final StatusStore statuses = new StatusStore(gateway);
    statuses.restore(gateway.loadInitialState());

    final Reconciliation reconciliation = statuses.reconcile(List.of(
        RegistryItem.of("a", ItemKind.NOTE, "A", "first"),
        RegistryItem.of("b", ItemKind.NOTE, "B", "second")));
    statuses.flush(reconciliation.removed());

    final Map<String, String> stored = store.loadStatuses();
    assertFalse(stored.containsKey("c"));
    assertEquals("Active", stored.get("a"));
    assertEquals("Pending", stored.get("b"));

    final PersistedState restarted = new PersistenceGateway(store, null,
        new NoopDashboardMetrics()).loadInitialState();
    assertEquals(ItemStatus.PENDING, restarted.statuses().get("b"));
    assertFalse(restarted.statuses().containsKey("c"));
  }
}
