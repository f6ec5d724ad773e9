package org.waabox.axis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.axis.event.EventKind;
import org.waabox.axis.event.PushMessage;
import org.waabox.axis.event.Subscription;
import org.waabox.axis.model.ItemContent;
import org.waabox.axis.model.ItemDetail;
import org.waabox.axis.model.ItemKind;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.persistence.InMemoryStateStore;
import org.waabox.axis.persistence.PersistenceException;
import org.waabox.axis.persistence.StateStore;
import org.waabox.axis.provider.FakeItemProvider;
import org.waabox.axis.provider.ProviderException;

/**
 * Tests for {@link Dashboard}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DashboardTest {

  private final List<String> launched = new CopyOnWriteArrayList<>();

  private FakeItemProvider provider;

  private InMemoryStateStore durable;

  private Dashboard dashboard;

  private Subscription events;

  @BeforeEach
  void setUp() {
    provider = new FakeItemProvider();
    provider.items(
        RegistryItem.of("n1", ItemKind.NOTE, "Groceries", "milk"),
        RegistryItem.of("d1", ItemKind.DOCUMENT, "Plan", "q3"));
    durable = new InMemoryStateStore();
    dashboard = Dashboard.builder(provider)
        .stateStore(durable)
        .launcher(launched::add)
        .config(AxisConfig.create(Duration.ofMinutes(5), Duration.ofHours(1),
            60, 50, null))
        .build();
    events = dashboard.hub().subscribe();
  }

  @AfterEach
  void tearDown() {
    dashboard.stop();
  }

  @Test
  void whenReadingRegistry_givenFreshStart_shouldDecorateNotesOnly() {
    final List<RegistryItem> items = dashboard.registry(false);

    assertEquals(2, items.size());
    assertEquals(ItemStatus.PENDING, items.get(0).status());
    assertNull(items.get(1).status());
    assertEquals(Map.of("n1", "Pending"), durable.loadStatuses());
  }

  @Test
  void whenForcingRefresh_givenAutoMode_shouldServeCache() throws Exception {
    dashboard.registry(false);
    drain();

    dashboard.registry(true);

    assertEquals(1, provider.listCalls());
    assertTrue(drain().isEmpty());
  }

  @Test
  void whenForcingRefresh_givenManualMode_shouldRefreshAndBroadcast()
      throws Exception {
    dashboard.registry(false);
    dashboard.switchMode("MANUAL");
    drain();

    dashboard.registry(true);

    assertEquals(2, provider.listCalls());
    assertEquals(List.of(EventKind.SNAPSHOT), kinds(drain()));
  }

  @Test
  void whenReadingContent_givenUncachedEmptyNote_shouldFillDefaults()
      throws Exception {
    provider.detail(new ItemDetail("n9", ItemKind.NOTE, "  ", "  \n "));

    final ItemContent content = dashboard.content(" n9 ");

    assertEquals("n9", content.id());
    assertEquals(Dashboard.EMPTY_CONTENT, content.content());
    assertEquals(ItemStatus.PENDING, content.status());

    final RegistryItem cached = dashboard.registry(false).get(0);
    assertEquals("n9", cached.id());
    assertEquals(Dashboard.UNTITLED, cached.title());
    assertEquals(Dashboard.NOTE_SNIPPET, cached.snippet());
    assertEquals(0, provider.listCalls());

    assertEquals(List.of(EventKind.STATUS_CHANGED, EventKind.SNAPSHOT),
        kinds(drain()));
  }

  @Test
  void whenReadingContent_givenCachedNote_shouldKeepSnippetAndNotBroadcast()
      throws Exception {
    dashboard.registry(false);
    dashboard.setStatus("n1", "Active");
    drain();
    provider.detail(new ItemDetail("n1", ItemKind.NOTE, "Groceries v2",
        " milk, eggs "));

    final ItemContent content = dashboard.content("n1");

    assertEquals("milk, eggs", content.content());
    assertEquals(ItemStatus.ACTIVE, content.status());
    final RegistryItem cached = dashboard.registry(false).get(0);
    assertEquals("Groceries v2", cached.title());
    assertEquals("milk", cached.snippet());
    assertTrue(drain().isEmpty());
  }

  @Test
  void whenReadingContent_givenDocument_shouldCarryNoStatus() {
    provider.detail(new ItemDetail("d1", ItemKind.DOCUMENT, "Plan",
        "Quarterly plan"));

    final ItemContent content = dashboard.content("d1");

    assertEquals("Quarterly plan", content.content());
    assertNull(content.status());
    assertTrue(durable.loadStatuses().isEmpty());
  }

  @Test
  void whenReadingContent_givenBlankOrUnknownId_shouldThrow() {
    assertThrows(ValidationException.class, () -> dashboard.content("  "));
    assertThrows(ValidationException.class, () -> dashboard.content(null));
    assertThrows(ProviderException.class, () -> dashboard.content("nope"));
  }

  @Test
  void whenSettingStatus_givenCachedNote_shouldAnnounceAndBroadcast()
      throws Exception {
    dashboard.registry(false);
    drain();

    final ItemStatus stored = dashboard.setStatus("n1", "Review");

    assertEquals(ItemStatus.REVIEW, stored);
    assertEquals("Review", durable.loadStatuses().get("n1"));
    final List<PushMessage> messages = drain();
    assertEquals(List.of(EventKind.STATUS_CHANGED, EventKind.SNAPSHOT),
        kinds(messages));
    assertEquals("{\"id\":\"n1\",\"status\":\"Review\","
        + "\"title\":\"Groceries\"}", messages.get(0).data());
  }

  @Test
  void whenSettingStatus_givenUnknownItem_shouldOnlyBroadcast()
      throws Exception {
    dashboard.registry(false);
    drain();

    dashboard.setStatus("ghost", "Blocked");

    assertEquals(List.of(EventKind.SNAPSHOT), kinds(drain()));
  }

  @Test
  void whenSettingStatus_givenMissingOrInvalidInput_shouldReject() {
    assertThrows(ValidationException.class,
        () -> dashboard.setStatus("", "Active"));
    assertThrows(ValidationException.class,
        () -> dashboard.setStatus("n1", ""));
    assertThrows(ValidationException.class,
        () -> dashboard.setStatus("n1", "active"));
    assertTrue(durable.loadStatuses().isEmpty());
  }

  @Test
  void whenChangingStatus_givenCachedDocument_shouldRejectWithoutRecord()
      throws Exception {
    dashboard.registry(false);
    drain();

    final ValidationException e = assertThrows(ValidationException.class,
        () -> dashboard.setStatus("d1", "Active"));
    assertThrows(ValidationException.class,
        () -> dashboard.cycleStatus("d1", "forward"));

    assertEquals("document items have no status: d1", e.getMessage());
    assertFalse(durable.loadStatuses().containsKey("d1"));
    assertTrue(drain().isEmpty());
  }

  @Test
  void whenCycling_givenDirections_shouldStepAndPersist() {
    dashboard.setStatus("n1", "Active");

    assertEquals(ItemStatus.BLOCKED, dashboard.cycleStatus("n1", null));
    assertEquals(ItemStatus.ACTIVE, dashboard.cycleStatus("n1", "back"));
    assertEquals(ItemStatus.BLOCKED, dashboard.cycleStatus("n1", "forward"));
    assertEquals("Blocked", durable.loadStatuses().get("n1"));
  }

  @Test
  void whenCycling_givenInvalidDirection_shouldReject() {
    final ValidationException e = assertThrows(ValidationException.class,
        () -> dashboard.cycleStatus("n1", "sideways"));
    assertEquals("invalid direction: sideways", e.getMessage());
  }

  @Test
  void whenSwitchingMode_givenExactName_shouldPersist() {
    assertEquals(Mode.AUTO, dashboard.mode());

    assertEquals(Mode.MANUAL, dashboard.switchMode("MANUAL"));

    assertEquals(Mode.MANUAL, dashboard.mode());
    assertEquals(Optional.of(Mode.MANUAL), durable.loadMode());
    assertThrows(ValidationException.class,
        () -> dashboard.switchMode("manual"));
    assertEquals(Mode.MANUAL, dashboard.mode());
  }

  @Test
  void whenDeleting_givenAutoMode_shouldRefuse() {
    assertThrows(AuthorizationException.class, () -> dashboard.delete("n1"));
    assertTrue(provider.deleted().isEmpty());
  }

  @Test
  void whenDeleting_givenManualMode_shouldRemoveAndBroadcast()
      throws Exception {
    dashboard.registry(false);
    dashboard.switchMode("MANUAL");
    drain();

    dashboard.delete("n1");

    assertEquals(List.of("n1"), provider.deleted());
    assertEquals(List.of("d1"), ids(dashboard.registry(false)));
    assertFalse(durable.loadStatuses().containsKey("n1"));
    final List<PushMessage> messages = drain();
    assertEquals(List.of(EventKind.SNAPSHOT), kinds(messages));
    assertFalse(messages.get(0).data().contains("n1"));
  }

  @Test
  void whenDeleting_givenProviderOutage_shouldPropagate() {
    dashboard.switchMode("MANUAL");
    provider.failing(true);

    assertThrows(ProviderException.class, () -> dashboard.delete("n1"));
  }

  @Test
  void whenDispatching_givenMode_shouldRequireManual() {
    assertThrows(AuthorizationException.class,
        () -> dashboard.dispatchAutomation("triage"));
    assertTrue(launched.isEmpty());

    dashboard.switchMode("MANUAL");
    dashboard.dispatchAutomation("triage");

    assertEquals(List.of("triage"), launched);
  }

  @Test
  void whenSubscribing_givenItems_shouldReceiveInitialSnapshot()
      throws Exception {
    dashboard.registry(false);

    try (Subscription subscription = dashboard.subscribe()) {
      final PushMessage message =
          subscription.poll(Duration.ofSeconds(5)).orElseThrow();

      assertEquals(EventKind.SNAPSHOT, message.kind());
      assertTrue(message.data().startsWith("[{\"id\":\"n1\""));
    }
  }

  @Test
  void whenStarting_givenPersistedState_shouldRestoreIt() {
    durable.saveMode(Mode.MANUAL);
    durable.saveStatus("n1", "Complete");

    dashboard.start();

    assertEquals(Mode.MANUAL, dashboard.mode());
    assertEquals(ItemStatus.COMPLETE, dashboard.registry(false).get(0).status());
    assertThrows(IllegalStateException.class, () -> dashboard.start());
  }

  @Test
  void whenStarting_givenUnreadableStatuses_shouldFailAndKeepStoredRecords() {
    durable.saveStatus("n1", "Active");
    final AtomicBoolean unreadable = new AtomicBoolean(true);
    final StateStore flaky = new StateStore() {
      @Override
      public Optional<Mode> loadMode() {
        return durable.loadMode();
      }

      @Override
      public void saveMode(final Mode mode) {
        durable.saveMode(mode);
      }

      @Override
      public Map<String, String> loadStatuses() {
        if (unreadable.get()) {
          throw new PersistenceException("corrupt status record",
              new IOException("malformed input"));
        }
        return durable.loadStatuses();
      }

      @Override
      public void saveStatus(final String id, final String status) {
        durable.saveStatus(id, status);
      }

      @Override
      public void deleteStatus(final String id) {
        durable.deleteStatus(id);
      }
    };
    final Dashboard restarted = Dashboard.builder(provider)
        .stateStore(flaky)
        .launcher(launched::add)
        .config(AxisConfig.create(Duration.ofMinutes(5), Duration.ofHours(1),
            60, 50, null))
        .build();

    try {
      assertThrows(PersistenceException.class, restarted::start);
      assertEquals("Active", durable.loadStatuses().get("n1"));

      unreadable.set(false);
      restarted.start();

      assertEquals(ItemStatus.ACTIVE,
          restarted.registry(false).get(0).status());
      assertEquals("Active", durable.loadStatuses().get("n1"));
    } finally {
      restarted.stop();
    }
  }

  private List<PushMessage> drain() throws InterruptedException {
    final List<PushMessage> messages = new ArrayList<>();
    Optional<PushMessage> next = events.poll(Duration.ZERO);
    while (next.isPresent()) {
      messages.add(next.get());
      next = events.poll(Duration.ZERO);
    }
    return messages;
  }

  private static List<EventKind> kinds(final List<PushMessage> messages) {
    final List<EventKind> kinds = new ArrayList<>();
    for (final PushMessage message : messages) {
      kinds.add(message.kind());
    }
    return kinds;
  }

  private static List<String> ids(final List<RegistryItem> items) {
    final List<String> ids = new ArrayList<>();
    for (final RegistryItem item : items) {
      ids.add(item.id());
    }
    return ids;
  }
}
