package org.waabox.axis;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.automation.AutomationGateway;
import org.waabox.axis.automation.LaunchException;
import org.waabox.axis.automation.ProcessTaskLauncher;
import org.waabox.axis.automation.TaskLauncher;
import org.waabox.axis.cache.SnapshotCache;
import org.waabox.axis.event.EventHub;
import org.waabox.axis.event.EventKind;
import org.waabox.axis.event.PushEventCodec;
import org.waabox.axis.event.PushMessage;
import org.waabox.axis.event.Subscription;
import org.waabox.axis.metrics.DashboardMetrics;
import org.waabox.axis.metrics.NoopDashboardMetrics;
import org.waabox.axis.model.CycleDirection;
import org.waabox.axis.model.ItemContent;
import org.waabox.axis.model.ItemDetail;
import org.waabox.axis.model.ItemKind;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.persistence.InMemoryStateStore;
import org.waabox.axis.persistence.PersistenceException;
import org.waabox.axis.persistence.PersistenceGateway;
import org.waabox.axis.persistence.StateStore;
import org.waabox.axis.provider.ItemProvider;
import org.waabox.axis.provider.ProviderException;
import org.waabox.axis.schedule.Poller;
import org.waabox.axis.status.StatusStore;

/**
 * Main entry point of the dashboard core.
 *
 * <p>Wires the status table, the item cache, the event hub, the poller and
 * the automation gateway around one {@link ItemProvider} and one
 * {@link StateStore}, and exposes the operations a transport binds to.
 * Mode policies live here: deleting items and dispatching automation
 * require {@link Mode#MANUAL}.
 *
 * <p>Usage:
 * <pre>{@code
 * Dashboard dashboard = Dashboard.builder(provider)
 *     .stateStore(store)
 *     .build();
 * dashboard.start();
 * List<RegistryItem> items = dashboard.registry(false);
 * dashboard.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Dashboard {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(Dashboard.class);

  /** Content returned for an item whose body is blank. */
  static final String EMPTY_CONTENT = "No body content.";

  /** Title given to a note whose title is blank. */
  static final String UNTITLED = "Untitled";

  /** Snippet given to a note that is cached from its detail only. */
  static final String NOTE_SNIPPET = "Note";

  /** The upstream item source. */
  private final ItemProvider provider;

  /** The durable mirror. */
  private final PersistenceGateway persistence;

  /** The status table and mode. */
  private final StatusStore statusStore;

  /** The subscriber fan-out. */
  private final EventHub hub;

  /** The item cache. */
  private final SnapshotCache cache;

  /** The auto-refresh loop. */
  private final Poller poller;

  /** The automation launcher. */
  private final AutomationGateway automation;

  /** Runs the initial snapshot of new subscribers. */
  private final ExecutorService initialSnapshots;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new dashboard.
   *
   * @param theProvider   the item source
   * @param theStateStore the durable store
   * @param theLauncher   the automation launcher
   * @param theMetrics    the metrics reporter
   * @param theConfig     the configuration
   * @param theClock      the time source of the cache
   */
  private Dashboard(final ItemProvider theProvider,
      final StateStore theStateStore, final TaskLauncher theLauncher,
      final DashboardMetrics theMetrics, final AxisConfig theConfig,
      final Clock theClock) {
    provider = theProvider;
    persistence = new PersistenceGateway(theStateStore,
        theConfig.legacyStateFile().orElse(null), theMetrics);
    statusStore = new StatusStore(persistence);
    hub = new EventHub(theConfig.subscriberCapacity(), theMetrics);
    cache = new SnapshotCache(theProvider, statusStore, hub,
        theConfig.cacheTtl(), theClock, theMetrics);
    poller = new Poller(cache, statusStore, hub,
        theConfig.autoRefreshTicks(), theConfig.pollInterval());
    automation = new AutomationGateway(theLauncher, hub);

    final AtomicInteger threadCount = new AtomicInteger();
    initialSnapshots = Executors.newCachedThreadPool(r -> {
      final Thread thread = new Thread(r,
          "axis-initial-snapshot-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Creates a new builder.
   *
   * @param provider the item source, never null
   *
   * @return a new builder, never null
   */
  public static Builder builder(final ItemProvider provider) {
    return new Builder(provider);
  }

  /**
   * Restores the persisted state, migrating the legacy file first if there
   * is one, and starts the poller.
   *
   * @throws IllegalStateException if already started
   * @throws PersistenceException  if the durable state cannot be read; the
   *                               dashboard stays unstarted and may be
   *                               started again
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Dashboard has already been started");
    }
    try {
      statusStore.restore(persistence.loadInitialState());
    } catch (final PersistenceException e) {
      started.set(false);
      throw e;
    }
    poller.start();
    log.info("Dashboard started in {} mode", statusStore.mode());
  }

  /** Stops the poller and the initial snapshot workers. */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    poller.stop();
    initialSnapshots.shutdown();
    try {
      if (!initialSnapshots.awaitTermination(5, TimeUnit.SECONDS)) {
        initialSnapshots.shutdownNow();
      }
    } catch (final InterruptedException e) {
      initialSnapshots.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("Dashboard stopped");
  }

  /**
   * Returns the decorated item list.
   *
   * <p>In {@link Mode#MANUAL} a forced refresh fetches the list and
   * broadcasts it first; in {@link Mode#AUTO} the flag is ignored. A stale
   * or empty cache is refreshed before serving; if that fails the cached
   * items are served anyway.
   *
   * @param forceRefresh whether the caller asked for a fresh fetch
   *
   * @return the decorated items, never null
   */
  public List<RegistryItem> registry(final boolean forceRefresh) {
    if (forceRefresh && statusStore.mode() == Mode.MANUAL) {
      cache.refreshQuietly();
      cache.broadcastSnapshot();
    }
    return cache.decorate(cache.readOrRefresh());
  }

  /**
   * Fetches the full content of one item.
   *
   * <p>A note is upserted into the cache, getting a {@code Pending} status
   * if it has none; a snapshot is broadcast when it was not cached before.
   *
   * @param id the item id, surrounding whitespace is ignored
   *
   * @return the content, with a status for notes only, never null
   *
   * @throws ValidationException if the id is blank
   * @throws ProviderException   if the provider fails
   */
  public ItemContent content(final String id) {
    final String trimmed = id == null ? "" : id.trim();
    if (trimmed.isEmpty()) {
      throw new ValidationException("missing id");
    }

    final ItemDetail detail = provider.getDetail(trimmed);
    final String itemId = detail.id().isBlank() ? trimmed : detail.id();

    String content = detail.content().trim();
    if (content.isEmpty()) {
      content = EMPTY_CONTENT;
    }

    if (detail.kind() != ItemKind.NOTE) {
      return new ItemContent(itemId, content, null);
    }

    final String title = detail.title().isBlank()
        ? UNTITLED : detail.title().trim();
    final String snippet = cache.find(itemId)
        .map(RegistryItem::snippet).orElse(NOTE_SNIPPET);
    if (cache.upsertSingle(RegistryItem.of(itemId, ItemKind.NOTE, title,
        snippet))) {
      cache.broadcastSnapshot();
    }
    return new ItemContent(itemId, content, statusStore.get(itemId));
  }

  /**
   * Sets the status of an item from its wire value.
   *
   * <p>Publishes a status change when the item's title is known, then
   * broadcasts the snapshot.
   *
   * @param id     the item id, never empty
   * @param status the status, one of the seven lifecycle values
   *
   * @return the stored status, never null
   *
   * @throws ValidationException if the id or status is missing, the status
   *                             is not recognized or the item is cached as a
   *                             kind without status; nothing changes
   */
  public ItemStatus setStatus(final String id, final String status) {
    if (id == null || id.isEmpty() || status == null || status.isEmpty()) {
      throw new ValidationException("missing id or status");
    }
    requireStatusTracked(id);
    final ItemStatus stored = statusStore.set(id, status);
    cache.titleOf(id)
        .filter(title -> !title.isEmpty())
        .ifPresent(title -> hub.publishStatusChanged(id, stored, title));
    cache.broadcastSnapshot();
    return stored;
  }

  /**
   * Moves the status of an item one step along the lifecycle.
   *
   * @param id        the item id, never empty
   * @param direction {@code forward} or {@code back}; blank means forward
   *
   * @return the stored status, never null
   *
   * @throws ValidationException if the id is missing, the direction is
   *                             not recognized or the item is cached as a
   *                             kind without status
   */
  public ItemStatus cycleStatus(final String id, final String direction) {
    if (id == null || id.isEmpty()) {
      throw new ValidationException("missing id");
    }
    requireStatusTracked(id);
    final CycleDirection parsed;
    if (direction == null || direction.isBlank()) {
      parsed = CycleDirection.FORWARD;
    } else {
      try {
        parsed = CycleDirection.fromValue(direction);
      } catch (final IllegalArgumentException e) {
        throw new ValidationException("invalid direction: " + direction);
      }
    }
    return setStatus(id, statusStore.cycle(id, parsed).value());
  }

  /**
   * Returns the current operating mode.
   *
   * @return the mode, never null
   */
  public Mode mode() {
    return statusStore.mode();
  }

  /**
   * Switches the operating mode.
   *
   * @param value {@code AUTO} or {@code MANUAL}
   *
   * @return the new mode, never null
   *
   * @throws ValidationException if the value is not a mode name
   */
  public Mode switchMode(final String value) {
    final Mode mode = Mode.parse(value).orElseThrow(
        () -> new ValidationException("invalid mode: " + value));
    statusStore.setMode(mode);
    return mode;
  }

  /**
   * Deletes an item upstream, then refreshes and broadcasts the list.
   *
   * @param id the item id, never empty
   *
   * @throws ValidationException    if the id is missing
   * @throws AuthorizationException unless in {@link Mode#MANUAL}
   * @throws ProviderException      if the provider fails to delete
   */
  public void delete(final String id) {
    if (id == null || id.isEmpty()) {
      throw new ValidationException("missing id");
    }
    requireManual("delete");
    provider.delete(id);
    log.info("Deleted item '{}'", id);
    cache.refreshQuietly();
    cache.broadcastSnapshot();
  }

  /**
   * Launches an automation task.
   *
   * @param task the task text, must not be blank
   *
   * @throws AuthorizationException unless in {@link Mode#MANUAL}
   * @throws ValidationException    if the task is blank
   * @throws LaunchException        if the executor could not be started
   */
  public void dispatchAutomation(final String task) {
    requireManual("automation dispatch");
    automation.dispatch(task);
  }

  /**
   * Registers a subscriber and queues it the current decorated snapshot in
   * the background. No snapshot is queued when there are no items.
   *
   * @return the subscription, never null; the caller closes it
   */
  public Subscription subscribe() {
    final Subscription subscription = hub.subscribe();
    try {
      initialSnapshots.execute(() -> sendInitialSnapshot(subscription));
    } catch (final RejectedExecutionException e) {
      log.debug("Dashboard stopped, no initial snapshot for new subscriber");
    }
    return subscription;
  }

  /**
   * Returns the event hub.
   *
   * @return the hub, never null
   */
  EventHub hub() {
    return hub;
  }

  /**
   * Returns the auto-refresh loop.
   *
   * @return the poller, never null
   */
  Poller poller() {
    return poller;
  }

  /**
   * Fails when the item is cached as a document or sheet. Ids not in the
   * cache are accepted.
   *
   * @param id the item id, never null
   */
  private void requireStatusTracked(final String id) {
    cache.find(id)
        .filter(item -> !item.kind().tracksStatus())
        .ifPresent(item -> {
          throw new ValidationException(item.kind().value()
              + " items have no status: " + id);
        });
  }

  /**
   * Fails unless the dashboard is in {@link Mode#MANUAL}.
   *
   * @param action the guarded action, for the message
   */
  private void requireManual(final String action) {
    if (statusStore.mode() != Mode.MANUAL) {
      throw new AuthorizationException(action, Mode.MANUAL);
    }
  }

  /**
   * Queues the decorated snapshot to one subscriber.
   *
   * @param subscription the new subscriber, never null
   */
  private void sendInitialSnapshot(final Subscription subscription) {
    final List<RegistryItem> items = cache.readOrRefresh();
    if (items.isEmpty()) {
      return;
    }
    final String data;
    try {
      data = PushEventCodec.encode(PushEventCodec.items(
          cache.decorate(items)));
    } catch (final JsonProcessingException e) {
      log.error("Failed to serialize the initial snapshot", e);
      return;
    }
    if (!subscription.offer(new PushMessage(EventKind.SNAPSHOT, data))) {
      log.debug("Initial snapshot not queued, subscriber full or closed");
    }
  }

  /**
   * Builder for creating {@link Dashboard} instances.
   *
   * <p>Defaults: an {@link InMemoryStateStore}, the {@code copilot}
   * {@link ProcessTaskLauncher}, {@link NoopDashboardMetrics},
   * {@link AxisConfig#create()} and the UTC system clock.
   */
  public static final class Builder {

    /** The item source. */
    private final ItemProvider provider;

    /** The optional durable store. */
    private StateStore stateStore;

    /** The optional automation launcher. */
    private TaskLauncher launcher;

    /** The optional metrics reporter. */
    private DashboardMetrics metrics;

    /** The optional configuration. */
    private AxisConfig config;

    /** The optional clock. */
    private Clock clock;

    /**
     * Creates a new builder.
     *
     * @param theProvider the item source, never null
     */
    private Builder(final ItemProvider theProvider) {
      Objects.requireNonNull(theProvider, "provider must not be null");
      provider = theProvider;
    }

    /**
     * Sets the durable store.
     *
     * @param theStateStore the store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder stateStore(final StateStore theStateStore) {
      Objects.requireNonNull(theStateStore, "stateStore must not be null");
      stateStore = theStateStore;
      return this;
    }

    /**
     * Sets the automation launcher.
     *
     * @param theLauncher the launcher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder launcher(final TaskLauncher theLauncher) {
      Objects.requireNonNull(theLauncher, "launcher must not be null");
      launcher = theLauncher;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final DashboardMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      metrics = theMetrics;
      return this;
    }

    /**
     * Sets the configuration.
     *
     * @param theConfig the configuration, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder config(final AxisConfig theConfig) {
      Objects.requireNonNull(theConfig, "config must not be null");
      config = theConfig;
      return this;
    }

    /**
     * Sets the clock used for cache expiry.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      clock = theClock;
      return this;
    }

    /**
     * Builds the dashboard. Unset options get their defaults.
     *
     * @return a new, not yet started dashboard, never null
     */
    public Dashboard build() {
      final StateStore resolvedStore = stateStore != null
          ? stateStore : new InMemoryStateStore();
      final TaskLauncher resolvedLauncher = launcher != null
          ? launcher : ProcessTaskLauncher.copilot();
      final DashboardMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopDashboardMetrics();
      final AxisConfig resolvedConfig = config != null
          ? config : AxisConfig.create();
      final Clock resolvedClock = clock != null
          ? clock : Clock.systemUTC();

      return new Dashboard(provider, resolvedStore, resolvedLauncher,
          resolvedMetrics, resolvedConfig, resolvedClock);
    }
  }
}
