package org.waabox.axis.schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.cache.SnapshotCache;
import org.waabox.axis.event.EventHub;
import org.waabox.axis.model.Mode;
import org.waabox.axis.provider.ProviderException;
import org.waabox.axis.status.StatusStore;

/**
 * The background loop that drives the auto-refresh countdown.
 *
 * <p>Every period the mode is sampled. In {@link Mode#MANUAL} the countdown
 * is reset and nothing is published. In {@link Mode#AUTO} the countdown is
 * decremented and published as a tick; when it reaches zero the cache is
 * refreshed, a snapshot is broadcast whether or not that refresh succeeded,
 * and the countdown starts over.
 *
 * <p>A failing iteration is logged and the loop keeps running until
 * {@link #stop()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Poller {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(Poller.class);

  /** The cache refreshed at the end of each countdown, never null. */
  private final SnapshotCache cache;

  /** The source of the current mode, never null. */
  private final StatusStore statusStore;

  /** The hub ticks are published to, never null. */
  private final EventHub hub;

  /** The countdown length, in periods. */
  private final int ticks;

  /** The period between iterations, never null. */
  private final Duration interval;

  /** The periods left before the next refresh. */
  private final AtomicInteger remaining;

  /** The scheduler that runs the loop, null until started. */
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a new poller.
   *
   * @param theCache       the cache to refresh, never null
   * @param theStatusStore the mode source, never null
   * @param theHub         the event hub, never null
   * @param theTicks       the countdown length, greater than zero
   * @param theInterval    the loop period, must be positive
   */
  public Poller(final SnapshotCache theCache, final StatusStore theStatusStore,
      final EventHub theHub, final int theTicks, final Duration theInterval) {
    Objects.requireNonNull(theCache, "cache cannot be null");
    Objects.requireNonNull(theStatusStore, "statusStore cannot be null");
    Objects.requireNonNull(theHub, "hub cannot be null");
    Objects.requireNonNull(theInterval, "interval cannot be null");
    if (theTicks <= 0) {
      throw new IllegalArgumentException(
          "ticks must be greater than 0, got: " + theTicks);
    }
    if (theInterval.isZero() || theInterval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive, got: "
          + theInterval);
    }
    cache = theCache;
    statusStore = theStatusStore;
    hub = theHub;
    ticks = theTicks;
    interval = theInterval;
    remaining = new AtomicInteger(theTicks);
  }

  /** Starts the loop on a daemon thread. */
  public void start() {
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "axis-poller");
      thread.setDaemon(true);
      return thread;
    });

    final long intervalMillis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::safeTick,
        intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

    log.info("Poller started, ticking every {} ms, refreshing every {} ticks",
        intervalMillis, ticks);
  }

  /** Stops the loop, waiting briefly for a running iteration. */
  public void stop() {
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (final InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
      log.info("Poller stopped");
    }
  }

  /**
   * Runs one iteration of the loop.
   *
   * @throws RuntimeException if a collaborator fails in an unexpected way;
   *                          a provider failure during the refresh is
   *                          absorbed
   */
  public void tick() {
    if (statusStore.mode() == Mode.MANUAL) {
      remaining.set(ticks);
      return;
    }

    final int left = remaining.decrementAndGet();
    hub.publishTick(left);

    if (left <= 0) {
      try {
        cache.refresh();
      } catch (final ProviderException e) {
        log.debug("Scheduled refresh failed, broadcasting cached items", e);
      }
      cache.broadcastSnapshot();
      remaining.set(ticks);
    }
  }

  /**
   * Returns the periods left before the next refresh.
   *
   * @return the countdown value
   */
  public int remaining() {
    return remaining.get();
  }

  /** Runs {@link #tick()}, logging any failure so the schedule survives. */
  private void safeTick() {
    try {
      tick();
    } catch (final RuntimeException e) {
      log.error("Poller iteration failed", e);
    }
  }
}
