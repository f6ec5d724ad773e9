package org.waabox.axis.event;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.metrics.DashboardMetrics;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.RegistryItem;

/**
 * Fans out push events to every live subscriber.
 *
 * <p>Delivery is best effort and at most once. {@link #publish} serializes
 * the payload once and offers it to each subscriber queue without blocking;
 * a subscriber whose queue is full misses that event. A stalled dashboard
 * tab therefore never delays the publisher or the other tabs.
 *
 * <p>Thread safety: this class is thread-safe. The subscriber set is a
 * {@link CopyOnWriteArraySet}, so publishing iterates a stable view while
 * subscribers come and go.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventHub {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(EventHub.class);

  /** The registered subscribers. */
  private final Set<Subscription> subscribers = new CopyOnWriteArraySet<>();

  /** The queue capacity of every new subscription. */
  private final int capacity;

  /** The metrics reporter, never null. */
  private final DashboardMetrics metrics;

  /**
   * Creates a new hub.
   *
   * @param theCapacity the per-subscriber queue capacity, greater than zero
   * @param theMetrics  the metrics reporter, never null
   */
  public EventHub(final int theCapacity, final DashboardMetrics theMetrics) {
    if (theCapacity <= 0) {
      throw new IllegalArgumentException(
          "capacity must be greater than 0, got: " + theCapacity);
    }
    Objects.requireNonNull(theMetrics, "metrics cannot be null");
    capacity = theCapacity;
    metrics = theMetrics;
  }

  /**
   * Registers a new subscriber.
   *
   * @return the subscription handle, never null
   */
  public Subscription subscribe() {
    final Subscription subscription = new Subscription(this, capacity);
    subscribers.add(subscription);
    log.debug("Subscriber registered, {} active", subscribers.size());
    return subscription;
  }

  /**
   * Removes a subscriber and discards its queue. Removing an unknown or
   * already removed subscription is a no-op.
   *
   * @param subscription the handle returned by {@link #subscribe()},
   *                     never null
   */
  public void unsubscribe(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription cannot be null");
    if (subscribers.remove(subscription)) {
      subscription.discard();
      log.debug("Subscriber removed, {} active", subscribers.size());
    }
  }

  /**
   * Returns the number of registered subscribers.
   *
   * @return the subscriber count
   */
  public int subscriberCount() {
    return subscribers.size();
  }

  /**
   * Serializes the payload and offers it to every subscriber.
   *
   * <p>If the payload cannot be serialized the failure is logged and this
   * broadcast is skipped.
   *
   * @param kind    the event kind, never null
   * @param payload the payload, a tree node or any Jackson-serializable
   *                value
   *
   * @return the number of subscribers that accepted the event
   */
  public int publish(final EventKind kind, final Object payload) {
    Objects.requireNonNull(kind, "kind cannot be null");

    final String data;
    try {
      data = PushEventCodec.encode(payload);
    } catch (final JsonProcessingException e) {
      log.error("Failed to serialize {} event, broadcast skipped",
          kind.wireName(), e);
      return 0;
    }

    final PushMessage message = new PushMessage(kind, data);
    int delivered = 0;
    for (final Subscription subscription : subscribers) {
      if (subscription.offer(message)) {
        delivered++;
      } else {
        log.debug("Subscriber queue full, dropped {} event",
            kind.wireName());
        metrics.eventDropped(kind);
      }
    }
    return delivered;
  }

  /**
   * Publishes the full decorated item list.
   *
   * @param items the decorated items, never null
   *
   * @return the number of subscribers that accepted the event
   */
  public int publishSnapshot(final List<RegistryItem> items) {
    return publish(EventKind.SNAPSHOT, PushEventCodec.items(items));
  }

  /**
   * Publishes the auto-refresh countdown.
   *
   * @param secondsRemaining the seconds left before the next refresh
   *
   * @return the number of subscribers that accepted the event
   */
  public int publishTick(final int secondsRemaining) {
    return publish(EventKind.TICK, PushEventCodec.tick(secondsRemaining));
  }

  /**
   * Publishes a status change of one item.
   *
   * @param id     the item id, never null
   * @param status the new status, never null
   * @param title  the item title, never null
   *
   * @return the number of subscribers that accepted the event
   */
  public int publishStatusChanged(final String id, final ItemStatus status,
      final String title) {
    return publish(EventKind.STATUS_CHANGED,
        PushEventCodec.statusChanged(id, status, title));
  }

  /**
   * Publishes an automation launch outcome.
   *
   * @param state the state name, {@code started} or {@code error}
   * @param task  the task text, never null
   * @param error the failure message, null on success
   *
   * @return the number of subscribers that accepted the event
   */
  public int publishAutomation(final String state, final String task,
      final String error) {
    return publish(EventKind.AUTOMATION,
        PushEventCodec.automation(state, task, error));
  }
}
