package org.waabox.axis.event;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The handle of one live subscriber: a bounded message queue registered
 * with an {@link EventHub}.
 *
 * <p>A reader task drains the queue with {@link #poll(Duration)} until its
 * connection is cancelled, then closes the subscription. Closing is
 * idempotent and deregisters the queue from the hub.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Subscription implements AutoCloseable {

  /** The pending messages. */
  private final BlockingQueue<PushMessage> queue;

  /** The hub this subscription is registered with. */
  private final EventHub hub;

  /** Whether this subscription was closed. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new subscription.
   *
   * @param theHub   the owning hub, never null
   * @param capacity the queue capacity, greater than zero
   */
  Subscription(final EventHub theHub, final int capacity) {
    hub = Objects.requireNonNull(theHub, "hub cannot be null");
    queue = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Queues a message without blocking.
   *
   * @param message the message, never null
   *
   * @return false if the queue is full or the subscription is closed
   */
  public boolean offer(final PushMessage message) {
    Objects.requireNonNull(message, "message cannot be null");
    if (closed.get()) {
      return false;
    }
    return queue.offer(message);
  }

  /**
   * Waits up to the given timeout for the next message.
   *
   * @param timeout the maximum wait, never null
   *
   * @return the message, or empty if none arrived in time
   *
   * @throws InterruptedException if the reader is interrupted while waiting
   */
  public Optional<PushMessage> poll(final Duration timeout)
      throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    return Optional.ofNullable(
        queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Returns the number of queued, unread messages.
   *
   * @return the queue size
   */
  public int pending() {
    return queue.size();
  }

  /**
   * Whether this subscription was closed.
   *
   * @return true once closed
   */
  public boolean isClosed() {
    return closed.get();
  }

  /** Deregisters from the hub and discards pending messages. */
  @Override
  public void close() {
    hub.unsubscribe(this);
  }

  /**
   * Marks this subscription closed and drops its messages. Called by the
   * hub on removal.
   */
  void discard() {
    closed.set(true);
    queue.clear();
  }
}
