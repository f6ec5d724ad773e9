package org.waabox.axis.metrics;

import java.time.Duration;

import org.waabox.axis.event.EventKind;

/**
 * An abstraction for recording operational metrics of the dashboard core.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopDashboardMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DashboardMetrics {

  /**
   * Records a successful registry refresh.
   *
   * @param itemCount the number of items fetched
   * @param elapsed   the time spent in the refresh, never null
   */
  void refreshCompleted(int itemCount, Duration elapsed);

  /**
   * Records a failed registry refresh.
   *
   * @param cause the provider failure, never null
   */
  void refreshFailed(Throwable cause);

  /**
   * Records an event that a subscriber missed because its queue was full.
   *
   * @param kind the kind of the dropped event, never null
   */
  void eventDropped(EventKind kind);

  /**
   * Records a durable write that failed and was ignored.
   *
   * @param key   the state key being written, never null
   * @param cause the failure, never null
   */
  void persistenceFailed(String key, Throwable cause);
}
