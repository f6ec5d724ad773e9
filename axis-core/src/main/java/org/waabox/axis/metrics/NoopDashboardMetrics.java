package org.waabox.axis.metrics;

import java.time.Duration;

import org.waabox.axis.event.EventKind;

/**
 * A {@link DashboardMetrics} that records nothing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopDashboardMetrics implements DashboardMetrics {

  /** {@inheritDoc} */
  @Override
  public void refreshCompleted(final int itemCount, final Duration elapsed) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshFailed(final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void eventDropped(final EventKind kind) {
  }

  /** {@inheritDoc} */
  @Override
  public void persistenceFailed(final String key, final Throwable cause) {
  }
}
