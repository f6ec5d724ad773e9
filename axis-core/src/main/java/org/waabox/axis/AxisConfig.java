package org.waabox.axis;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tuning of the dashboard core.
 *
 * <p>Instances are created via the static factory methods {@link #create()}
 * and {@link #create(Duration, Duration, int, int, Path)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AxisConfig {

  /** Default freshness window of the item cache (5 minutes). */
  private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

  /** Default period of the poller (1 second). */
  private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

  /** Default countdown length, in poller periods. */
  private static final int DEFAULT_AUTO_REFRESH_TICKS = 60;

  /** Default per-subscriber queue capacity. */
  private static final int DEFAULT_SUBSCRIBER_CAPACITY = 10;

  /** Default location of the legacy state file. */
  private static final Path DEFAULT_LEGACY_STATE_FILE =
      Path.of("axis.state.json");

  /** The cache freshness window, never null. */
  private final Duration cacheTtl;

  /** The poller period, never null. */
  private final Duration pollInterval;

  /** The countdown length. */
  private final int autoRefreshTicks;

  /** The per-subscriber queue capacity. */
  private final int subscriberCapacity;

  /** The legacy state file, null when migration is disabled. */
  private final Path legacyStateFile;

  /** Private constructor; use static factories.
   *
   * @param theCacheTtl           the cache freshness window
   * @param thePollInterval       the poller period
   * @param theAutoRefreshTicks   the countdown length
   * @param theSubscriberCapacity the subscriber queue capacity
   * @param theLegacyStateFile    the legacy state file, may be null
   */
  private AxisConfig(final Duration theCacheTtl,
      final Duration thePollInterval, final int theAutoRefreshTicks,
      final int theSubscriberCapacity, final Path theLegacyStateFile) {
    cacheTtl = theCacheTtl;
    pollInterval = thePollInterval;
    autoRefreshTicks = theAutoRefreshTicks;
    subscriberCapacity = theSubscriberCapacity;
    legacyStateFile = theLegacyStateFile;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param cacheTtl           the cache freshness window, must be positive
   * @param pollInterval       the poller period, must be positive
   * @param autoRefreshTicks   the countdown length, greater than zero
   * @param subscriberCapacity the subscriber queue capacity, greater than
   *                           zero
   * @param legacyStateFile    the legacy state file, null to skip the
   *                           migration
   *
   * @return a new configuration instance, never null
   */
  public static AxisConfig create(final Duration cacheTtl,
      final Duration pollInterval, final int autoRefreshTicks,
      final int subscriberCapacity, final Path legacyStateFile) {
    Objects.requireNonNull(cacheTtl, "cacheTtl cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");

    if (cacheTtl.isZero() || cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must be positive");
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (autoRefreshTicks <= 0) {
      throw new IllegalArgumentException(
          "autoRefreshTicks must be greater than 0");
    }
    if (subscriberCapacity <= 0) {
      throw new IllegalArgumentException(
          "subscriberCapacity must be greater than 0");
    }

    return new AxisConfig(cacheTtl, pollInterval, autoRefreshTicks,
        subscriberCapacity, legacyStateFile);
  }

  /**
   * Creates a configuration with default values.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Cache TTL: 5 minutes</li>
   *   <li>Poll interval: 1 second</li>
   *   <li>Auto-refresh ticks: 60</li>
   *   <li>Subscriber capacity: 10</li>
   *   <li>Legacy state file: {@code axis.state.json} in the working
   *       directory</li>
   * </ul>
   *
   * @return a new configuration instance, never null
   */
  public static AxisConfig create() {
    return create(DEFAULT_CACHE_TTL, DEFAULT_POLL_INTERVAL,
        DEFAULT_AUTO_REFRESH_TICKS, DEFAULT_SUBSCRIBER_CAPACITY,
        DEFAULT_LEGACY_STATE_FILE);
  }

  /**
   * Returns the cache freshness window.
   *
   * @return the TTL, never null
   */
  public Duration cacheTtl() {
    return cacheTtl;
  }

  /**
   * Returns the poller period.
   *
   * @return the interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns the countdown length, in poller periods.
   *
   * @return the tick count
   */
  public int autoRefreshTicks() {
    return autoRefreshTicks;
  }

  /**
   * Returns the per-subscriber queue capacity.
   *
   * @return the capacity
   */
  public int subscriberCapacity() {
    return subscriberCapacity;
  }

  /**
   * Returns the legacy state file.
   *
   * @return the file, or empty when migration is disabled
   */
  public Optional<Path> legacyStateFile() {
    return Optional.ofNullable(legacyStateFile);
  }
}
