package org.waabox.axis.server.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the dashboard HTTP server.
 *
 * <p>Holds the port to listen on and how long an event stream may stay idle
 * before a keep-alive comment is written to it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AxisHttpConfig {

  /** The default keep-alive interval of event streams (15 seconds). */
  private static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(15);

  /** The port to listen on, 0 for an ephemeral port. */
  private final int port;

  /** The idle interval after which a keep-alive comment is sent. */
  private final Duration keepAliveInterval;

  /** Private constructor; use the static factory methods instead. */
  private AxisHttpConfig(final int thePort,
      final Duration theKeepAliveInterval) {
    port = thePort;
    keepAliveInterval = theKeepAliveInterval;
  }

  /**
   * Creates a new configuration with the default keep-alive interval of
   * 15 seconds.
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @return a new {@link AxisHttpConfig} instance, never null
   */
  public static AxisHttpConfig create(final int port) {
    return create(port, DEFAULT_KEEP_ALIVE);
  }

  /**
   * Creates a new configuration.
   *
   * @param port              the port to listen on, 0 for an ephemeral port
   * @param keepAliveInterval the idle interval of event streams, must be
   *                          positive
   * @return a new {@link AxisHttpConfig} instance, never null
   */
  public static AxisHttpConfig create(final int port,
      final Duration keepAliveInterval) {
    Objects.requireNonNull(keepAliveInterval,
        "keepAliveInterval cannot be null");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
    if (keepAliveInterval.isZero() || keepAliveInterval.isNegative()) {
      throw new IllegalArgumentException(
          "keepAliveInterval must be positive");
    }
    return new AxisHttpConfig(port, keepAliveInterval);
  }

  /**
   * Returns the configured port.
   *
   * @return the port, 0 for an ephemeral port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the keep-alive interval of event streams.
   *
   * @return the interval, never null
   */
  public Duration keepAliveInterval() {
    return keepAliveInterval;
  }
}
