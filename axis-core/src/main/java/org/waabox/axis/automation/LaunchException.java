package org.waabox.axis.automation;

import org.waabox.axis.AxisException;

/**
 * Thrown when an automation task cannot be started.
 *
 * <p>Only the launch is covered: once a task is running its outcome is
 * never observed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LaunchException extends AxisException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new launch exception.
   *
   * @param message the failure message, never null
   * @param cause   the underlying failure, may be null
   */
  public LaunchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
