package org.waabox.axis.persistence;

import org.waabox.axis.AxisException;

/**
 * Thrown by a {@link StateStore} when a durable read or write fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PersistenceException extends AxisException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public PersistenceException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
