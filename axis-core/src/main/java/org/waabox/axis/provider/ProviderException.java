package org.waabox.axis.provider;

import org.waabox.axis.AxisException;

/**
 * Thrown when the upstream item provider fails to list, fetch or delete.
 *
 * <p>Reads mask this failure by serving the last good snapshot; deletes
 * surface it because there is no safe fallback.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ProviderException extends AxisException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public ProviderException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public ProviderException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
