package org.waabox.axis;

/**
 * Base exception for all Axis-related errors.
 *
 * <p>This is an unchecked exception. Each subclass maps to one category of
 * failure the dashboard boundary knows how to report: invalid input,
 * an action attempted in the wrong mode, an upstream provider failure,
 * a durable write failure or an automation launch failure.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AxisException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public AxisException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public AxisException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
