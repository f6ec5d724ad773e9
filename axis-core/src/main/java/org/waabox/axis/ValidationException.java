package org.waabox.axis;

/**
 * Thrown when a caller supplies malformed input: a missing or empty item
 * id, an unrecognized status or mode, or an empty automation task.
 *
 * <p>No state is changed when this exception is raised.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ValidationException extends AxisException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new validation exception.
   *
   * @param message the description of the invalid input, never null
   */
  public ValidationException(final String message) {
    super(message);
  }
}
