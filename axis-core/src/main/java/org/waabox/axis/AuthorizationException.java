package org.waabox.axis;

import org.waabox.axis.model.Mode;

/**
 * Thrown when a mutating action is attempted while the dashboard runs in a
 * mode that does not permit it, for example a delete or an automation
 * dispatch outside {@link Mode#MANUAL}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AuthorizationException extends AxisException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given action and required mode.
   *
   * @param action   the rejected action, never null
   * @param required the mode the action requires, never null
   */
  public AuthorizationException(final String action, final Mode required) {
    super(action + " requires " + required + " mode");
  }
}
