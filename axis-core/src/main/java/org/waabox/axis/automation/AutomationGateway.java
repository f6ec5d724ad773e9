package org.waabox.axis.automation;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.ValidationException;
import org.waabox.axis.event.EventHub;

/**
 * Fire-and-forget dispatch of delegated tasks.
 *
 * <p>Reports only whether the executor was launched: an {@code automation}
 * event with state {@code started}, or with state {@code error} and the
 * failure message. The mode policy is enforced by the caller.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AutomationGateway {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AutomationGateway.class);

  /** The automation state published after a successful launch. */
  public static final String STATE_STARTED = "started";

  /** The automation state published after a failed launch. */
  public static final String STATE_ERROR = "error";

  /** The executor starter, never null. */
  private final TaskLauncher launcher;

  /** The hub outcomes are published to, never null. */
  private final EventHub hub;

  /**
   * Creates a new gateway.
   *
   * @param theLauncher the executor starter, never null
   * @param theHub      the event hub, never null
   */
  public AutomationGateway(final TaskLauncher theLauncher,
      final EventHub theHub) {
    Objects.requireNonNull(theLauncher, "launcher cannot be null");
    Objects.requireNonNull(theHub, "hub cannot be null");
    launcher = theLauncher;
    hub = theHub;
  }

  /**
   * Launches the executor for a task, exactly once.
   *
   * @param task the task text, must not be blank
   *
   * @throws ValidationException if the task is null or blank
   * @throws LaunchException     if the executor could not be started
   */
  public void dispatch(final String task) {
    if (task == null || task.isBlank()) {
      throw new ValidationException("task is required");
    }
    final String trimmed = task.trim();
    try {
      launcher.launch(trimmed);
    } catch (final LaunchException e) {
      log.warn("Automation launch failed for task '{}': {}", trimmed,
          e.getMessage());
      hub.publishAutomation(STATE_ERROR, trimmed, e.getMessage());
      throw e;
    }
    log.info("Automation started for task '{}'", trimmed);
    hub.publishAutomation(STATE_STARTED, trimmed, null);
  }
}
