package org.waabox.axis.automation;

/**
 * Starts an external executor for a delegated task.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TaskLauncher {

  /**
   * Starts the executor for the task and returns without waiting for it.
   *
   * @param task the task text, never null or blank
   *
   * @throws LaunchException if the executor cannot be started
   */
  void launch(String task);
}
