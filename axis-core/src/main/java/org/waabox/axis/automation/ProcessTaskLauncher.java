package org.waabox.axis.automation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TaskLauncher} that spawns a local process.
 *
 * <p>The command line is the configured prefix, the task text and the
 * configured suffix. The child inherits this process's standard output and
 * error and is never waited for.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ProcessTaskLauncher implements TaskLauncher {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ProcessTaskLauncher.class);

  /** The default executable. */
  public static final String DEFAULT_EXECUTABLE = "copilot";

  /** The arguments placed before the task. */
  private final List<String> prefix;

  /** The arguments placed after the task. */
  private final List<String> suffix;

  /**
   * Creates a launcher with an explicit command line.
   *
   * @param thePrefix the executable and the arguments before the task,
   *                  never null or empty
   * @param theSuffix the arguments after the task, never null
   */
  public ProcessTaskLauncher(final List<String> thePrefix,
      final List<String> theSuffix) {
    Objects.requireNonNull(thePrefix, "prefix cannot be null");
    Objects.requireNonNull(theSuffix, "suffix cannot be null");
    if (thePrefix.isEmpty()) {
      throw new IllegalArgumentException("prefix cannot be empty");
    }
    prefix = List.copyOf(thePrefix);
    suffix = List.copyOf(theSuffix);
  }

  /**
   * Creates a launcher running {@code copilot -p <task> --allow-all}.
   *
   * @return the launcher, never null
   */
  public static ProcessTaskLauncher copilot() {
    return new ProcessTaskLauncher(List.of(DEFAULT_EXECUTABLE, "-p"),
        List.of("--allow-all"));
  }

  /**
   * Builds the full command line for a task.
   *
   * @param task the task text, never null
   *
   * @return the command, never null
   */
  List<String> command(final String task) {
    final List<String> command = new ArrayList<>(prefix);
    command.add(task);
    command.addAll(suffix);
    return command;
  }

  /** {@inheritDoc} */
  @Override
  public void launch(final String task) {
    Objects.requireNonNull(task, "task cannot be null");
    final List<String> command = command(task);
    try {
      final Process process = new ProcessBuilder(command)
          .inheritIO()
          .start();
      log.info("Started '{}' as pid {}", command.get(0), process.pid());
    } catch (final IOException | SecurityException e) {
      throw new LaunchException("failed to start " + command.get(0) + ": "
          + e.getMessage(), e);
    }
  }
}
