package org.waabox.axis.automation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ProcessTaskLauncher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ProcessTaskLauncherTest {

  @Test
  void whenBuildingCommand_givenCopilotLauncher_shouldWrapTask() {
    final ProcessTaskLauncher launcher = ProcessTaskLauncher.copilot();

    assertEquals(List.of("copilot", "-p", "tidy the backlog", "--allow-all"),
        launcher.command("tidy the backlog"));
  }

  @Test
  void whenLaunching_givenMissingExecutable_shouldThrowLaunchException() {
    final ProcessTaskLauncher launcher = new ProcessTaskLauncher(
        List.of("axis-no-such-executable-" + System.nanoTime()), List.of());

    final LaunchException e = assertThrows(LaunchException.class,
        () -> launcher.launch("anything"));

    assertTrue(e.getMessage().startsWith("failed to start axis-no-such"));
    assertNotNull(e.getCause());
  }

  @Test
  void whenCreating_givenEmptyPrefix_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new ProcessTaskLauncher(List.of(), List.of()));
  }
}
