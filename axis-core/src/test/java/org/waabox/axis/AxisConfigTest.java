package org.waabox.axis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AxisConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AxisConfigTest {

  @Test
  void whenCreating_givenNoArguments_shouldUseDefaults() {
    final AxisConfig config = AxisConfig.create();

    assertEquals(Duration.ofMinutes(5), config.cacheTtl());
    assertEquals(Duration.ofSeconds(1), config.pollInterval());
    assertEquals(60, config.autoRefreshTicks());
    assertEquals(10, config.subscriberCapacity());
    assertEquals(Optional.of(Path.of("axis.state.json")),
        config.legacyStateFile());
  }

  @Test
  void whenCreating_givenNoLegacyFile_shouldReturnEmpty() {
    final AxisConfig config = AxisConfig.create(Duration.ofSeconds(30),
        Duration.ofMillis(250), 4, 2, null);

    assertFalse(config.legacyStateFile().isPresent());
    assertEquals(4, config.autoRefreshTicks());
  }

  @Test
  void whenCreating_givenInvalidValues_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () -> AxisConfig.create(
        Duration.ZERO, Duration.ofSeconds(1), 60, 10, null));
    assertThrows(IllegalArgumentException.class, () -> AxisConfig.create(
        Duration.ofMinutes(5), Duration.ofSeconds(-1), 60, 10, null));
    assertThrows(IllegalArgumentException.class, () -> AxisConfig.create(
        Duration.ofMinutes(5), Duration.ofSeconds(1), 0, 10, null));
    assertThrows(IllegalArgumentException.class, () -> AxisConfig.create(
        Duration.ofMinutes(5), Duration.ofSeconds(1), 60, 0, null));
    assertThrows(NullPointerException.class, () -> AxisConfig.create(
        null, Duration.ofSeconds(1), 60, 10, null));
  }
}
