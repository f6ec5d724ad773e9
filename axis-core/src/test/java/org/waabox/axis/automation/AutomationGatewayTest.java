package org.waabox.axis.automation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.axis.ValidationException;
import org.waabox.axis.event.EventHub;
import org.waabox.axis.event.EventKind;
import org.waabox.axis.event.PushMessage;
import org.waabox.axis.event.Subscription;
import org.waabox.axis.metrics.NoopDashboardMetrics;

/**
 * Tests for {@link AutomationGateway}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AutomationGatewayTest {

  private final List<String> launched = new ArrayList<>();

  private EventHub hub;

  private Subscription subscription;

  @BeforeEach
  void setUp() {
    hub = new EventHub(10, new NoopDashboardMetrics());
    subscription = hub.subscribe();
  }

  @Test
  void whenDispatching_givenTask_shouldLaunchTrimmedAndAnnounceStart()
      throws Exception {
    final AutomationGateway gateway =
        new AutomationGateway(launched::add, hub);

    gateway.dispatch("  summarize inbox \n");

    assertEquals(List.of("summarize inbox"), launched);
    final PushMessage message =
        subscription.poll(Duration.ofSeconds(1)).orElseThrow();
    assertEquals(EventKind.AUTOMATION, message.kind());
    assertEquals("{\"state\":\"started\",\"task\":\"summarize inbox\"}",
        message.data());
  }

  @Test
  void whenDispatching_givenBlankTask_shouldRejectWithoutLaunching() {
    final AutomationGateway gateway =
        new AutomationGateway(launched::add, hub);

    assertThrows(ValidationException.class, () -> gateway.dispatch(null));
    assertThrows(ValidationException.class, () -> gateway.dispatch("   "));

    assertTrue(launched.isEmpty());
    assertEquals(0, subscription.pending());
  }

  @Test
  void whenDispatching_givenLaunchFailure_shouldAnnounceErrorAndRethrow()
      throws Exception {
    final LaunchException failure = new LaunchException(
        "failed to start copilot: not found", new IOException("not found"));
    final AutomationGateway gateway = new AutomationGateway(task -> {
      throw failure;
    }, hub);

    final LaunchException thrown = assertThrows(LaunchException.class,
        () -> gateway.dispatch("deploy"));

    assertSame(failure, thrown);
    final PushMessage message =
        subscription.poll(Duration.ofSeconds(1)).orElseThrow();
    assertEquals("{\"state\":\"error\",\"task\":\"deploy\","
        + "\"error\":\"failed to start copilot: not found\"}",
        message.data());
  }
}
