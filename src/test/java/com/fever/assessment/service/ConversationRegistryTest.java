package com.fever.assessment.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.fever.assessment.conversation.SessionController;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConversationRegistryTest {

  private Instant now;
  private ConversationRegistry registry;

  @BeforeEach
  public void setUp() {
    now = Instant.parse("2026-02-10T08:00:00Z");
    Clock clock = new Clock() {
      @Override
      public ZoneId getZone() {
        return ZoneOffset.UTC;
      }

      @Override
      public Clock withZone(ZoneId zone) {
        return this;
      }

      @Override
      public Instant instant() {
        return now;
      }
    };
    registry = new ConversationRegistry(Duration.ofMinutes(30), clock);
  }

  @Test
  public void registersAndFindsConversations() {
    SessionController controller = mock(SessionController.class);
    registry.register("c-1", controller);

    assertEquals(controller, registry.find(" c-1 ").orElseThrow().getController());
    assertTrue(registry.find("c-2").isEmpty());
    assertTrue(registry.find(null).isEmpty());
  }

  @Test
  public void idleConversationsAreSwept() {
    HostedConversation active = registry.register("active", mock(SessionController.class));
    registry.register("idle", mock(SessionController.class));

    now = now.plus(Duration.ofMinutes(20));
    registry.touch(active);
    now = now.plus(Duration.ofMinutes(15));
    registry.cleanExpired();

    assertTrue(registry.find("active").isPresent());
    assertFalse(registry.find("idle").isPresent());
    assertEquals(1, registry.size());
  }

  @Test
  public void removeReportsWhetherAnythingWasRemoved() {
    registry.register("c-1", mock(SessionController.class));

    assertTrue(registry.remove("c-1"));
    assertFalse(registry.remove("c-1"));
    assertFalse(registry.remove(null));
  }
}
