package com.fever.assessment.service;

import com.fever.assessment.conversation.SessionController;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Live conversations of this host, keyed by a conversation id that survives restarts of the
 * underlying session. Idle conversations are swept after the configured timeout.
 */
@Component
public class ConversationRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConversationRegistry.class);

  private final ConcurrentHashMap<String, HostedConversation> conversations = new ConcurrentHashMap<>();
  private final Duration idleTimeout;
  private final Clock clock;

  @Autowired
  public ConversationRegistry(@Value("${assessment.session.timeout-minutes:30}") long timeoutMinutes) {
    this(Duration.ofMinutes(Math.max(timeoutMinutes, 1)), Clock.systemUTC());
  }

  ConversationRegistry(Duration idleTimeout, Clock clock) {
    this.idleTimeout = idleTimeout;
    this.clock = clock;
  }

  public HostedConversation register(String conversationId, SessionController controller) {
    HostedConversation hosted = new HostedConversation(conversationId, controller, clock.instant());
    conversations.put(conversationId, hosted);
    return hosted;
  }

  public Optional<HostedConversation> find(String conversationId) {
    if (conversationId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(conversations.get(conversationId.trim()));
  }

  public void touch(HostedConversation hosted) {
    hosted.setLastUpdated(clock.instant());
  }

  public boolean remove(String conversationId) {
    return conversationId != null && conversations.remove(conversationId.trim()) != null;
  }

  public int size() {
    return conversations.size();
  }

  @Scheduled(fixedDelayString = "${assessment.session.sweep-interval-ms:60000}")
  public void cleanExpired() {
    Instant cutoff = clock.instant().minus(idleTimeout);
    int before = conversations.size();
    conversations.entrySet().removeIf(entry -> entry.getValue().getLastUpdated().isBefore(cutoff));
    int removed = before - conversations.size();
    if (removed > 0) {
      log.info("Removed {} idle conversation(s)", removed);
    }
  }
}
