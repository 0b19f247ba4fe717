package com.motherrealm.backend.observer.client;

import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.roster.api.AgentView;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one viewer, rebuilt solely from pushed {@link ObserverEvent}s. Each viewer owns its own
 * projection; instances are not shared and not thread-safe.
 *
 * <p>Private-conversation messages are always recorded but only returned by {@link
 * #visibleMessages()} while debug mode is on.
 */
public class ObserverProjection {

  public static final int DEFAULT_MESSAGE_CAPACITY = 500;

  private final Map<String, AgentView> roster = new LinkedHashMap<>();
  private final Map<String, String> voices = new LinkedHashMap<>();
  private final Map<String, String> voiceErrors = new LinkedHashMap<>();
  private final Map<String, ConversationView> activeConversations = new LinkedHashMap<>();
  private final Deque<ObserverEvent> messages = new ArrayDeque<>();
  private final int messageCapacity;
  private boolean debugMode;

  public ObserverProjection() {
    this(DEFAULT_MESSAGE_CAPACITY, false);
  }

  public ObserverProjection(int messageCapacity, boolean debugMode) {
    if (messageCapacity <= 0) {
      throw new IllegalArgumentException("messageCapacity must be positive");
    }
    this.messageCapacity = messageCapacity;
    this.debugMode = debugMode;
  }

  public void apply(ObserverEvent event) {
    if (event == null || event.type() == null) {
      return;
    }
    switch (event.type()) {
      case ROSTER_UPDATE -> applyRoster(event);
      case VOICE_UPDATE -> applyVoice(event);
      case CONVERSATION_UPDATE -> applyConversation(event);
      case DEBUG_MESSAGE -> applyMessage(event);
    }
  }

  private void applyRoster(ObserverEvent event) {
    roster.clear();
    if (event.agents() == null) {
      return;
    }
    for (AgentView agent : event.agents()) {
      roster.put(agent.name(), agent);
      if (agent.voiceEnabled() && agent.voiceId() != null) {
        voices.put(agent.name(), agent.voiceId());
      }
    }
  }

  private void applyVoice(ObserverEvent event) {
    if (Boolean.TRUE.equals(event.success())) {
      voices.put(event.agent(), event.voiceId());
      voiceErrors.remove(event.agent());
    } else {
      voiceErrors.put(event.agent(), event.error() != null ? event.error() : "voice update failed");
    }
  }

  private void applyConversation(ObserverEvent event) {
    if (event.isConversationEnded()) {
      activeConversations.remove(event.conversationId());
      return;
    }
    activeConversations.put(
        event.conversationId(),
        new ConversationView(
            event.conversationId(),
            event.participants() != null ? List.copyOf(event.participants()) : List.of(),
            Boolean.TRUE.equals(event.isPrivate())));
  }

  private void applyMessage(ObserverEvent event) {
    messages.addLast(event);
    while (messages.size() > messageCapacity) {
      messages.removeFirst();
    }
  }

  public boolean isDebugMode() {
    return debugMode;
  }

  public void setDebugMode(boolean debugMode) {
    this.debugMode = debugMode;
  }

  public Map<String, AgentView> roster() {
    return Collections.unmodifiableMap(roster);
  }

  public Optional<String> voiceOf(String agent) {
    return Optional.ofNullable(voices.get(agent));
  }

  public Optional<String> voiceErrorOf(String agent) {
    return Optional.ofNullable(voiceErrors.get(agent));
  }

  public Map<String, ConversationView> activeConversations() {
    return Collections.unmodifiableMap(activeConversations);
  }

  public List<ObserverEvent> visibleMessages() {
    List<ObserverEvent> visible = new ArrayList<>(messages.size());
    for (ObserverEvent message : messages) {
      if (debugMode || !Boolean.TRUE.equals(message.isPrivate())) {
        visible.add(message);
      }
    }
    return Collections.unmodifiableList(visible);
  }

  public List<ObserverEvent> messagesOf(String conversationId) {
    return visibleMessages().stream()
        .filter(message -> conversationId.equals(message.conversationId()))
        .toList();
  }

  public record ConversationView(String id, List<String> participants, boolean isPrivate) {}
}
