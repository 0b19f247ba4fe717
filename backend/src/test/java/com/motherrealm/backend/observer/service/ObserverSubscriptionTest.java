package com.motherrealm.backend.observer.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.support.RecordingObserverChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ObserverSubscriptionTest {

  @Test
  void fullQueueEvictsOldestChatMessageBeforeLifecycleEvents() {
    ObserverSubscription subscription = new ObserverSubscription(new RecordingObserverChannel(), 3);
    ObserverEvent created = ObserverEvent.conversationCreated("convo_1", List.of("a", "b"), true);
    ObserverEvent firstChat = debug(1);
    ObserverEvent secondChat = debug(2);
    subscription.offer(created);
    subscription.offer(firstChat);
    subscription.offer(secondChat);

    ObserverEvent ended = ObserverEvent.conversationEnded("convo_1", List.of("a", "b"), true);
    Optional<ObserverEvent> dropped = subscription.offer(ended);

    assertThat(dropped).containsSame(firstChat);
    assertThat(drain(subscription)).containsExactly(created, secondChat, ended);
  }

  @Test
  void incomingChatIsDroppedWhenEverythingQueuedOutranksIt() {
    ObserverSubscription subscription = new ObserverSubscription(new RecordingObserverChannel(), 2);
    ObserverEvent roster = ObserverEvent.rosterUpdate(List.of());
    ObserverEvent ended = ObserverEvent.conversationEnded("convo_1", List.of("a", "b"), false);
    subscription.offer(roster);
    subscription.offer(ended);

    ObserverEvent chat = debug(3);
    assertThat(subscription.offer(chat)).containsSame(chat);
    assertThat(drain(subscription)).containsExactly(roster, ended);
  }

  @Test
  void lifecycleEventDisplacesStandardEventWhenNoChatIsQueued() {
    ObserverSubscription subscription = new ObserverSubscription(new RecordingObserverChannel(), 2);
    ObserverEvent roster = ObserverEvent.rosterUpdate(List.of());
    ObserverEvent voice = ObserverEvent.voiceFailed("agentA", "v2/en_speaker_1", "down");
    subscription.offer(roster);
    subscription.offer(voice);

    ObserverEvent ended = ObserverEvent.conversationEnded("convo_1", List.of("a", "b"), false);
    assertThat(subscription.offer(ended)).containsSame(roster);
    assertThat(drain(subscription)).containsExactly(voice, ended);
  }

  @Test
  void equalPriorityReplacesOldest() {
    ObserverSubscription subscription = new ObserverSubscription(new RecordingObserverChannel(), 2);
    ObserverEvent first = debug(1);
    ObserverEvent second = debug(2);
    ObserverEvent third = debug(3);
    subscription.offer(first);
    subscription.offer(second);

    assertThat(subscription.offer(third)).containsSame(first);
    assertThat(drain(subscription)).containsExactly(second, third);
  }

  private static ObserverEvent debug(long messageId) {
    return ObserverEvent.debugMessage("convo_1", true, messageId, "agentA", "m" + messageId, "text");
  }

  private static List<ObserverEvent> drain(ObserverSubscription subscription) {
    List<ObserverEvent> events = new ArrayList<>();
    ObserverEvent next;
    while ((next = subscription.poll()) != null) {
      events.add(next);
    }
    return events;
  }
}
