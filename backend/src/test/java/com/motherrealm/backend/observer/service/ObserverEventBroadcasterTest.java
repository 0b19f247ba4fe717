package com.motherrealm.backend.observer.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.api.ObserverEventType;
import com.motherrealm.backend.observer.config.ObserverProperties;
import com.motherrealm.backend.support.RecordingObserverChannel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ObserverEventBroadcasterTest {

  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private ObserverEventBroadcaster broadcaster;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    meterRegistry = new SimpleMeterRegistry();
    ObserverProperties properties = new ObserverProperties();
    properties.setQueueCapacity(4);
    broadcaster = new ObserverEventBroadcaster(executor, properties, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void publishReachesEverySubscriberInOrder() throws Exception {
    RecordingObserverChannel first = new RecordingObserverChannel("first");
    RecordingObserverChannel second = new RecordingObserverChannel("second");
    broadcaster.subscribe(first);
    broadcaster.subscribe(second);

    ObserverEvent created = ObserverEvent.conversationCreated("convo_1", List.of("a", "b"), false);
    ObserverEvent message = ObserverEvent.debugMessage("convo_1", false, 1L, "a", "hi", "text");
    broadcaster.publish(created);
    broadcaster.publish(message);

    for (RecordingObserverChannel channel : List.of(first, second)) {
      channel.await(event -> event.type() == ObserverEventType.DEBUG_MESSAGE, Duration.ofSeconds(5));
      assertThat(channel.received()).containsExactly(created, message);
    }
    assertThat(
            meterRegistry
                .counter("observer_events_published_total", "type", "conversation_update")
                .count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.get("observer_subscribers").gauge().value()).isEqualTo(2.0);
  }

  @Test
  void slowSubscriberDoesNotBlockPublisherOrOtherSubscribers() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    BlockingChannel slow = new BlockingChannel("slow", release);
    RecordingObserverChannel fast = new RecordingObserverChannel("fast");
    broadcaster.subscribe(slow);
    broadcaster.subscribe(fast);

    long started = System.nanoTime();
    for (int i = 0; i < 20; i++) {
      broadcaster.publish(ObserverEvent.debugMessage("convo_1", true, i, "a", "m" + i, "text"));
    }
    broadcaster.publish(ObserverEvent.conversationEnded("convo_1", List.of("a", "b"), true));
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));

    ObserverEvent ended = fast.await(ObserverEvent::isConversationEnded, Duration.ofSeconds(5));
    assertThat(fast.received()).last().isSameAs(ended);
    assertThat(slow.received()).isEmpty();

    release.countDown();
    assertThat(
            meterRegistry.counter("observer_events_dropped_total", "type", "debug_message").count())
        .isPositive();
  }

  @Test
  void failingSubscriberIsRemovedWithoutAffectingOthers() throws Exception {
    ObserverChannel broken =
        new RecordingObserverChannel("broken") {
          @Override
          public synchronized void send(ObserverEvent event) {
            throw new IllegalStateException("socket reset");
          }
        };
    RecordingObserverChannel healthy = new RecordingObserverChannel("healthy");
    broadcaster.subscribe(broken);
    broadcaster.subscribe(healthy);

    broadcaster.publish(ObserverEvent.rosterUpdate(List.of()));

    healthy.await(event -> event.type() == ObserverEventType.ROSTER_UPDATE, Duration.ofSeconds(5));
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (broadcaster.subscriberCount() > 1 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    assertThat(broken.isOpen()).isFalse();
  }

  @Test
  void resubscribingWithSameIdReplacesPreviousSubscription() {
    RecordingObserverChannel original = new RecordingObserverChannel("same");
    RecordingObserverChannel replacement = new RecordingObserverChannel("same");

    broadcaster.subscribe(original);
    broadcaster.subscribe(replacement);

    assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    assertThat(original.isOpen()).isFalse();
    assertThat(replacement.isOpen()).isTrue();
  }

  @Test
  void deliverTargetsSingleObserver() throws Exception {
    RecordingObserverChannel target = new RecordingObserverChannel("target");
    RecordingObserverChannel bystander = new RecordingObserverChannel("bystander");
    broadcaster.subscribe(target);
    broadcaster.subscribe(bystander);

    broadcaster.deliver("target", ObserverEvent.rosterUpdate(List.of()));

    target.await(event -> event.type() == ObserverEventType.ROSTER_UPDATE, Duration.ofSeconds(5));
    assertThat(bystander.received()).isEmpty();
  }

  private static final class BlockingChannel extends RecordingObserverChannel {

    private final CountDownLatch release;

    BlockingChannel(String id, CountDownLatch release) {
      super(id);
      this.release = release;
    }

    @Override
    public void send(ObserverEvent event) {
      try {
        release.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
      super.send(event);
    }
  }
}
