package com.motherrealm.backend.observer.service;

import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.api.ObserverEventType;
import com.motherrealm.backend.observer.config.ObserverProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans accepted state changes out to every subscribed observer. Publishing only enqueues; the
 * transports are written from the dispatch executor so a slow or dead observer never blocks the
 * caller. Visibility of private-conversation traffic is decided by the observer, not here.
 */
@Component
public class ObserverEventBroadcaster {

  private static final Logger log = LoggerFactory.getLogger(ObserverEventBroadcaster.class);

  private final Map<String, ObserverSubscription> subscriptions = new ConcurrentHashMap<>();
  private final Executor dispatchExecutor;
  private final ObserverProperties properties;
  private final MeterRegistry meterRegistry;

  public ObserverEventBroadcaster(
      @Qualifier("observerDispatchExecutor") Executor dispatchExecutor,
      ObserverProperties properties,
      MeterRegistry meterRegistry) {
    this.dispatchExecutor = dispatchExecutor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    if (meterRegistry != null) {
      meterRegistry.gaugeMapSize("observer_subscribers", List.of(), subscriptions);
    }
  }

  public ObserverSubscription subscribe(ObserverChannel channel) {
    ObserverSubscription subscription =
        new ObserverSubscription(channel, properties.getQueueCapacity());
    ObserverSubscription previous = subscriptions.put(channel.id(), subscription);
    if (previous != null) {
      previous.close();
    }
    log.info("Observer {} subscribed ({} active)", channel.id(), subscriptions.size());
    return subscription;
  }

  public void unsubscribe(String observerId) {
    ObserverSubscription removed = subscriptions.remove(observerId);
    if (removed != null) {
      removed.close();
      log.info("Observer {} unsubscribed ({} active)", observerId, subscriptions.size());
    }
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  public Collection<ObserverSubscription> subscriptions() {
    return List.copyOf(subscriptions.values());
  }

  public void publish(ObserverEvent event) {
    countPublished(event.type());
    for (ObserverSubscription subscription : subscriptions.values()) {
      enqueue(subscription, event);
    }
  }

  /** Delivers an event to a single observer, e.g. the roster snapshot sent on connect. */
  public void deliver(String observerId, ObserverEvent event) {
    ObserverSubscription subscription = subscriptions.get(observerId);
    if (subscription != null) {
      enqueue(subscription, event);
    }
  }

  private void enqueue(ObserverSubscription subscription, ObserverEvent event) {
    if (subscription.isClosed()) {
      if (subscriptions.remove(subscription.id(), subscription)) {
        subscription.close();
      }
      return;
    }
    Optional<ObserverEvent> dropped = subscription.offer(event);
    dropped.ifPresent(
        discarded -> {
          countDropped(discarded.type());
          log.warn(
              "Observer {} queue full, dropped {} event",
              subscription.id(),
              discarded.type().wireName());
        });
    scheduleDrain(subscription);
  }

  private void scheduleDrain(ObserverSubscription subscription) {
    if (!subscription.tryStartDrain()) {
      return;
    }
    try {
      dispatchExecutor.execute(() -> drain(subscription));
    } catch (RejectedExecutionException rejected) {
      log.warn("Dispatch executor rejected delivery to observer {}", subscription.id(), rejected);
      subscription.finishDrain();
    }
  }

  private void drain(ObserverSubscription subscription) {
    do {
      ObserverEvent next;
      while ((next = subscription.poll()) != null) {
        try {
          subscription.channel().send(next);
          if (log.isDebugEnabled()) {
            log.debug("Delivered {} to observer {}", next.type().wireName(), subscription.id());
          }
        } catch (Exception deliveryFailure) {
          log.info(
              "Delivery to observer {} failed, dropping subscription: {}",
              subscription.id(),
              deliveryFailure.getMessage());
          subscriptions.remove(subscription.id(), subscription);
          subscription.close();
          return;
        }
      }
    } while (subscription.finishDrain());
  }

  private void countPublished(ObserverEventType type) {
    counter("observer_events_published_total", type).ifPresent(Counter::increment);
  }

  private void countDropped(ObserverEventType type) {
    counter("observer_events_dropped_total", type).ifPresent(Counter::increment);
  }

  private Optional<Counter> counter(String name, ObserverEventType type) {
    if (meterRegistry == null) {
      return Optional.empty();
    }
    return Optional.of(meterRegistry.counter(name, "type", type.wireName()));
  }
}
