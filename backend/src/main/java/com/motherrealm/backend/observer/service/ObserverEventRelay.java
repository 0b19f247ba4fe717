package com.motherrealm.backend.observer.service;

import com.motherrealm.backend.observer.api.ObserverEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards observer events published by the services once their transaction has committed, so
 * rolled-back changes are never announced. Events published outside a transaction, such as a
 * failed voice assignment, are forwarded immediately.
 */
@Component
public class ObserverEventRelay {

  private final ObserverEventBroadcaster broadcaster;

  public ObserverEventRelay(ObserverEventBroadcaster broadcaster) {
    this.broadcaster = broadcaster;
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onObserverEvent(ObserverEvent event) {
    broadcaster.publish(event);
  }
}
