package com.motherrealm.backend.observer.service;

import com.motherrealm.backend.observer.api.ObserverEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded outbound queue of a single observer. Events are delivered in arrival order. When the
 * queue is full the oldest event of the lowest priority present is evicted, unless every queued
 * event outranks the incoming one, in which case the incoming event is dropped instead.
 */
public class ObserverSubscription {

  private final ObserverChannel channel;
  private final int capacity;
  private final Deque<ObserverEvent> queue = new ArrayDeque<>();
  private final AtomicBoolean draining = new AtomicBoolean();
  private volatile boolean closed;

  public ObserverSubscription(ObserverChannel channel, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
    }
    this.channel = channel;
    this.capacity = capacity;
  }

  public String id() {
    return channel.id();
  }

  public ObserverChannel channel() {
    return channel;
  }

  public boolean isClosed() {
    return closed || !channel.isOpen();
  }

  /**
   * Enqueues the event and returns the event that had to be discarded to make room, if any. The
   * discarded event may be the offered one.
   */
  public synchronized Optional<ObserverEvent> offer(ObserverEvent event) {
    if (queue.size() < capacity) {
      queue.addLast(event);
      return Optional.empty();
    }
    ObserverEvent victim = findEvictionCandidate();
    if (victim == null || outranks(victim, event)) {
      return Optional.of(event);
    }
    removeFirstOccurrence(victim);
    queue.addLast(event);
    return Optional.of(victim);
  }

  synchronized ObserverEvent poll() {
    return queue.pollFirst();
  }

  public synchronized int pending() {
    return queue.size();
  }

  boolean tryStartDrain() {
    return !closed && draining.compareAndSet(false, true);
  }

  /** Releases the drain flag; true when events arrived meanwhile and draining was re-acquired. */
  boolean finishDrain() {
    draining.set(false);
    return pending() > 0 && tryStartDrain();
  }

  void close() {
    closed = true;
    synchronized (this) {
      queue.clear();
    }
    channel.close();
  }

  private ObserverEvent findEvictionCandidate() {
    ObserverEvent candidate = null;
    for (ObserverEvent queued : queue) {
      if (candidate == null
          || queued.type().priority().ordinal() > candidate.type().priority().ordinal()) {
        candidate = queued;
      }
    }
    return candidate;
  }

  private static boolean outranks(ObserverEvent queued, ObserverEvent incoming) {
    return queued.type().priority().ordinal() < incoming.type().priority().ordinal();
  }

  private void removeFirstOccurrence(ObserverEvent victim) {
    Iterator<ObserverEvent> iterator = queue.iterator();
    while (iterator.hasNext()) {
      if (iterator.next() == victim) {
        iterator.remove();
        return;
      }
    }
  }
}
