package com.motherrealm.backend.observer.transport.sse;

import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.service.ObserverChannel;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Read-only observer fed over Server-Sent Events; each event is named after its type. */
public class SseObserverChannel implements ObserverChannel {

  private final String id = "sse-" + UUID.randomUUID();
  private final SseEmitter emitter;
  private final AtomicBoolean open = new AtomicBoolean(true);

  public SseObserverChannel(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void send(ObserverEvent event) throws IOException {
    emitter.send(SseEmitter.event().name(event.type().wireName()).data(event));
  }

  public void markClosed() {
    open.set(false);
  }

  @Override
  public void close() {
    if (open.compareAndSet(true, false)) {
      emitter.complete();
    }
  }
}
