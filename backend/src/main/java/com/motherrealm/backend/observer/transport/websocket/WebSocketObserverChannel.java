package com.motherrealm.backend.observer.transport.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.service.ObserverChannel;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Observer channel backed by a WebSocket session. Broadcast events and direct command replies are
 * written from different threads, so the session is wrapped in a concurrent decorator.
 */
class WebSocketObserverChannel implements ObserverChannel {

  private static final Logger log = LoggerFactory.getLogger(WebSocketObserverChannel.class);

  static final int SEND_TIME_LIMIT_MS = 10_000;
  static final int BUFFER_SIZE_LIMIT = 512 * 1024;

  private final WebSocketSession session;
  private final ObjectMapper objectMapper;

  WebSocketObserverChannel(WebSocketSession session, ObjectMapper objectMapper) {
    this.session =
        new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    this.objectMapper = objectMapper;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(ObserverEvent event) throws IOException {
    sendPayload(event);
  }

  void sendPayload(Object payload) throws IOException {
    session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
  }

  @Override
  public void close() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (IOException exception) {
      log.debug("Failed to close observer socket {}", id(), exception);
    }
  }
}
