package com.motherrealm.backend.observer.config;

import com.motherrealm.backend.observer.transport.websocket.ObserverWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class ObserverWebSocketConfiguration implements WebSocketConfigurer {

  private final ObserverWebSocketHandler handler;
  private final ObserverProperties properties;

  public ObserverWebSocketConfiguration(
      ObserverWebSocketHandler handler, ObserverProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, properties.getWebsocketPath())
        .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
  }
}
