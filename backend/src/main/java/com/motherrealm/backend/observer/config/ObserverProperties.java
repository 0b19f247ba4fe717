package com.motherrealm.backend.observer.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.observers")
public class ObserverProperties {

  /**
   * Maximum number of undelivered events buffered per observer. Once reached, lower priority
   * events are evicted first.
   */
  @Min(1)
  private int queueCapacity = 256;

  /** Threads shared by all observers for pushing queued events to their transports. */
  @Min(1)
  private int dispatchThreads = 4;

  private String websocketPath = "/ws/observers";

  private List<String> allowedOrigins = List.of("*");

  /** SSE emitter timeout; zero keeps the stream open until the client disconnects. */
  private Duration sseTimeout = Duration.ZERO;

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public int getDispatchThreads() {
    return Math.max(1, dispatchThreads);
  }

  public void setDispatchThreads(int dispatchThreads) {
    this.dispatchThreads = Math.max(1, dispatchThreads);
  }

  public String getWebsocketPath() {
    return websocketPath;
  }

  public void setWebsocketPath(String websocketPath) {
    this.websocketPath = websocketPath;
  }

  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  public void setAllowedOrigins(List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of();
  }

  public Duration getSseTimeout() {
    return sseTimeout;
  }

  public void setSseTimeout(Duration sseTimeout) {
    if (sseTimeout != null && !sseTimeout.isNegative()) {
      this.sseTimeout = sseTimeout;
    }
  }
}
