package com.motherrealm.backend.observer.controller;

import com.motherrealm.backend.conversation.service.ConversationService;
import com.motherrealm.backend.observer.config.ObserverProperties;
import com.motherrealm.backend.observer.service.ObserverEventBroadcaster;
import com.motherrealm.backend.observer.transport.sse.SseObserverChannel;
import com.motherrealm.backend.roster.service.RosterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/observers")
public class ObserverStreamController {

  private final ObserverEventBroadcaster broadcaster;
  private final RosterService rosterService;
  private final ConversationService conversationService;
  private final ObserverProperties properties;

  public ObserverStreamController(
      ObserverEventBroadcaster broadcaster,
      RosterService rosterService,
      ConversationService conversationService,
      ObserverProperties properties) {
    this.broadcaster = broadcaster;
    this.rosterService = rosterService;
    this.conversationService = conversationService;
    this.properties = properties;
  }

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    SseEmitter emitter = new SseEmitter(properties.getSseTimeout().toMillis());
    SseObserverChannel channel = new SseObserverChannel(emitter);
    Runnable release =
        () -> {
          channel.markClosed();
          broadcaster.unsubscribe(channel.id());
        };
    emitter.onCompletion(release);
    emitter.onTimeout(release);
    emitter.onError(
        throwable -> {
          log.debug("SSE observer {} failed", channel.id(), throwable);
          release.run();
        });
    broadcaster.subscribe(channel);
    broadcaster.deliver(channel.id(), rosterService.snapshot());
    conversationService
        .activeSnapshot()
        .forEach(event -> broadcaster.deliver(channel.id(), event));
    return emitter;
  }

  @GetMapping("/count")
  public int subscriberCount() {
    return broadcaster.subscriberCount();
  }
}
