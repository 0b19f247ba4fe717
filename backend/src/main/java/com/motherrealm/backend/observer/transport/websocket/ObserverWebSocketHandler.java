package com.motherrealm.backend.observer.transport.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motherrealm.backend.command.api.CommandReply;
import com.motherrealm.backend.command.api.ObserverCommand;
import com.motherrealm.backend.command.service.ObserverCommandDispatcher;
import com.motherrealm.backend.common.exception.ErrorCode;
import com.motherrealm.backend.common.exception.OrchestrationException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.conversation.service.ConversationService;
import com.motherrealm.backend.observer.service.ObserverEventBroadcaster;
import com.motherrealm.backend.roster.service.RosterService;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Each socket is one observer: it is subscribed to the broadcaster on connect, receives the current
 * roster and active conversations, and may issue commands. Failures are reported only to the socket that sent the command.
 */
@Slf4j
@Component
public class ObserverWebSocketHandler extends TextWebSocketHandler {

  private final ObserverEventBroadcaster broadcaster;
  private final ObserverCommandDispatcher dispatcher;
  private final RosterService rosterService;
  private final ConversationService conversationService;
  private final ObjectMapper objectMapper;
  private final Map<String, WebSocketObserverChannel> channels = new ConcurrentHashMap<>();

  public ObserverWebSocketHandler(
      ObserverEventBroadcaster broadcaster,
      ObserverCommandDispatcher dispatcher,
      RosterService rosterService,
      ConversationService conversationService,
      ObjectMapper objectMapper) {
    this.broadcaster = broadcaster;
    this.dispatcher = dispatcher;
    this.rosterService = rosterService;
    this.conversationService = conversationService;
    this.objectMapper = objectMapper;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    WebSocketObserverChannel channel = new WebSocketObserverChannel(session, objectMapper);
    channels.put(session.getId(), channel);
    broadcaster.subscribe(channel);
    try {
      broadcaster.deliver(session.getId(), rosterService.snapshot());
      conversationService
          .activeSnapshot()
          .forEach(event -> broadcaster.deliver(session.getId(), event));
    } catch (DataAccessException | StoreUnavailableException failure) {
      log.warn("Initial snapshot unavailable for observer {}", session.getId(), failure);
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws IOException {
    WebSocketObserverChannel channel = channels.get(session.getId());
    if (channel == null) {
      return;
    }
    CommandReply reply = handleCommand(session.getId(), message.getPayload());
    channel.sendPayload(reply);
  }

  CommandReply handleCommand(String observerId, String payload) {
    String commandType = null;
    try {
      JsonNode frame = objectMapper.readTree(payload);
      if (frame == null || !frame.isObject()) {
        return CommandReply.error(null, ErrorCode.INVALID_COMMAND, "Command must be a JSON object");
      }
      commandType = frame.path("type").asText(null);
      ObserverCommand command = objectMapper.treeToValue(frame, ObserverCommand.class);
      log.debug("Observer {} issued {}", observerId, command.commandType());
      return dispatcher.dispatch(command);
    } catch (JsonProcessingException invalid) {
      return CommandReply.error(
          commandType,
          ErrorCode.INVALID_COMMAND,
          "Unreadable command: " + invalid.getOriginalMessage());
    } catch (OrchestrationException failure) {
      if (failure.getErrorCode() == ErrorCode.STORE_UNAVAILABLE) {
        log.warn(
            "Command {} from observer {} failed: {}",
            commandType,
            observerId,
            failure.getReason(),
            failure.getCause());
      } else {
        log.debug(
            "Command {} from observer {} rejected: {}", commandType, observerId, failure.getReason());
      }
      return CommandReply.error(commandType, failure.getErrorCode(), failure.getReason());
    } catch (DataAccessException failure) {
      log.warn("Command {} from observer {} hit a store failure", commandType, observerId, failure);
      return CommandReply.error(
          commandType, ErrorCode.STORE_UNAVAILABLE, "Persistence store unavailable");
    } catch (RuntimeException unexpected) {
      log.error(
          "Command {} from observer {} failed unexpectedly", commandType, observerId, unexpected);
      return CommandReply.error(commandType, ErrorCode.INTERNAL_ERROR, "Unexpected error");
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Transport error on observer socket {}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    channels.remove(session.getId());
    broadcaster.unsubscribe(session.getId());
  }
}
