package com.motherrealm.backend.command.service;

import com.motherrealm.backend.command.api.CommandReply;
import com.motherrealm.backend.command.api.CreateConversationCommand;
import com.motherrealm.backend.command.api.EndConversationCommand;
import com.motherrealm.backend.command.api.ObserverCommand;
import com.motherrealm.backend.command.api.RealmPromptCommand;
import com.motherrealm.backend.command.api.SendMessageCommand;
import com.motherrealm.backend.command.api.SetVoiceCommand;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.conversation.service.ConversationService;
import com.motherrealm.backend.conversation.service.MessageLogService;
import com.motherrealm.backend.voice.service.VoiceAssignment;
import com.motherrealm.backend.voice.service.VoiceRegistryService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/** Applies observer commands to the owning services and builds the reply for the issuing socket. */
@Service
public class ObserverCommandDispatcher {

  private final ConversationService conversationService;
  private final MessageLogService messageLogService;
  private final VoiceRegistryService voiceRegistryService;
  private final RealmCommandService realmCommandService;

  public ObserverCommandDispatcher(
      ConversationService conversationService,
      MessageLogService messageLogService,
      VoiceRegistryService voiceRegistryService,
      RealmCommandService realmCommandService) {
    this.conversationService = conversationService;
    this.messageLogService = messageLogService;
    this.voiceRegistryService = voiceRegistryService;
    this.realmCommandService = realmCommandService;
  }

  public CommandReply dispatch(ObserverCommand command) {
    if (command instanceof CreateConversationCommand create) {
      String id =
          conversationService.create(create.initiator(), create.participants(), create.isPrivate());
      return CommandReply.conversationAck(command.commandType(), id);
    }
    if (command instanceof EndConversationCommand end) {
      String id = require("conversation_id", end.conversationId());
      conversationService.end(id);
      return CommandReply.conversationAck(command.commandType(), id);
    }
    if (command instanceof SetVoiceCommand voice) {
      VoiceAssignment assignment =
          voiceRegistryService.setVoice(voice.agent(), voice.voiceId(), voice.params());
      return CommandReply.voiceAck(command.commandType(), assignment.rosterMirrored());
    }
    if (command instanceof SendMessageCommand message) {
      String id = require("conversation_id", message.conversationId());
      long messageId =
          messageLogService.append(id, message.sender(), message.content(), message.messageType());
      return CommandReply.messageAck(command.commandType(), id, messageId);
    }
    if (command instanceof RealmPromptCommand realm) {
      RealmCommandResult result = realmCommandService.execute(realm.sender(), realm.prompt());
      return CommandReply.conversationAck(command.commandType(), result.conversationId());
    }
    throw new InvalidCommandException("Unsupported command type: " + command.commandType());
  }

  private static String require(String field, String value) {
    if (!StringUtils.hasText(value)) {
      throw new InvalidCommandException(field + " must not be blank");
    }
    return value;
  }
}
