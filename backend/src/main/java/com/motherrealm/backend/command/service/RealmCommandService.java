package com.motherrealm.backend.command.service;

import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.conversation.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class RealmCommandService {

  private final RealmCommandParser parser;
  private final ConversationService conversationService;

  public RealmCommandService(RealmCommandParser parser, ConversationService conversationService) {
    this.parser = parser;
    this.conversationService = conversationService;
  }

  public RealmCommandResult execute(String sender, String prompt) {
    if (!StringUtils.hasText(sender)) {
      throw new InvalidCommandException("sender must not be blank");
    }
    RealmCommand command = parser.parse(prompt);
    RealmAction action =
        RealmAction.fromCommandName(command.action())
            .orElseThrow(
                () -> new InvalidCommandException("Unknown realm action: " + command.action()));
    log.info("Realm command {} from {} with arguments {}", action, sender, command.arguments());
    return switch (action) {
      case PRIVATE_CHAT -> {
        String id = conversationService.create(sender, command.arguments(), true);
        yield new RealmCommandResult(action.commandName(), id);
      }
    };
  }
}
