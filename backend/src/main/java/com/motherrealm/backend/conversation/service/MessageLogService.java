package com.motherrealm.backend.conversation.service;

import com.motherrealm.backend.common.exception.ConversationNotActiveException;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.conversation.domain.Conversation;
import com.motherrealm.backend.conversation.domain.ConversationMessage;
import com.motherrealm.backend.conversation.domain.SenderKind;
import com.motherrealm.backend.conversation.persistence.ConversationMessageRepository;
import com.motherrealm.backend.conversation.persistence.ConversationRepository;
import com.motherrealm.backend.observer.api.ObserverEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Ordered, append-only message log scoped to a conversation. */
@Service
public class MessageLogService {

  private static final Logger log = LoggerFactory.getLogger(MessageLogService.class);

  private final ConversationRepository conversationRepository;
  private final ConversationMessageRepository messageRepository;
  private final ApplicationEventPublisher eventPublisher;

  public MessageLogService(
      ConversationRepository conversationRepository,
      ConversationMessageRepository messageRepository,
      ApplicationEventPublisher eventPublisher) {
    this.conversationRepository = conversationRepository;
    this.messageRepository = messageRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Appends a message and bumps the conversation's last activity in one transaction. The
   * conversation row is locked first, so a concurrent end either happens before (and the append is
   * rejected) or after the append commits.
   */
  @Transactional
  public long append(String conversationId, String sender, String content, String messageType) {
    if (!StringUtils.hasText(sender)) {
      throw new InvalidCommandException("sender must not be blank");
    }
    try {
      Conversation conversation =
          conversationRepository
              .findByIdForUpdate(conversationId)
              .filter(Conversation::isActive)
              .orElseThrow(() -> new ConversationNotActiveException(conversationId));
      SenderKind kind = conversation.involves(sender) ? SenderKind.AGENT : SenderKind.USER;
      ConversationMessage saved =
          messageRepository.save(
              new ConversationMessage(conversation, sender, kind, content, messageType));
      conversation.touch(saved.getCreatedAt());
      conversationRepository.save(conversation);
      log.debug(
          "Message {} appended to conversation {} by {} ({})",
          saved.getId(),
          conversationId,
          sender,
          kind);
      eventPublisher.publishEvent(
          ObserverEvent.debugMessage(
              conversationId,
              conversation.isPrivate(),
              saved.getId(),
              sender,
              saved.getContent(),
              saved.getMessageType()));
      return saved.getId();
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("message append", failure);
    }
  }

  @Transactional(readOnly = true)
  public List<ConversationMessage> history(String conversationId) {
    try {
      if (!conversationRepository.existsById(conversationId)) {
        throw NotFoundException.conversation(conversationId);
      }
      return List.copyOf(messageRepository.findByConversationIdOrderByIdAsc(conversationId));
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("message history", failure);
    }
  }
}
