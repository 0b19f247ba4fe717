package com.motherrealm.backend.conversation.service;

import com.motherrealm.backend.common.exception.AlreadyEndedException;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.common.exception.InvalidParticipantsException;
import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.conversation.api.ConversationSummary;
import com.motherrealm.backend.conversation.domain.Conversation;
import com.motherrealm.backend.conversation.persistence.ConversationMessageRepository;
import com.motherrealm.backend.conversation.persistence.ConversationMessageRepository.MessageCount;
import com.motherrealm.backend.conversation.persistence.ConversationRepository;
import com.motherrealm.backend.observer.api.ObserverEvent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Owns the conversation lifecycle. Ending a conversation takes the same row lock as appending a
 * message, so an append can never commit against a conversation that has already ended.
 */
@Service
@Slf4j
public class ConversationService {

  private static final int MIN_PARTICIPANTS = 2;

  private final ConversationRepository conversationRepository;
  private final ConversationMessageRepository messageRepository;
  private final ApplicationEventPublisher eventPublisher;

  public ConversationService(
      ConversationRepository conversationRepository,
      ConversationMessageRepository messageRepository,
      ApplicationEventPublisher eventPublisher) {
    this.conversationRepository = conversationRepository;
    this.messageRepository = messageRepository;
    this.eventPublisher = eventPublisher;
  }

  /** Creates a new active conversation. Repeated calls always create distinct conversations. */
  @Transactional
  public String create(String initiator, List<String> participants, boolean isPrivate) {
    if (!StringUtils.hasText(initiator)) {
      throw new InvalidCommandException("initiator must not be blank");
    }
    List<String> distinct = distinctParticipants(participants);
    if (distinct.size() < MIN_PARTICIPANTS) {
      throw new InvalidParticipantsException(distinct.size());
    }
    Conversation saved;
    try {
      saved = conversationRepository.save(new Conversation(initiator.trim(), distinct, isPrivate));
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("conversation create", failure);
    }
    log.info(
        "Conversation {} created by {} with participants {} (private={})",
        saved.getId(),
        saved.getInitiatorId(),
        distinct,
        isPrivate);
    eventPublisher.publishEvent(
        ObserverEvent.conversationCreated(saved.getId(), distinct, isPrivate));
    return saved.getId();
  }

  /** Ends an active conversation. Ending one twice is rejected with {@link AlreadyEndedException}. */
  @Transactional
  public void end(String conversationId) {
    Conversation conversation;
    try {
      conversation =
          conversationRepository
              .findByIdForUpdate(conversationId)
              .orElseThrow(() -> NotFoundException.conversation(conversationId));
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("conversation end", failure);
    }
    if (!conversation.isActive()) {
      throw new AlreadyEndedException(conversationId);
    }
    conversation.end();
    conversationRepository.save(conversation);
    log.info("Conversation {} ended", conversationId);
    eventPublisher.publishEvent(
        ObserverEvent.conversationEnded(
            conversationId, conversation.getParticipants(), conversation.isPrivate()));
  }

  @Transactional(readOnly = true)
  public List<ConversationSummary> listActive() {
    try {
      List<Conversation> active = conversationRepository.findByActiveTrueOrderByLastActivityAtDesc();
      if (active.isEmpty()) {
        return List.of();
      }
      Map<String, Long> counts =
          messageRepository
              .countByConversationIds(active.stream().map(Conversation::getId).toList())
              .stream()
              .collect(
                  Collectors.toMap(MessageCount::getConversationId, MessageCount::getMessageCount));
      return active.stream()
          .map(
              conversation ->
                  ConversationSummary.from(
                      conversation, counts.getOrDefault(conversation.getId(), 0L)))
          .toList();
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("active conversation lookup", failure);
    }
  }

  /**
   * Active conversations replayed as {@code created} updates, least recently active first, so a
   * newly connected observer can build its view without having seen the original events.
   */
  @Transactional(readOnly = true)
  public List<ObserverEvent> activeSnapshot() {
    List<Conversation> active;
    try {
      active = conversationRepository.findByActiveTrueOrderByLastActivityAtDesc();
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("active conversation lookup", failure);
    }
    List<ObserverEvent> events = new ArrayList<>(active.size());
    for (int i = active.size() - 1; i >= 0; i--) {
      Conversation conversation = active.get(i);
      events.add(
          ObserverEvent.conversationCreated(
              conversation.getId(), conversation.getParticipants(), conversation.isPrivate()));
    }
    return events;
  }

  @Transactional(readOnly = true)
  public ConversationSummary get(String conversationId) {
    Conversation conversation =
        conversationRepository
            .findById(conversationId)
            .orElseThrow(() -> NotFoundException.conversation(conversationId));
    return ConversationSummary.from(
        conversation, messageRepository.countByConversationId(conversationId));
  }

  static List<String> distinctParticipants(List<String> participants) {
    if (participants == null) {
      return List.of();
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String participant : participants) {
      if (StringUtils.hasText(participant)) {
        distinct.add(participant.trim());
      }
    }
    return List.copyOf(new ArrayList<>(distinct));
  }
}
