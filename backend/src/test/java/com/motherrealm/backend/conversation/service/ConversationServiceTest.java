package com.motherrealm.backend.conversation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.motherrealm.backend.common.exception.AlreadyEndedException;
import com.motherrealm.backend.common.exception.ErrorCode;
import com.motherrealm.backend.common.exception.InvalidParticipantsException;
import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.conversation.domain.Conversation;
import com.motherrealm.backend.conversation.persistence.ConversationMessageRepository;
import com.motherrealm.backend.conversation.persistence.ConversationRepository;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.api.ObserverEventType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

  @Mock private ConversationRepository conversationRepository;

  @Mock private ConversationMessageRepository messageRepository;

  @Mock private ApplicationEventPublisher eventPublisher;

  private ConversationService service;

  @BeforeEach
  void setUp() {
    service = new ConversationService(conversationRepository, messageRepository, eventPublisher);
  }

  @Test
  void createRejectsFewerThanTwoDistinctParticipants() {
    assertThatThrownBy(() -> service.create("user-1", List.of("agentA", "agentA", " "), false))
        .isInstanceOf(InvalidParticipantsException.class)
        .satisfies(
            ex -> {
              InvalidParticipantsException invalid = (InvalidParticipantsException) ex;
              assertThat(invalid.getErrorCode()).isEqualTo(ErrorCode.INVALID_PARTICIPANTS);
              assertThat(invalid.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            });
    assertThatThrownBy(() -> service.create("user-1", null, false))
        .isInstanceOf(InvalidParticipantsException.class);
    verify(conversationRepository, never()).save(any());
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void createPersistsActiveConversationAndAnnouncesIt() {
    when(conversationRepository.save(any(Conversation.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    String id = service.create("user-1", List.of("agentA", "agentB", "agentA"), true);

    assertThat(id).startsWith(Conversation.ID_PREFIX);
    ArgumentCaptor<Conversation> saved = ArgumentCaptor.forClass(Conversation.class);
    verify(conversationRepository).save(saved.capture());
    assertThat(saved.getValue().isActive()).isTrue();
    assertThat(saved.getValue().isPrivate()).isTrue();
    assertThat(saved.getValue().getParticipants()).containsExactly("agentA", "agentB");

    ArgumentCaptor<ObserverEvent> event = ArgumentCaptor.forClass(ObserverEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().type()).isEqualTo(ObserverEventType.CONVERSATION_UPDATE);
    assertThat(event.getValue().status()).isEqualTo(ObserverEvent.STATUS_CREATED);
    assertThat(event.getValue().conversationId()).isEqualTo(id);
    assertThat(event.getValue().participants()).containsExactly("agentA", "agentB");
  }

  @Test
  void repeatedCreateProducesDistinctIds() {
    when(conversationRepository.save(any(Conversation.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    String first = service.create("user-1", List.of("agentA", "agentB"), false);
    String second = service.create("user-1", List.of("agentA", "agentB"), false);

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void activeSnapshotReplaysCreatedUpdatesLeastRecentlyActiveFirst() {
    Conversation busy = new Conversation("user-1", List.of("agentA", "agentB"), true);
    Conversation quiet = new Conversation("user-2", List.of("agentB", "agentC"), false);
    when(conversationRepository.findByActiveTrueOrderByLastActivityAtDesc())
        .thenReturn(List.of(busy, quiet));

    List<ObserverEvent> snapshot = service.activeSnapshot();

    assertThat(snapshot)
        .extracting(ObserverEvent::conversationId)
        .containsExactly(quiet.getId(), busy.getId());
    assertThat(snapshot)
        .allSatisfy(event -> assertThat(event.status()).isEqualTo(ObserverEvent.STATUS_CREATED));
    assertThat(snapshot.get(1).isPrivate()).isTrue();
    assertThat(snapshot.get(1).participants()).containsExactly("agentA", "agentB");
  }

  @Test
  void endUnknownConversationIsNotFound() {
    when(conversationRepository.findByIdForUpdate("convo_missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.end("convo_missing")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void endingTwiceIsRejected() {
    Conversation conversation = new Conversation("user-1", List.of("agentA", "agentB"), false);
    when(conversationRepository.findByIdForUpdate(conversation.getId()))
        .thenReturn(Optional.of(conversation));

    service.end(conversation.getId());

    assertThat(conversation.isActive()).isFalse();
    assertThat(conversation.getEndedAt()).isNotNull();
    assertThatThrownBy(() -> service.end(conversation.getId()))
        .isInstanceOf(AlreadyEndedException.class);

    ArgumentCaptor<ObserverEvent> event = ArgumentCaptor.forClass(ObserverEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().isConversationEnded()).isTrue();
  }
}
