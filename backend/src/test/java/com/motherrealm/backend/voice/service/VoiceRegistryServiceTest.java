package com.motherrealm.backend.voice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.api.ObserverEventType;
import com.motherrealm.backend.roster.persistence.AgentWorkerRepository;
import com.motherrealm.backend.roster.service.RosterService;
import com.motherrealm.backend.voice.config.VoiceConfiguration;
import com.motherrealm.backend.voice.config.VoiceProperties;
import com.motherrealm.backend.voice.domain.VoiceProfile;
import com.motherrealm.backend.voice.persistence.VoiceProfileRepository;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class VoiceRegistryServiceTest {

  @Mock private VoiceProfileRepository voiceProfileRepository;

  @Mock private AgentWorkerRepository agentWorkerRepository;

  @Mock private RosterService rosterService;

  @Mock private ApplicationEventPublisher eventPublisher;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private VoiceRegistryService service;

  @BeforeEach
  void setUp() {
    VoiceProperties properties = new VoiceProperties();
    properties.setUpsertAttempts(2);
    properties.setUpsertBackoff(Duration.ofMillis(1));
    service =
        new VoiceRegistryService(
            voiceProfileRepository,
            agentWorkerRepository,
            rosterService,
            eventPublisher,
            TransactionOperations.withoutTransaction(),
            new VoiceConfiguration().voiceUpsertRetryTemplate(properties),
            properties);
  }

  @Test
  void storeFailureIsBroadcastAsFailedVoiceUpdate() {
    when(agentWorkerRepository.findByNameForUpdate("agentA"))
        .thenThrow(new DataAccessResourceFailureException("database down"));

    assertThatThrownBy(() -> service.setVoice("agentA", "v2/en_speaker_4", null))
        .isInstanceOf(StoreUnavailableException.class);

    ArgumentCaptor<ObserverEvent> events = ArgumentCaptor.forClass(ObserverEvent.class);
    verify(eventPublisher).publishEvent(events.capture());
    ObserverEvent failure = events.getValue();
    assertThat(failure.type()).isEqualTo(ObserverEventType.VOICE_UPDATE);
    assertThat(failure.success()).isFalse();
    assertThat(failure.agent()).isEqualTo("agentA");
    assertThat(failure.voiceId()).isEqualTo("v2/en_speaker_4");
    assertThat(failure.error()).isNotBlank();
  }

  @Test
  void conflictingFirstInsertIsRetried() {
    when(agentWorkerRepository.findByNameForUpdate("agentA")).thenReturn(Optional.empty());
    when(voiceProfileRepository.findByAgentNameForUpdate("agentA")).thenReturn(Optional.empty());
    when(voiceProfileRepository.saveAndFlush(any(VoiceProfile.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate key"))
        .thenAnswer(invocation -> invocation.getArgument(0));

    VoiceAssignment assignment = service.setVoice("agentA", "v2/en_speaker_4", null);

    assertThat(assignment.voiceId()).isEqualTo("v2/en_speaker_4");
    assertThat(assignment.rosterMirrored()).isFalse();
    verify(voiceProfileRepository, times(2)).saveAndFlush(any(VoiceProfile.class));
    verify(rosterService, never()).publishRosterUpdate();
  }

  @Test
  void nonObjectParamsAreRejected() throws Exception {
    assertThatThrownBy(
            () -> service.setVoice("agentA", "v2/en_speaker_4", objectMapper.readTree("[1,2]")))
        .isInstanceOf(InvalidCommandException.class);
    verifyNoInteractions(voiceProfileRepository, eventPublisher);
  }

  @Test
  void rejectedIdentifiersAreNotBroadcast() {
    assertThatThrownBy(() -> service.setVoice("agentA", " ", null))
        .isInstanceOf(InvalidCommandException.class);
    assertThatThrownBy(() -> service.setVoice("a".repeat(300), "v2/en_speaker_4", null))
        .isInstanceOf(InvalidCommandException.class);
    verifyNoInteractions(voiceProfileRepository, eventPublisher);
  }

  @Test
  void resolveVoiceIdFallsBackWhenStoreIsUnavailable() {
    when(voiceProfileRepository.findById("agentA"))
        .thenThrow(new DataAccessResourceFailureException("database down"));

    assertThat(service.resolveVoiceId("agentA")).isEqualTo("v2/en_speaker_6");
  }
}
