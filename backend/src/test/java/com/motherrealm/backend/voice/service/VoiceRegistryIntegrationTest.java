package com.motherrealm.backend.voice.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.observer.api.ObserverEventType;
import com.motherrealm.backend.observer.service.ObserverEventBroadcaster;
import com.motherrealm.backend.roster.api.AgentView;
import com.motherrealm.backend.roster.service.RosterService;
import com.motherrealm.backend.support.DatabaseIntegrationTest;
import com.motherrealm.backend.support.RecordingObserverChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class VoiceRegistryIntegrationTest extends DatabaseIntegrationTest {

  @Autowired private VoiceRegistryService voiceRegistryService;

  @Autowired private RosterService rosterService;

  @Autowired private ObserverEventBroadcaster broadcaster;

  @Autowired private ObjectMapper objectMapper;

  private RecordingObserverChannel observer;

  @AfterEach
  void unsubscribe() {
    if (observer != null) {
      broadcaster.unsubscribe(observer.id());
    }
  }

  @Test
  void voiceWithoutParamsRoundTripsAsEmptyObject() {
    voiceRegistryService.setVoice("agentA", "v2/en_speaker_4", null);

    VoiceSelection selection = voiceRegistryService.getVoice("agentA").orElseThrow();

    assertThat(selection.voiceId()).isEqualTo("v2/en_speaker_4");
    assertThat(selection.params().isEmpty()).isTrue();
  }

  @Test
  void laterAssignmentReplacesParamsWithoutMerging() throws Exception {
    voiceRegistryService.setVoice(
        "agentA", "v2/en_speaker_1", objectMapper.readTree("{\"speed\":1.1,\"pitch\":3}"));
    voiceRegistryService.setVoice(
        "agentA", "v2/en_speaker_2", objectMapper.readTree("{\"speed\":0.9}"));

    VoiceSelection selection = voiceRegistryService.getVoice("agentA").orElseThrow();

    assertThat(selection.voiceId()).isEqualTo("v2/en_speaker_2");
    assertThat(selection.params()).isEqualTo(objectMapper.readTree("{\"speed\":0.9}"));
  }

  @Test
  void unknownAgentHasNoVoiceAndResolvesToDefault() {
    assertThat(voiceRegistryService.getVoice("nobody")).isEmpty();
    assertThat(voiceRegistryService.resolveVoiceId("nobody")).isEqualTo("v2/en_speaker_6");
  }

  @Test
  void assignmentMirrorsIntoRosterRecord() throws Exception {
    rosterService.register("agentA", "http://agent-a:8000", "llm");
    observer = new RecordingObserverChannel();
    broadcaster.subscribe(observer);

    VoiceAssignment assignment = voiceRegistryService.setVoice("agentA", "v2/en_speaker_3", null);

    assertThat(assignment.rosterMirrored()).isTrue();
    AgentView agent = rosterService.find("agentA").orElseThrow();
    assertThat(agent.voiceId()).isEqualTo("v2/en_speaker_3");
    assertThat(agent.voiceEnabled()).isTrue();

    ObserverEvent update =
        observer.await(event -> event.type() == ObserverEventType.VOICE_UPDATE, Duration.ofSeconds(5));
    assertThat(update.success()).isTrue();
    assertThat(update.rosterMirrored()).isTrue();
    assertThat(update.voiceId()).isEqualTo("v2/en_speaker_3");
    observer.await(
        event ->
            event.type() == ObserverEventType.ROSTER_UPDATE
                && event.agents().stream().anyMatch(view -> "v2/en_speaker_3".equals(view.voiceId())),
        Duration.ofSeconds(5));
  }

  @Test
  void assignmentWithoutRosterRecordReportsMissingMirror() throws Exception {
    observer = new RecordingObserverChannel();
    broadcaster.subscribe(observer);

    VoiceAssignment assignment = voiceRegistryService.setVoice("ghost", "v2/en_speaker_5", null);

    assertThat(assignment.rosterMirrored()).isFalse();
    assertThat(voiceRegistryService.getVoice("ghost")).isPresent();
    assertThat(rosterService.find("ghost")).isEmpty();
    ObserverEvent update =
        observer.await(event -> event.type() == ObserverEventType.VOICE_UPDATE, Duration.ofSeconds(5));
    assertThat(update.success()).isTrue();
    assertThat(update.rosterMirrored()).isFalse();
  }

  @Test
  void concurrentAssignmentsLeaveProfileAndRosterConsistent() throws Exception {
    rosterService.register("agentA", "http://agent-a:8000", "llm");
    int writers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<VoiceAssignment>> results = new ArrayList<>();
    try {
      for (int i = 0; i < writers; i++) {
        String voiceId = "v2/en_speaker_" + i;
        Callable<VoiceAssignment> task =
            () -> {
              start.await();
              return voiceRegistryService.setVoice("agentA", voiceId, null);
            };
        results.add(pool.submit(task));
      }
      start.countDown();
      for (Future<VoiceAssignment> result : results) {
        assertThat(result.get(30, TimeUnit.SECONDS).rosterMirrored()).isTrue();
      }
    } finally {
      pool.shutdownNow();
    }

    String profileVoice = voiceRegistryService.getVoice("agentA").orElseThrow().voiceId();
    assertThat(rosterService.find("agentA").orElseThrow().voiceId()).isEqualTo(profileVoice);
  }
}
