package com.motherrealm.backend.voice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import com.motherrealm.backend.common.exception.StoreUnavailableException;
import com.motherrealm.backend.observer.api.ObserverEvent;
import com.motherrealm.backend.roster.domain.AgentWorker;
import com.motherrealm.backend.roster.persistence.AgentWorkerRepository;
import com.motherrealm.backend.roster.service.RosterService;
import com.motherrealm.backend.voice.config.VoiceProperties;
import com.motherrealm.backend.voice.domain.VoiceParameters;
import com.motherrealm.backend.voice.domain.VoiceProfile;
import com.motherrealm.backend.voice.persistence.VoiceProfileRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

@Service
public class VoiceRegistryService {

  private static final Logger log = LoggerFactory.getLogger(VoiceRegistryService.class);
  private static final int MAX_IDENTIFIER_LENGTH = 128;

  private final VoiceProfileRepository voiceProfileRepository;
  private final AgentWorkerRepository agentWorkerRepository;
  private final RosterService rosterService;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionOperations transactionOperations;
  private final RetryTemplate retryTemplate;
  private final VoiceProperties properties;

  public VoiceRegistryService(
      VoiceProfileRepository voiceProfileRepository,
      AgentWorkerRepository agentWorkerRepository,
      RosterService rosterService,
      ApplicationEventPublisher eventPublisher,
      TransactionOperations transactionOperations,
      @Qualifier("voiceUpsertRetryTemplate") RetryTemplate retryTemplate,
      VoiceProperties properties) {
    this.voiceProfileRepository = voiceProfileRepository;
    this.agentWorkerRepository = agentWorkerRepository;
    this.rosterService = rosterService;
    this.eventPublisher = eventPublisher;
    this.transactionOperations = transactionOperations;
    this.retryTemplate = retryTemplate;
    this.properties = properties;
  }

  /**
   * Upserts the agent's voice profile and mirrors the voice into its roster record within one
   * transaction. A {@code voice_update} event is published whether or not the write succeeds;
   * input rejected before the write is only reported to the caller.
   */
  public VoiceAssignment setVoice(String agent, String voiceId, JsonNode params) {
    requireIdentifier("agent", agent);
    requireIdentifier("voiceId", voiceId);
    VoiceParameters parameters;
    try {
      parameters = VoiceParameters.from(params);
    } catch (IllegalArgumentException invalid) {
      throw new InvalidCommandException(invalid.getMessage());
    }

    VoiceAssignment assignment;
    try {
      assignment =
          retryTemplate.execute(
              context ->
                  transactionOperations.execute(status -> upsert(agent, voiceId, parameters)));
    } catch (DataAccessException | TransactionException failure) {
      log.warn("Voice assignment for agent {} failed", agent, failure);
      eventPublisher.publishEvent(
          ObserverEvent.voiceFailed(agent, voiceId, "Voice could not be stored"));
      throw new StoreUnavailableException("voice assignment for " + agent, failure);
    }

    if (assignment.rosterMirrored()) {
      log.info("Voice {} assigned to agent {}", voiceId, agent);
    } else {
      log.info("Voice {} assigned to agent {} without roster record to mirror", voiceId, agent);
    }
    eventPublisher.publishEvent(
        ObserverEvent.voiceUpdated(
            agent, voiceId, parameters.asObjectNode(), assignment.rosterMirrored()));
    return assignment;
  }

  @Transactional(readOnly = true)
  public Optional<VoiceSelection> getVoice(String agent) {
    if (!StringUtils.hasText(agent)) {
      return Optional.empty();
    }
    try {
      return voiceProfileRepository
          .findById(agent)
          .map(
              profile ->
                  new VoiceSelection(
                      profile.getVoiceId(), profile.getParameters().asObjectNode()));
    } catch (DataAccessException failure) {
      throw new StoreUnavailableException("voice lookup for " + agent, failure);
    }
  }

  /** Voice to synthesize the agent's output with; falls back to the default voice. */
  public String resolveVoiceId(String agent) {
    try {
      return getVoice(agent).map(VoiceSelection::voiceId).orElse(properties.getDefaultVoiceId());
    } catch (StoreUnavailableException unavailable) {
      log.warn(
          "Voice lookup for agent {} unavailable, using default voice {}",
          agent,
          properties.getDefaultVoiceId());
      return properties.getDefaultVoiceId();
    }
  }

  private VoiceAssignment upsert(String agent, String voiceId, VoiceParameters parameters) {
    // Roster row first, then profile row: the same lock order for every writer.
    Optional<AgentWorker> rosterRecord = agentWorkerRepository.findByNameForUpdate(agent);
    VoiceProfile profile =
        voiceProfileRepository
            .findByAgentNameForUpdate(agent)
            .orElseGet(() -> new VoiceProfile(agent));
    profile.assign(voiceId, parameters);
    VoiceProfile saved = voiceProfileRepository.saveAndFlush(profile);

    rosterRecord.ifPresent(
        worker -> {
          worker.mirrorVoice(voiceId);
          agentWorkerRepository.save(worker);
        });
    if (rosterRecord.isPresent()) {
      rosterService.publishRosterUpdate();
    }
    return new VoiceAssignment(
        agent, voiceId, saved.getParameters(), rosterRecord.isPresent(), saved.getLastUpdated());
  }

  private static void requireIdentifier(String field, String value) {
    if (!StringUtils.hasText(value)) {
      throw new InvalidCommandException(field + " must not be blank");
    }
    if (value.length() > MAX_IDENTIFIER_LENGTH) {
      throw new InvalidCommandException(
          field + " must not be longer than " + MAX_IDENTIFIER_LENGTH + " characters");
    }
  }
}
