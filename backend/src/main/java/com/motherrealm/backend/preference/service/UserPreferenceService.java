package com.motherrealm.backend.preference.service;

import com.motherrealm.backend.preference.api.PreferenceUpdateRequest;
import com.motherrealm.backend.preference.domain.SessionPayload;
import com.motherrealm.backend.preference.domain.UserPreference;
import com.motherrealm.backend.preference.persistence.UserPreferenceRepository;
import com.motherrealm.backend.roster.api.AgentView;
import com.motherrealm.backend.roster.service.RosterService;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
public class UserPreferenceService {

  private final UserPreferenceRepository userPreferenceRepository;
  private final RosterService rosterService;

  public UserPreferenceService(
      UserPreferenceRepository userPreferenceRepository, RosterService rosterService) {
    this.userPreferenceRepository = userPreferenceRepository;
    this.rosterService = rosterService;
  }

  @Transactional(readOnly = true)
  public Optional<UserPreference> get(String userId) {
    return userPreferenceRepository.findById(userId);
  }

  @Transactional
  public UserPreference update(String userId, PreferenceUpdateRequest request) {
    UserPreference preference =
        userPreferenceRepository
            .findByUserIdForUpdate(userId)
            .orElseGet(() -> new UserPreference(userId));
    if (request.voiceEnabled() != null) {
      preference.setVoiceEnabled(request.voiceEnabled());
    }
    if (request.preferredAgent() != null) {
      preference.setPreferredAgent(request.preferredAgent().isBlank() ? null : request.preferredAgent());
    }
    if (request.session() != null) {
      preference.setSessionPayload(SessionPayload.from(request.session()));
    }
    UserPreference saved = userPreferenceRepository.saveAndFlush(preference);
    log.debug("Preferences updated for user {}", userId);
    return saved;
  }

  /**
   * Voice output is used when the agent has a voice enabled in the roster, unless the user has
   * stored a preference turning voice off.
   */
  @Transactional(readOnly = true)
  public boolean shouldUseVoiceOutput(String userId, String agentName) {
    boolean agentVoiced = rosterService.find(agentName).map(AgentView::voiceEnabled).orElse(false);
    if (!agentVoiced) {
      return false;
    }
    return userPreferenceRepository
        .findById(userId)
        .map(preference -> !preference.isVoiceExplicitlyDisabled())
        .orElse(true);
  }
}
