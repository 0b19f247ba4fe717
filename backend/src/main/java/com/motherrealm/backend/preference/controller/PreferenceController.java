package com.motherrealm.backend.preference.controller;

import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.preference.api.PreferenceResponse;
import com.motherrealm.backend.preference.api.PreferenceUpdateRequest;
import com.motherrealm.backend.preference.api.VoiceOutputResponse;
import com.motherrealm.backend.preference.service.UserPreferenceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/preferences/{userId}")
public class PreferenceController {

  private final UserPreferenceService userPreferenceService;

  public PreferenceController(UserPreferenceService userPreferenceService) {
    this.userPreferenceService = userPreferenceService;
  }

  @GetMapping
  public PreferenceResponse get(@PathVariable String userId) {
    return userPreferenceService
        .get(userId)
        .map(PreferenceResponse::from)
        .orElseThrow(() -> new NotFoundException("User preferences", userId));
  }

  @PutMapping
  public PreferenceResponse update(
      @PathVariable String userId, @RequestBody @Valid PreferenceUpdateRequest request) {
    return PreferenceResponse.from(userPreferenceService.update(userId, request));
  }

  @GetMapping("/voice-output")
  public VoiceOutputResponse voiceOutput(
      @PathVariable String userId, @RequestParam("agent") String agent) {
    return new VoiceOutputResponse(
        userId, agent, userPreferenceService.shouldUseVoiceOutput(userId, agent));
  }
}
