package com.motherrealm.backend.voice.controller;

import com.motherrealm.backend.common.exception.NotFoundException;
import com.motherrealm.backend.voice.api.VoiceAssignmentRequest;
import com.motherrealm.backend.voice.api.VoiceAssignmentResponse;
import com.motherrealm.backend.voice.api.VoiceResponse;
import com.motherrealm.backend.voice.service.VoiceRegistryService;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/voices")
@Validated
public class VoiceController {

  private final VoiceRegistryService voiceRegistryService;

  public VoiceController(VoiceRegistryService voiceRegistryService) {
    this.voiceRegistryService = voiceRegistryService;
  }

  @PutMapping("/{agent}")
  public VoiceAssignmentResponse assign(
      @PathVariable String agent, @RequestBody @Valid VoiceAssignmentRequest request) {
    return VoiceAssignmentResponse.from(
        voiceRegistryService.setVoice(agent, request.voiceId(), request.params()));
  }

  @GetMapping("/{agent}")
  public VoiceResponse get(@PathVariable String agent) {
    return voiceRegistryService
        .getVoice(agent)
        .map(selection -> new VoiceResponse(agent, selection.voiceId(), selection.params()))
        .orElseThrow(() -> new NotFoundException("Voice profile", agent));
  }

  /** Voice used for speech output, falling back to the configured default voice. */
  @GetMapping("/{agent}/effective")
  public VoiceResponse effective(@PathVariable String agent) {
    return new VoiceResponse(agent, voiceRegistryService.resolveVoiceId(agent), null);
  }
}
