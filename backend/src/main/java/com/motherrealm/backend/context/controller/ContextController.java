package com.motherrealm.backend.context.controller;

import com.motherrealm.backend.context.api.ContextAppendRequest;
import com.motherrealm.backend.context.api.ContextAppendResponse;
import com.motherrealm.backend.context.api.ContextEntryResponse;
import com.motherrealm.backend.context.api.PromptEnrichmentRequest;
import com.motherrealm.backend.context.api.PromptEnrichmentResponse;
import com.motherrealm.backend.context.service.ContextPromptService;
import com.motherrealm.backend.context.service.ContextPromptService.EnrichedPrompt;
import com.motherrealm.backend.context.service.ContextStoreService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/context/{userId}/{agent}")
@Validated
public class ContextController {

  private final ContextStoreService contextStoreService;
  private final ContextPromptService contextPromptService;

  public ContextController(
      ContextStoreService contextStoreService, ContextPromptService contextPromptService) {
    this.contextStoreService = contextStoreService;
    this.contextPromptService = contextPromptService;
  }

  @PostMapping("/entries")
  @ResponseStatus(HttpStatus.CREATED)
  public ContextAppendResponse append(
      @PathVariable String userId,
      @PathVariable String agent,
      @RequestBody ContextAppendRequest request) {
    long id =
        contextStoreService.append(
            userId, agent, request.query(), request.response(), request.context());
    return new ContextAppendResponse(id);
  }

  @GetMapping("/entries")
  public List<ContextEntryResponse> recent(
      @PathVariable String userId,
      @PathVariable String agent,
      @RequestParam(name = "limit", required = false) Integer limit) {
    return contextStoreService.recent(userId, agent, limit).stream()
        .map(ContextEntryResponse::from)
        .toList();
  }

  @GetMapping(value = "/transcript", produces = MediaType.TEXT_PLAIN_VALUE)
  public String transcript(
      @PathVariable String userId,
      @PathVariable String agent,
      @RequestParam(name = "limit", required = false) Integer limit) {
    return contextPromptService.transcript(userId, agent, limit);
  }

  @PostMapping("/prompt")
  public PromptEnrichmentResponse enrich(
      @PathVariable String userId,
      @PathVariable String agent,
      @RequestBody @Valid PromptEnrichmentRequest request) {
    EnrichedPrompt enriched = contextPromptService.enrich(userId, agent, request.prompt());
    return new PromptEnrichmentResponse(enriched.prompt(), enriched.historySize());
  }
}
