package com.motherrealm.backend.conversation.controller;

import com.motherrealm.backend.conversation.api.ConversationCreateRequest;
import com.motherrealm.backend.conversation.api.ConversationCreatedResponse;
import com.motherrealm.backend.conversation.api.ConversationSummary;
import com.motherrealm.backend.conversation.api.MessageAppendRequest;
import com.motherrealm.backend.conversation.api.MessageAppendResponse;
import com.motherrealm.backend.conversation.api.MessageResponse;
import com.motherrealm.backend.conversation.service.ConversationService;
import com.motherrealm.backend.conversation.service.MessageLogService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

  private final ConversationService conversationService;
  private final MessageLogService messageLogService;

  public ConversationController(
      ConversationService conversationService, MessageLogService messageLogService) {
    this.conversationService = conversationService;
    this.messageLogService = messageLogService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ConversationCreatedResponse create(@RequestBody @Valid ConversationCreateRequest request) {
    String id =
        conversationService.create(request.initiator(), request.participants(), request.isPrivate());
    return new ConversationCreatedResponse(id);
  }

  @GetMapping("/active")
  public List<ConversationSummary> listActive() {
    return conversationService.listActive();
  }

  @GetMapping("/{conversationId}")
  public ConversationSummary get(@PathVariable String conversationId) {
    return conversationService.get(conversationId);
  }

  @PostMapping("/{conversationId}/end")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void end(@PathVariable String conversationId) {
    conversationService.end(conversationId);
  }

  @PostMapping("/{conversationId}/messages")
  @ResponseStatus(HttpStatus.CREATED)
  public MessageAppendResponse append(
      @PathVariable String conversationId, @RequestBody @Valid MessageAppendRequest request) {
    long id =
        messageLogService.append(
            conversationId, request.sender(), request.content(), request.messageType());
    return new MessageAppendResponse(id);
  }

  @GetMapping("/{conversationId}/messages")
  public List<MessageResponse> history(@PathVariable String conversationId) {
    return messageLogService.history(conversationId).stream().map(MessageResponse::from).toList();
  }
}
