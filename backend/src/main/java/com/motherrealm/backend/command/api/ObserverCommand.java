package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Inbound frame sent by an observer client, discriminated by its {@code type} field. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = CreateConversationCommand.class, name = ObserverCommand.CREATE_CONVERSATION),
  @JsonSubTypes.Type(value = EndConversationCommand.class, name = ObserverCommand.END_CONVERSATION),
  @JsonSubTypes.Type(value = SetVoiceCommand.class, name = ObserverCommand.SET_VOICE),
  @JsonSubTypes.Type(value = SendMessageCommand.class, name = ObserverCommand.SEND_MESSAGE),
  @JsonSubTypes.Type(value = RealmPromptCommand.class, name = ObserverCommand.REALM_COMMAND)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ObserverCommand {

  String CREATE_CONVERSATION = "create_conversation";
  String END_CONVERSATION = "end_conversation";
  String SET_VOICE = "set_voice";
  String SEND_MESSAGE = "send_message";
  String REALM_COMMAND = "realm_command";

  String commandType();
}
