package com.motherrealm.backend.command.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.motherrealm.backend.common.exception.ErrorCode;

/**
 * Direct answer to the socket that issued a command. State changes themselves reach every observer
 * through the broadcaster; replies only acknowledge or reject.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandReply(
    String type,
    String command,
    @JsonProperty("conversation_id") String conversationId,
    Long messageId,
    Boolean rosterMirrored,
    ErrorCode code,
    String message) {

  public static final String TYPE_ACK = "command_ack";
  public static final String TYPE_ERROR = "error";

  public static CommandReply conversationAck(String command, String conversationId) {
    return new CommandReply(TYPE_ACK, command, conversationId, null, null, null, null);
  }

  public static CommandReply messageAck(String command, String conversationId, long messageId) {
    return new CommandReply(TYPE_ACK, command, conversationId, messageId, null, null, null);
  }

  public static CommandReply voiceAck(String command, boolean rosterMirrored) {
    return new CommandReply(TYPE_ACK, command, null, null, rosterMirrored, null, null);
  }

  public static CommandReply error(String command, ErrorCode code, String message) {
    return new CommandReply(TYPE_ERROR, command, null, null, null, code, message);
  }
}
