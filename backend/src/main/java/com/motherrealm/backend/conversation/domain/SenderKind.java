package com.motherrealm.backend.conversation.domain;

public enum SenderKind {
  USER,
  AGENT
}
