package com.motherrealm.backend.conversation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "conversation_message")
public class ConversationMessage {

  public static final String DEFAULT_TYPE = "text";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
  private Conversation conversation;

  @Column(name = "sender", nullable = false, updatable = false, length = 128)
  private String sender;

  @Enumerated(EnumType.STRING)
  @Column(name = "sender_kind", nullable = false, updatable = false, length = 16)
  private SenderKind senderKind;

  @Column(name = "content", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "message_type", nullable = false, updatable = false, length = 64)
  private String messageType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ConversationMessage() {}

  public ConversationMessage(
      Conversation conversation,
      String sender,
      SenderKind senderKind,
      String content,
      String messageType) {
    this.conversation = conversation;
    this.sender = sender;
    this.senderKind = senderKind;
    this.content = content != null ? content : "";
    this.messageType = messageType != null && !messageType.isBlank() ? messageType : DEFAULT_TYPE;
  }

  @PrePersist
  void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public String getSender() {
    return sender;
  }

  public SenderKind getSenderKind() {
    return senderKind;
  }

  public String getContent() {
    return content;
  }

  public String getMessageType() {
    return messageType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
