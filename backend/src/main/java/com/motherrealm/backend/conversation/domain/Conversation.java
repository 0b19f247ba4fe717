package com.motherrealm.backend.conversation.domain;

import com.motherrealm.backend.shared.json.IdentifierListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Multi-party session among agents. Participants are fixed at creation and a conversation can only
 * move from active to ended.
 */
@Entity
@Table(name = "conversation")
public class Conversation {

  public static final String ID_PREFIX = "convo_";

  @Id
  @Column(name = "id", nullable = false, length = 64)
  private String id;

  @Column(name = "initiator_id", nullable = false, updatable = false, length = 128)
  private String initiatorId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "participants", nullable = false, updatable = false)
  @Convert(converter = IdentifierListJsonConverter.class)
  private List<String> participants = List.of();

  @Column(name = "is_private", nullable = false, updatable = false)
  private boolean privateConversation;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_activity_at", nullable = false)
  private Instant lastActivityAt;

  @Column(name = "ended_at")
  private Instant endedAt;

  protected Conversation() {}

  public Conversation(String initiatorId, List<String> participants, boolean privateConversation) {
    this.id = ID_PREFIX + UUID.randomUUID();
    this.initiatorId = initiatorId;
    this.participants = List.copyOf(participants);
    this.privateConversation = privateConversation;
    this.active = true;
  }

  @PrePersist
  void onCreate() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (lastActivityAt == null) {
      lastActivityAt = now;
    }
  }

  public void touch(Instant at) {
    if (lastActivityAt == null || at.isAfter(lastActivityAt)) {
      lastActivityAt = at;
    }
  }

  public void end() {
    if (!active) {
      throw new IllegalStateException("Conversation " + id + " already ended");
    }
    active = false;
    endedAt = Instant.now();
  }

  public boolean involves(String identity) {
    return participants.contains(identity);
  }

  public String getId() {
    return id;
  }

  public String getInitiatorId() {
    return initiatorId;
  }

  public List<String> getParticipants() {
    return participants;
  }

  public boolean isPrivate() {
    return privateConversation;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }

  public Instant getEndedAt() {
    return endedAt;
  }
}
