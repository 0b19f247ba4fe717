package com.motherrealm.backend.context.domain;

import com.motherrealm.backend.context.domain.converter.ContextPayloadConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Immutable
@Table(name = "context_entry")
public class ContextEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false, length = 128)
  private String userId;

  @Column(name = "agent_name", nullable = false, updatable = false, length = 128)
  private String agentName;

  @Column(name = "query", columnDefinition = "TEXT", updatable = false)
  private String query;

  @Column(name = "response", columnDefinition = "TEXT", updatable = false)
  private String response;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context_data", updatable = false)
  @Convert(converter = ContextPayloadConverter.class)
  private ContextPayload payload = ContextPayload.empty();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ContextEntry() {}

  public ContextEntry(
      String userId, String agentName, String query, String response, ContextPayload payload) {
    this.userId = userId;
    this.agentName = agentName;
    this.query = query != null ? query : "";
    this.response = response != null ? response : "";
    this.payload = payload != null ? payload : ContextPayload.empty();
  }

  @PrePersist
  protected void onPersist() {
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public String getAgentName() {
    return agentName;
  }

  public String getQuery() {
    return query;
  }

  public String getResponse() {
    return response;
  }

  public ContextPayload getPayload() {
    return payload != null ? payload : ContextPayload.empty();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
