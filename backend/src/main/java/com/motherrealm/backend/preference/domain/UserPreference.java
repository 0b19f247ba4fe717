package com.motherrealm.backend.preference.domain;

import com.motherrealm.backend.preference.domain.converter.SessionPayloadConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "user_preference")
public class UserPreference {

  @Id
  @Column(name = "user_id", nullable = false, length = 128)
  private String userId;

  /** Null until the user states a preference. */
  @Column(name = "voice_enabled")
  private Boolean voiceEnabled;

  @Column(name = "preferred_agent", length = 128)
  private String preferredAgent;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "session_data")
  @Convert(converter = SessionPayloadConverter.class)
  private SessionPayload sessionPayload = SessionPayload.empty();

  @Column(name = "last_updated", nullable = false)
  private Instant lastUpdated;

  protected UserPreference() {}

  public UserPreference(String userId) {
    this.userId = userId;
  }

  @PrePersist
  @PreUpdate
  protected void touch() {
    this.lastUpdated = Instant.now();
  }

  public String getUserId() {
    return userId;
  }

  public Boolean getVoiceEnabled() {
    return voiceEnabled;
  }

  public boolean isVoiceExplicitlyDisabled() {
    return Boolean.FALSE.equals(voiceEnabled);
  }

  public void setVoiceEnabled(Boolean voiceEnabled) {
    this.voiceEnabled = voiceEnabled;
  }

  public String getPreferredAgent() {
    return preferredAgent;
  }

  public void setPreferredAgent(String preferredAgent) {
    this.preferredAgent = preferredAgent;
  }

  public SessionPayload getSessionPayload() {
    return sessionPayload != null ? sessionPayload : SessionPayload.empty();
  }

  public void setSessionPayload(SessionPayload sessionPayload) {
    this.sessionPayload = sessionPayload != null ? sessionPayload : SessionPayload.empty();
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }
}
