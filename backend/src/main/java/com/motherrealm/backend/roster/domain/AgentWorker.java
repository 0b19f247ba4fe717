package com.motherrealm.backend.roster.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "agent_worker")
public class AgentWorker {

  @Id
  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "address", length = 512)
  private String address;

  @Column(name = "type", length = 64)
  private String type;

  @Column(name = "voice_id", length = 128)
  private String voiceId;

  @Column(name = "voice_enabled", nullable = false)
  private boolean voiceEnabled;

  @Column(name = "blacklisted", nullable = false)
  private boolean blacklisted;

  @Column(name = "registered_at", nullable = false, updatable = false)
  private Instant registeredAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected AgentWorker() {}

  public AgentWorker(String name, String address, String type) {
    this.name = name;
    this.address = address;
    this.type = type;
  }

  @PrePersist
  protected void onPersist() {
    Instant now = Instant.now();
    this.registeredAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public String getName() {
    return name;
  }

  public String getAddress() {
    return address;
  }

  public String getType() {
    return type;
  }

  public String getVoiceId() {
    return voiceId;
  }

  public boolean isVoiceEnabled() {
    return voiceEnabled;
  }

  public boolean isBlacklisted() {
    return blacklisted;
  }

  public Instant getRegisteredAt() {
    return registeredAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateEndpoint(String address, String type) {
    this.address = address;
    this.type = type;
    this.blacklisted = false;
  }

  public void blacklist() {
    this.blacklisted = true;
  }

  /** Mirrors an assigned voice into the roster; always enables voice output for the agent. */
  public void mirrorVoice(String voiceId) {
    this.voiceId = voiceId;
    this.voiceEnabled = true;
  }
}
