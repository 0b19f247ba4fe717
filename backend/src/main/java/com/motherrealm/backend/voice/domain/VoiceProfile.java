package com.motherrealm.backend.voice.domain;

import com.motherrealm.backend.voice.domain.converter.VoiceParametersConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "voice_profile")
public class VoiceProfile {

  @Id
  @Column(name = "agent_name", nullable = false, length = 128)
  private String agentName;

  @Column(name = "voice_id", nullable = false, length = 128)
  private String voiceId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "voice_params")
  @Convert(converter = VoiceParametersConverter.class)
  private VoiceParameters parameters = VoiceParameters.empty();

  @Column(name = "last_updated", nullable = false)
  private Instant lastUpdated;

  protected VoiceProfile() {}

  public VoiceProfile(String agentName) {
    this.agentName = agentName;
  }

  public String getAgentName() {
    return agentName;
  }

  public String getVoiceId() {
    return voiceId;
  }

  public VoiceParameters getParameters() {
    return parameters != null ? parameters : VoiceParameters.empty();
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }

  /** Replaces voice and parameters wholesale; previous parameters are not merged. */
  public void assign(String voiceId, VoiceParameters parameters) {
    this.voiceId = voiceId;
    this.parameters = parameters != null ? parameters : VoiceParameters.empty();
    this.lastUpdated = Instant.now();
  }
}
