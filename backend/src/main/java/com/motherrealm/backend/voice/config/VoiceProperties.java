package com.motherrealm.backend.voice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.voice")
public class VoiceProperties {

  /** Voice used for speech output when an agent has no profile of its own. */
  @NotBlank
  private String defaultVoiceId = "v2/en_speaker_6";

  /**
   * Attempts for a voice upsert. Two first-time assignments for the same agent race on the
   * profile key; the loser is retried and then updates the winner's row.
   */
  @Min(1)
  private int upsertAttempts = 3;

  private Duration upsertBackoff = Duration.ofMillis(50);

  public String getDefaultVoiceId() {
    return defaultVoiceId;
  }

  public void setDefaultVoiceId(String defaultVoiceId) {
    this.defaultVoiceId = defaultVoiceId;
  }

  public int getUpsertAttempts() {
    return Math.max(1, upsertAttempts);
  }

  public void setUpsertAttempts(int upsertAttempts) {
    this.upsertAttempts = upsertAttempts;
  }

  public Duration getUpsertBackoff() {
    return upsertBackoff;
  }

  public void setUpsertBackoff(Duration upsertBackoff) {
    if (upsertBackoff != null && !upsertBackoff.isNegative()) {
      this.upsertBackoff = upsertBackoff;
    }
  }
}
