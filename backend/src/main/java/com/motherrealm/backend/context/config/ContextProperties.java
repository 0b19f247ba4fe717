package com.motherrealm.backend.context.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.context")
public class ContextProperties {

  /** Entries returned by a recent-history lookup when the caller does not ask for a size. */
  @Min(1)
  private int defaultLimit = 5;

  /** Upper bound for a single lookup regardless of the requested size. */
  @Min(1)
  private int maxLimit = 50;

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public int getMaxLimit() {
    return Math.max(maxLimit, defaultLimit);
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  /** Default for a missing size, otherwise the requested size capped at the max. */
  public int resolveLimit(Integer requested) {
    if (requested == null) {
      return defaultLimit;
    }
    return Math.min(Math.max(requested, 0), getMaxLimit());
  }
}
