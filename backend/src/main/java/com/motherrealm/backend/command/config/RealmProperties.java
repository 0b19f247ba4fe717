package com.motherrealm.backend.command.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.realm")
public class RealmProperties {

  /** Prompts starting with this marker are treated as realm commands instead of queries. */
  @NotBlank private String commandPrefix = "MOTHERREALM:";

  public String getCommandPrefix() {
    return commandPrefix;
  }

  public void setCommandPrefix(String commandPrefix) {
    this.commandPrefix = commandPrefix;
  }
}
