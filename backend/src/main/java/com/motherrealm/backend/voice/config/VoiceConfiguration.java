package com.motherrealm.backend.voice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

@Configuration
@EnableConfigurationProperties(VoiceProperties.class)
public class VoiceConfiguration {

  @Bean(name = "voiceUpsertRetryTemplate")
  public RetryTemplate voiceUpsertRetryTemplate(VoiceProperties properties) {
    return RetryTemplate.builder()
        .maxAttempts(properties.getUpsertAttempts())
        .fixedBackoff(Math.max(1L, properties.getUpsertBackoff().toMillis()))
        .retryOn(DataIntegrityViolationException.class)
        .retryOn(PessimisticLockingFailureException.class)
        .build();
  }
}
