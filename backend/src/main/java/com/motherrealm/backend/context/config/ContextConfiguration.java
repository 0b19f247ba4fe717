package com.motherrealm.backend.context.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ContextProperties.class)
public class ContextConfiguration {}
