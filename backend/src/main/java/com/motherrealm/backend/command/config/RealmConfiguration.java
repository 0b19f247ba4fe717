package com.motherrealm.backend.command.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RealmProperties.class)
public class RealmConfiguration {}
